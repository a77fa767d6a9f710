package com.example.comicshelf.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GapReportResponse {

    private String series;

    /**
     * chapter or volume.
     */
    private String type;

    private List<Integer> gaps;
    private int count;
}
