package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesRenameResponse {

    /**
     * Id of the series that holds the comics afterwards. Differs from the request id after a merge.
     */
    private Long seriesId;
    private String name;
    private boolean merged;
}
