package com.example.comicshelf.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateGroupResponse {

    private String fileHash;
    private int count;

    /**
     * Space taken by the copies beyond the first, human readable.
     */
    private String reclaimableSize;

    private List<DuplicateComicResponse> comics;
}
