package com.example.comicshelf.api.request;

import com.example.comicshelf.domain.enumtype.ScanType;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateScanJobRequest {

    @NotNull
    private ScanType scanType;
}
