package com.example.comicshelf.application.job;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.comicshelf.application.service.ScanJobService;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.enumtype.ScanType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class IncrementalScanJobTest {

    @Test
    void shouldSkipWhenDisabled() {
        AppScanProperties properties = new AppScanProperties();
        properties.setIncrementalEnabled(false);
        ScanJobService scanJobService = mock(ScanJobService.class);

        new IncrementalScanJob(properties, scanJobService).run();

        verifyNoInteractions(scanJobService);
    }

    @Test
    void shouldStartIncrementalScanAndTolerateActiveJob() {
        AppScanProperties properties = new AppScanProperties();
        properties.setIncrementalEnabled(true);
        ScanJobService scanJobService = mock(ScanJobService.class);
        when(scanJobService.startScan(any(ScanType.class)))
                .thenThrow(new BusinessException("409", "已有扫描任务运行中"));

        Assertions.assertDoesNotThrow(() -> new IncrementalScanJob(properties, scanJobService).run());
        verify(scanJobService).startScan(ScanType.INCREMENTAL);
    }
}
