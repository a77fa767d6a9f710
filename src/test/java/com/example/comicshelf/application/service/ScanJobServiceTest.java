package com.example.comicshelf.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.comicshelf.api.response.ScanJobDetailResponse;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.common.exception.LibraryAccessException;
import com.example.comicshelf.domain.enumtype.ScanType;
import com.example.comicshelf.infrastructure.persistence.entity.ScanJobEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.ScanJobMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

class ScanJobServiceTest {

    private ScanJobMapper scanJobMapper;
    private ComicMapper comicMapper;
    private SeriesMapper seriesMapper;
    private LibrarySyncService librarySyncService;
    private ComicProcessingService comicProcessingService;
    private SeriesSearchService seriesSearchService;
    private TagMetadataCache tagMetadataCache;
    private ExecutorService executor;
    private ScanJobService service;

    @BeforeEach
    void setUp() {
        scanJobMapper = mock(ScanJobMapper.class);
        comicMapper = mock(ComicMapper.class);
        seriesMapper = mock(SeriesMapper.class);
        librarySyncService = mock(LibrarySyncService.class);
        comicProcessingService = mock(ComicProcessingService.class);
        seriesSearchService = mock(SeriesSearchService.class);
        tagMetadataCache = mock(TagMetadataCache.class);
        executor = mock(ExecutorService.class);
        service = new ScanJobService(scanJobMapper, comicMapper, seriesMapper, librarySyncService,
                comicProcessingService, seriesSearchService, tagMetadataCache, executor, new AppScanProperties(),
                new ObjectMapper());
    }

    @Test
    void shouldRejectSecondScanWithoutTouchingTheLibrary() {
        when(scanJobMapper.countRunning()).thenReturn(1);

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> service.startScan(ScanType.RESCAN));

        Assertions.assertEquals("409", ex.getCode());
        verify(scanJobMapper, never()).insertRunning(any(ScanJobEntity.class));
        verifyNoInteractions(executor, comicMapper, seriesMapper, seriesSearchService);
    }

    @Test
    void shouldMapLostInsertRaceToConflict() {
        when(scanJobMapper.insertRunning(any(ScanJobEntity.class)))
                .thenThrow(new DuplicateKeyException("Duplicate entry '1' for key 'uk_scan_job_running'"));

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> service.startScan(ScanType.FULL));

        Assertions.assertEquals("409", ex.getCode());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldCreateRunningJobAndSubmitIt() {
        assignIdOnInsert(7L);
        ScanJobEntity stored = new ScanJobEntity();
        stored.setId(7L);
        stored.setScanType("FULL");
        stored.setStatus("running");
        stored.setPhase(ScanJobProgress.PHASE_QUEUED);
        when(scanJobMapper.selectById(7L)).thenReturn(stored);

        ScanJobDetailResponse response = service.startScan(ScanType.FULL);

        Assertions.assertEquals(Long.valueOf(7L), response.getJobId());
        Assertions.assertEquals("running", response.getStatus());
        Assertions.assertTrue(response.getErrors().isEmpty());
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void shouldFailJobWhenExecutorRejects() {
        assignIdOnInsert(8L);
        when(executor.submit(any(Runnable.class))).thenThrow(new RejectedExecutionException("queue full"));

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> service.startScan(ScanType.FULL));

        Assertions.assertEquals("TASK_EXECUTOR_REJECTED", ex.getCode());
        verify(scanJobMapper).markFinished(eq(8L), eq("failed"), startsWith("任务调度失败"));
    }

    @Test
    void shouldRunBothPhasesAndComplete() {
        when(librarySyncService.sync(any(), any(), any())).thenReturn(new LibrarySyncService.SyncStats());
        when(comicProcessingService.process(any(), any(), any())).thenReturn(new ComicProcessingService.ProcessingStats());

        service.runJob(3L, ScanType.FULL);

        verify(comicMapper).resetEmptyProcessed();
        verify(comicMapper, never()).deleteAll();
        verify(scanJobMapper).markFinished(eq(3L), eq("completed"), isNull());
    }

    @Test
    void shouldWipeLibraryBeforeRescan() {
        when(librarySyncService.sync(any(), any(), any())).thenReturn(new LibrarySyncService.SyncStats());
        when(comicProcessingService.process(any(), any(), any())).thenReturn(new ComicProcessingService.ProcessingStats());

        service.runJob(4L, ScanType.RESCAN);

        verify(comicMapper).deleteAll();
        verify(seriesMapper).deleteAll();
        verify(seriesSearchService).clear();
        verify(tagMetadataCache).invalidate();
        verify(scanJobMapper).markFinished(eq(4L), eq("completed"), isNull());
    }

    @Test
    void shouldNotRequeueEmptyComicsOnIncrementalScan() {
        when(librarySyncService.sync(any(), any(), any())).thenReturn(new LibrarySyncService.SyncStats());
        when(comicProcessingService.process(any(), any(), any())).thenReturn(new ComicProcessingService.ProcessingStats());

        service.runJob(5L, ScanType.INCREMENTAL);

        verify(comicMapper, never()).resetEmptyProcessed();
    }

    @Test
    void shouldStopAfterCancelledSync() {
        LibrarySyncService.SyncStats cancelled = new LibrarySyncService.SyncStats();
        cancelled.setCancelled(true);
        when(librarySyncService.sync(any(), any(), any())).thenReturn(cancelled);

        service.runJob(6L, ScanType.FULL);

        verify(comicProcessingService, never()).process(any(), any(), any());
        verify(scanJobMapper).markFinished(eq(6L), eq("cancelled"), anyString());
    }

    @Test
    void shouldRecordFailureSummary() {
        when(librarySyncService.sync(any(), any(), any()))
                .thenThrow(new LibraryAccessException("/missing", "Library root does not exist: /missing"));

        service.runJob(9L, ScanType.FULL);

        verify(scanJobMapper).markFinished(9L, "failed", "Library root does not exist: /missing");
        verify(comicProcessingService, never()).process(any(), any(), any());
    }

    @Test
    void shouldExposeStoredErrorsAndCancelFlag() {
        ScanJobEntity stored = new ScanJobEntity();
        stored.setId(2L);
        stored.setErrors("[\"a.cbz: No images in archive\",\"b.cbz: bad zip\"]");
        stored.setCancelRequested(1);
        stored.setThumbBytesWritten(2048L);
        when(scanJobMapper.selectLatest()).thenReturn(stored);

        ScanJobDetailResponse response = service.getLatestJob();

        Assertions.assertEquals(Arrays.asList("a.cbz: No images in archive", "b.cbz: bad zip"), response.getErrors());
        Assertions.assertTrue(response.isCancelRequested());
        Assertions.assertEquals(2048L, response.getThumbBytesWritten());
        Assertions.assertNull(service.getJob(404L));
    }

    @Test
    void shouldReportWhetherCancelHitARunningJob() {
        when(scanJobMapper.requestCancel()).thenReturn(0, 1);

        Assertions.assertFalse(service.cancelRunningJob());
        Assertions.assertTrue(service.cancelRunningJob());
    }

    @Test
    void shouldFailJobsLeftRunningByPreviousProcess() {
        when(scanJobMapper.markAllRunningFailed(ScanJobService.INTERRUPTED_SUMMARY)).thenReturn(2);

        Assertions.assertEquals(2, service.recoverInterruptedJobs());
    }

    private void assignIdOnInsert(Long id) {
        doAnswer(invocation -> {
            ScanJobEntity entity = invocation.getArgument(0);
            entity.setId(id);
            Assertions.assertEquals(ScanJobProgress.PHASE_QUEUED, entity.getPhase());
            return 1;
        }).when(scanJobMapper).insertRunning(any(ScanJobEntity.class));
    }
}
