package com.example.comicshelf.application.service;

import com.example.comicshelf.infrastructure.persistence.entity.ScanJobEntity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ScanJobProgressTest {

    @Test
    void shouldCapAndTruncateErrors() {
        ScanJobProgress progress = new ScanJobProgress(2, 20);

        progress.addError("a.cbz: Corrupt zip");
        progress.addError("");
        progress.addError("b.cbz: Thumbnail generation failed badly");
        progress.addError("c.cbz: dropped");

        Assertions.assertEquals(2, progress.getErrors().size());
        Assertions.assertEquals("b.cbz: Thumbnail gen", progress.getErrors().get(1));
        Assertions.assertEquals(1, progress.getDroppedErrors());
    }

    @Test
    void shouldCopyCountersToEntity() {
        ScanJobProgress progress = new ScanJobProgress(10, 200);
        progress.setPhase(ScanJobProgress.PHASE_PROCESS);
        progress.setTotalComics(4);
        progress.addProcessedComics(3);
        progress.addProcessedPages(120);
        progress.addThumbBytesSaved(2048L);

        ScanJobEntity entity = progress.toEntity(5L, "[]");

        Assertions.assertEquals(Long.valueOf(5L), entity.getId());
        Assertions.assertEquals("Phase 2: Processing", entity.getPhase());
        Assertions.assertEquals(Integer.valueOf(3), entity.getProcessedComics());
        Assertions.assertEquals(Integer.valueOf(120), entity.getProcessedPages());
        Assertions.assertEquals(Long.valueOf(2048L), entity.getThumbBytesSaved());
        Assertions.assertEquals("[]", entity.getErrors());
    }
}
