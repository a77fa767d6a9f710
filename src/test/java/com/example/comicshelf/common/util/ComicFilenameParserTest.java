package com.example.comicshelf.common.util;

import com.example.comicshelf.domain.model.ComicNumbering;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ComicFilenameParserTest {

    @Test
    void shouldParseVolumeAndChapterMarkers() {
        ComicNumbering numbering = ComicFilenameParser.parseNumbering("Berserk v03 c012.5.cbz");

        Assertions.assertEquals(3.0D, numbering.getVolume());
        Assertions.assertEquals(12.5D, numbering.getChapter());
    }

    @Test
    void shouldParseLongMarkers() {
        ComicNumbering numbering = ComicFilenameParser.parseNumbering("Monster Vol.2 Chapter 15.cbr");

        Assertions.assertEquals(2.0D, numbering.getVolume());
        Assertions.assertEquals(15.0D, numbering.getChapter());
    }

    @Test
    void shouldUseTrailingNumberAsChapterWhenNoMarker() {
        ComicNumbering numbering = ComicFilenameParser.parseNumbering("Blame 7.cbz");

        Assertions.assertNull(numbering.getVolume());
        Assertions.assertEquals(7.0D, numbering.getChapter());
    }

    @Test
    void shouldLeaveNumberingEmptyWhenNothingMatches() {
        ComicNumbering numbering = ComicFilenameParser.parseNumbering("Artbook.cbz");

        Assertions.assertNull(numbering.getVolume());
        Assertions.assertNull(numbering.getChapter());
    }

    @Test
    void shouldDeriveSeriesFromFilename() {
        Assertions.assertEquals("Akira", ComicFilenameParser.seriesFromFilename("Akira v01.cbz"));
        Assertions.assertEquals("Dorohedoro", ComicFilenameParser.seriesFromFilename("Dorohedoro ch 12.cbr"));
        Assertions.assertEquals("Oneshot", ComicFilenameParser.seriesFromFilename("Oneshot.cbz"));
    }

    @Test
    void shouldSplitExtension() {
        Assertions.assertEquals("cbz", ComicFilenameParser.extension("a.b.cbz"));
        Assertions.assertEquals("a.b", ComicFilenameParser.stripExtension("a.b.cbz"));
        Assertions.assertEquals("", ComicFilenameParser.extension("noext"));
    }
}
