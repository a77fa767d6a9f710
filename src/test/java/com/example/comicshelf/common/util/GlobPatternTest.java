package com.example.comicshelf.common.util;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GlobPatternTest {

    @Test
    void shouldMatchWildcardsAgainstWholeValue() {
        Pattern pattern = GlobPattern.compile("*breast*");

        Assertions.assertTrue(pattern.matcher("large breast").matches());
        Assertions.assertTrue(pattern.matcher("breast").matches());
        Assertions.assertFalse(pattern.matcher("breakfast").matches());
    }

    @Test
    void shouldRequireSpaceAroundWordPatterns() {
        Pattern pattern = GlobPattern.compile("* sex");

        Assertions.assertTrue(pattern.matcher("group sex").matches());
        Assertions.assertFalse(pattern.matcher("sexless").matches());
        Assertions.assertFalse(pattern.matcher("sex").matches());
    }

    @Test
    void shouldSupportSingleCharAndClasses() {
        Assertions.assertTrue(GlobPattern.compile("b?y").matcher("boy").matches());
        Assertions.assertTrue(GlobPattern.compile("[bc]at").matcher("Cat").matches());
        Assertions.assertFalse(GlobPattern.compile("[!bc]at").matcher("cat").matches());
        Assertions.assertTrue(GlobPattern.compile("[!bc]at").matcher("hat").matches());
    }

    @Test
    void shouldQuoteRegexMetacharacters() {
        Assertions.assertTrue(GlobPattern.compile("a.b+c").matcher("a.b+c").matches());
        Assertions.assertFalse(GlobPattern.compile("a.b+c").matcher("axbbc").matches());
    }

    @Test
    void shouldRejectUnclosedClass() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> GlobPattern.compile("[abc"));
    }
}
