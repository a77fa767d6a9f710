package com.example.comicshelf.domain.model;

import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TagModificationResolverTest {

    @Test
    void shouldFollowMergeChainToFinalTarget() {
        TagModificationResolver resolver = new TagModificationResolver(Arrays.asList(
                TagModification.merge("shonen", "shounen"),
                TagModification.merge("shounen", "battle")));

        Assertions.assertEquals("battle", resolver.resolve("shonen"));
        Assertions.assertEquals("battle", resolver.resolve("shounen"));
        Assertions.assertEquals("romance", resolver.resolve("romance"));
    }

    @Test
    void shouldDropTagsWhoseChainEndsBlacklisted() {
        TagModificationResolver resolver = new TagModificationResolver(Arrays.asList(
                TagModification.merge("oneshot", "doujinshi"),
                TagModification.blacklist("doujinshi")));

        Assertions.assertNull(resolver.resolve("oneshot"));
        Assertions.assertNull(resolver.resolve("doujinshi"));
        Assertions.assertTrue(resolver.isBlacklisted("doujinshi"));
        Assertions.assertFalse(resolver.isBlacklisted("oneshot"));
    }

    @Test
    void shouldResolveMergeCycleToOneStableMember() {
        TagModificationResolver resolver = new TagModificationResolver(Arrays.asList(
                TagModification.merge("romcom", "romance comedy"),
                TagModification.merge("romance comedy", "rom com"),
                TagModification.merge("rom com", "romcom")));

        String expected = "rom com";
        Assertions.assertEquals(expected, resolver.resolve("romcom"));
        Assertions.assertEquals(expected, resolver.resolve("romance comedy"));
        Assertions.assertEquals(expected, resolver.resolve("rom com"));
    }

    @Test
    void shouldExposeWhitelistDisplay() {
        TagModificationResolver resolver = new TagModificationResolver(Arrays.asList(
                TagModification.whitelist("sci fi", " Sci-Fi ")));

        Assertions.assertEquals("Sci-Fi", resolver.displayOverride("sci fi"));
        Assertions.assertNull(resolver.displayOverride("horror"));
        Assertions.assertEquals("sci fi", resolver.resolve("sci fi"));
    }

    @Test
    void shouldRejectUnusableStoredRows() {
        Assertions.assertNull(TagModification.of("action", "rename", null, null));
        Assertions.assertNull(TagModification.of("action", "merge", "", null));
        Assertions.assertNull(TagModification.of("action", "whitelist", null, "  "));
        Assertions.assertTrue(TagModification.of("action", "MERGE", "fight", null) instanceof TagModification.Merge);
        Assertions.assertNull(TagModificationResolver.empty().resolve(""));
    }
}
