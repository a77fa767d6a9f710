package com.example.comicshelf.domain.model;

import com.example.comicshelf.domain.enumtype.TagModificationAction;
import java.util.Objects;

/**
 * An admin rule attached to one normalized source tag. Exactly one of {@link Blacklist},
 * {@link Whitelist} or {@link Merge}.
 */
public abstract class TagModification {

    private final String sourceNorm;

    private TagModification(String sourceNorm) {
        this.sourceNorm = Objects.requireNonNull(sourceNorm, "sourceNorm");
    }

    public String getSourceNorm() {
        return sourceNorm;
    }

    public abstract TagModificationAction getAction();

    public static TagModification blacklist(String sourceNorm) {
        return new Blacklist(sourceNorm);
    }

    public static TagModification whitelist(String sourceNorm, String display) {
        return new Whitelist(sourceNorm, display);
    }

    public static TagModification merge(String sourceNorm, String targetNorm) {
        return new Merge(sourceNorm, targetNorm);
    }

    /**
     * Rebuilds a rule from its stored columns. Returns {@code null} for rows whose action or
     * payload is unusable.
     */
    public static TagModification of(String sourceNorm, String action, String targetNorm, String displayName) {
        TagModificationAction parsed = TagModificationAction.fromValue(action);
        if (sourceNorm == null || sourceNorm.isEmpty() || parsed == null) {
            return null;
        }
        switch (parsed) {
            case BLACKLIST:
                return new Blacklist(sourceNorm);
            case WHITELIST:
                return displayName == null || displayName.trim().isEmpty() ? null : new Whitelist(sourceNorm, displayName);
            case MERGE:
                return targetNorm == null || targetNorm.isEmpty() ? null : new Merge(sourceNorm, targetNorm);
            default:
                return null;
        }
    }

    public static final class Blacklist extends TagModification {

        private Blacklist(String sourceNorm) {
            super(sourceNorm);
        }

        @Override
        public TagModificationAction getAction() {
            return TagModificationAction.BLACKLIST;
        }

        @Override
        public String toString() {
            return "Blacklist{" + getSourceNorm() + "}";
        }
    }

    public static final class Whitelist extends TagModification {

        private final String display;

        private Whitelist(String sourceNorm, String display) {
            super(sourceNorm);
            this.display = Objects.requireNonNull(display, "display").trim();
        }

        public String getDisplay() {
            return display;
        }

        @Override
        public TagModificationAction getAction() {
            return TagModificationAction.WHITELIST;
        }

        @Override
        public String toString() {
            return "Whitelist{" + getSourceNorm() + " -> '" + display + "'}";
        }
    }

    public static final class Merge extends TagModification {

        private final String targetNorm;

        private Merge(String sourceNorm, String targetNorm) {
            super(sourceNorm);
            this.targetNorm = Objects.requireNonNull(targetNorm, "targetNorm");
        }

        public String getTargetNorm() {
            return targetNorm;
        }

        @Override
        public TagModificationAction getAction() {
            return TagModificationAction.MERGE;
        }

        @Override
        public String toString() {
            return "Merge{" + getSourceNorm() + " -> " + targetNorm + "}";
        }
    }
}
