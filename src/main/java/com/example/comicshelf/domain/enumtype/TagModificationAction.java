package com.example.comicshelf.domain.enumtype;

import java.util.Locale;

public enum TagModificationAction {
    BLACKLIST,
    WHITELIST,
    MERGE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TagModificationAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TagModificationAction action : values()) {
            if (action.value().equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        return null;
    }
}
