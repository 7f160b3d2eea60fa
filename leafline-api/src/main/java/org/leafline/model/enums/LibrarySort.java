package org.leafline.model.enums;

import org.springframework.data.domain.Sort;

import java.util.Arrays;
import java.util.Locale;

public enum LibrarySort {
    /** Most recently read by the caller first; books the caller never opened fall back to their upload time. */
    RECENT("recent"),
    ADDED("added"),
    TITLE("title");

    private final String value;

    LibrarySort(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Sort toSort() {
        if (this == TITLE) {
            return Sort.by(Sort.Order.asc("title"), Sort.Order.asc("id"));
        }
        return Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
    }

    public static LibrarySort fromValue(String value) {
        if (value == null) {
            return RECENT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(sort -> sort.value.equals(normalized))
                .findFirst()
                .orElse(RECENT);
    }
}
