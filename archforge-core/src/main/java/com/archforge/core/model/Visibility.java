package com.archforge.core.model;

/**
 * Member visibility as written in class diagrams.
 */
public enum Visibility {
    PUBLIC("+", "public"),
    PRIVATE("-", "private"),
    PROTECTED("#", "protected"),
    PACKAGE("~", "internal");

    private final String marker;
    private final String keyword;

    Visibility(String marker, String keyword) {
        this.marker = marker;
        this.keyword = keyword;
    }

    public String marker() {
        return marker;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Maps a diagram visibility marker to a visibility.
     *
     * @param marker one of {@code + - # ~}, may be null or empty
     * @return matching visibility, {@link #PUBLIC} when absent or unknown
     */
    public static Visibility fromMarker(String marker) {
        if (marker == null || marker.isEmpty()) {
            return PUBLIC;
        }
        for (Visibility visibility : values()) {
            if (visibility.marker.equals(marker)) {
                return visibility;
            }
        }
        return PUBLIC;
    }
}
