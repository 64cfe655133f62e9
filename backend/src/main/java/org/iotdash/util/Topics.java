package org.iotdash.util;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class Topics {

    private Topics() {
    }

    /**
     * Splits a comma separated topic list, trimming entries and dropping blanks.
     */
    public static List<String> split(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(topic -> !topic.isEmpty())
                .collect(Collectors.toList());
    }
}
