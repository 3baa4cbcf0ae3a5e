package com.gprintex.gtm.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient label matching shared by the labelled enums.
 * Case and whitespace are ignored, so "Smart City" matches "SmartCity".
 */
final class Labels {

    private Labels() {
    }

    static <E extends Enum<E>> Optional<E> match(E[] values, String raw, Function<E, String> label) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var key = canonical(raw);
        return Arrays.stream(values)
            .filter(v -> canonical(label.apply(v)).equals(key) || canonical(v.name()).equals(key))
            .findFirst();
    }

    private static String canonical(String value) {
        return value.replaceAll("[\\s_]", "").toLowerCase(Locale.ROOT);
    }
}
