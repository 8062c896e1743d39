package com.unifiedplatform.backend.global.common;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.unifiedplatform.backend.global.error.ProblemException;

/**
 * Enum values travel as lower-case codes ({@code student_activity}) and are stored by constant name.
 */
public final class WireCodes {

    private WireCodes() {
    }

    public static String code(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire code, failing with a 422 problem naming {@code field} when the value is unknown.
     * Returns {@code null} for a blank input.
     */
    public static <E extends Enum<E>> E parseNullable(Class<E> type, String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.validation(
                    "INVALID_" + field.toUpperCase(Locale.ROOT),
                    field + " must be one of " + allowed(type)
            );
        }
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String raw, String field) {
        E value = parseNullable(type, raw, field);
        if (value == null) {
            throw ProblemException.validation(
                    field.toUpperCase(Locale.ROOT) + "_REQUIRED",
                    field + " is required"
            );
        }
        return value;
    }

    private static <E extends Enum<E>> String allowed(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(WireCodes::code)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
