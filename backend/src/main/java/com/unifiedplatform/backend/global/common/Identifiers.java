package com.unifiedplatform.backend.global.common;

import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.global.error.ProblemException;

/**
 * Identity references arrive as strings; one that is not even a UUID cannot resolve to a record,
 * so it is reported the same way as a well-formed id that is missing.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static UUID resolveOrNotFound(String raw, String notFoundCode, String label) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw ProblemException.notFound(notFoundCode, label + " " + raw.trim() + " does not exist");
        }
    }

    /**
     * Lenient parse for query filters: a malformed id matches nothing rather than failing the listing.
     */
    public static Optional<UUID> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
