package com.unifiedplatform.backend.global.web;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body returned by create endpoints: the store-generated identity and, where the operation has one,
 * the resulting status or a short message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreatedResponse(UUID id, String status, String message) {

    public static CreatedResponse of(UUID id) {
        return new CreatedResponse(id, null, null);
    }

    public static CreatedResponse withStatus(UUID id, String status) {
        return new CreatedResponse(id, status, null);
    }

    public static CreatedResponse withMessage(UUID id, String message) {
        return new CreatedResponse(id, null, message);
    }
}
