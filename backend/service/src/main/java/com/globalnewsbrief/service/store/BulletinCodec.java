package com.globalnewsbrief.service.store;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalnewsbrief.core.model.BulletinWrapper;
import com.globalnewsbrief.core.util.JsonUtils;
import com.globalnewsbrief.core.validation.ValidationException;

import java.io.IOException;

/**
 * Wire form of a bulletin: {@code {"bulletin": {...}}} with snake_case fields. Decoding runs the
 * full model validation, so a decoded bulletin is as trustworthy as a freshly formatted one.
 */
public final class BulletinCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private BulletinCodec() {
    }

    public static String toJson(BulletinWrapper wrapper) {
        try {
            return JsonUtils.prettyWriter().writeValueAsString(wrapper);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize bulletin", e);
        }
    }

    public static BulletinWrapper fromJson(String json) {
        try {
            return MAPPER.readValue(json, BulletinWrapper.class);
        } catch (JsonMappingException e) {
            ValidationException invalid = validationCause(e);
            if (invalid != null) {
                throw invalid;
            }
            throw new IllegalStateException("Unable to deserialize bulletin", e);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize bulletin", e);
        }
    }

    private static ValidationException validationCause(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof ValidationException invalid) {
                return invalid;
            }
        }
        return null;
    }
}
