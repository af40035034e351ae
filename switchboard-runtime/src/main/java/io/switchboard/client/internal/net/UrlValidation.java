/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.net;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a user supplied server address.
 *
 * <pre>
 *   raw input ──► normalize ──► parse
 *                                 │
 *                   ┌─────────────┴─────────────┐
 *                   ▼                           ▼
 *                Valid(url)              Invalid(error)
 * </pre>
 */
public sealed interface UrlValidation permits UrlValidation.Valid, UrlValidation.Invalid {

    /**
     * The input normalized to a well-formed absolute http or https url.
     */
    record Valid(String url) implements UrlValidation {
        public Valid {
            Objects.requireNonNull(url);
        }
    }

    /**
     * The input was rejected.
     */
    record Invalid(ValidationError error) implements UrlValidation {
        public Invalid {
            Objects.requireNonNull(error);
        }

        public String message() {
            return error.message();
        }
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    default Optional<String> normalizedUrl() {
        return this instanceof Valid valid ? Optional.of(valid.url()) : Optional.empty();
    }
}
