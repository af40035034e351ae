/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.net;

/**
 * Reasons a user supplied server address is rejected.
 */
public enum ValidationError {
    EMPTY_INPUT("Please enter a server URL"),
    INVALID_FORMAT("Please enter a valid URL"),
    UNSUPPORTED_SCHEME("URL must use http or https protocol");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    /**
     * @return text that can be shown to the user as-is
     */
    public String message() {
        return message;
    }
}
