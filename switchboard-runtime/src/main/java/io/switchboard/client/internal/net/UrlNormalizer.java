/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.net;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns what a user typed into the address box into a canonical absolute url.
 * <p>
 * Loopback and bare IPv4 addresses are assumed to be development servers and get {@code http://}.
 * Anything else without a scheme is treated as a public host and gets {@code https://}.
 * </p>
 * <p>
 * Both operations are total: malformed input yields an {@link UrlValidation.Invalid}, never an exception.
 * </p>
 */
public final class UrlNormalizer {

    private static final String HTTP_PREFIX = "http://";
    private static final String HTTPS_PREFIX = "https://";
    private static final Pattern IPV4_PREFIX = Pattern.compile("^\\d+\\.\\d+\\.\\d+\\.\\d+.*");
    private static final Pattern EXPLICIT_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    private UrlNormalizer() {
    }

    /**
     * Adds the scheme a bare address should be reached with. Input that already carries
     * {@code http://} or {@code https://} is only trimmed.
     *
     * @param raw user input
     * @return the input with a scheme prefix
     */
    public static String normalize(String raw) {
        String trimmed = raw.trim();
        if (hasHttpScheme(trimmed)) {
            return trimmed;
        }
        if (trimmed.startsWith("localhost") || trimmed.startsWith("127.0.0.1")
                || IPV4_PREFIX.matcher(trimmed).matches()) {
            return HTTP_PREFIX + trimmed;
        }
        return HTTPS_PREFIX + trimmed;
    }

    /**
     * Normalizes and checks the input.
     *
     * @param raw user input, may be null
     * @return the normalized url or the reason it was rejected
     */
    public static UrlValidation validate(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return new UrlValidation.Invalid(ValidationError.EMPTY_INPUT);
        }
        String trimmed = raw.trim();
        if (!hasHttpScheme(trimmed) && EXPLICIT_SCHEME.matcher(trimmed).matches()) {
            return new UrlValidation.Invalid(ValidationError.UNSUPPORTED_SCHEME);
        }

        String normalized = normalize(trimmed);
        URI uri;
        try {
            uri = new URI(normalized);
        }
        catch (URISyntaxException e) {
            return new UrlValidation.Invalid(ValidationError.INVALID_FORMAT);
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            return new UrlValidation.Invalid(ValidationError.INVALID_FORMAT);
        }
        String lowerScheme = scheme.toLowerCase(Locale.ROOT);
        if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
            return new UrlValidation.Invalid(ValidationError.UNSUPPORTED_SCHEME);
        }
        // registry-based authorities (e.g. "host:notaport") parse without a host
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            return new UrlValidation.Invalid(ValidationError.INVALID_FORMAT);
        }
        return new UrlValidation.Valid(normalized);
    }

    private static boolean hasHttpScheme(String value) {
        return value.regionMatches(true, 0, HTTP_PREFIX, 0, HTTP_PREFIX.length())
                || value.regionMatches(true, 0, HTTPS_PREFIX, 0, HTTPS_PREFIX.length());
    }
}
