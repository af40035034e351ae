/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.net;

import java.util.regex.Pattern;

/**
 * Derives the short label shown for a session from its server url.
 *
 * <table>
 *   <tr><th>Url</th><th>Label</th></tr>
 *   <tr><td>http://localhost:3000/</td><td>localhost:3000</td></tr>
 *   <tr><td>http://127.0.0.1:8080</td><td>localhost:8080</td></tr>
 *   <tr><td>http://192.168.1.10:4096</td><td>192.168.1.10:4096</td></tr>
 *   <tr><td>https://chat.example.com/app</td><td>example.com</td></tr>
 * </table>
 */
public final class DisplayNames {

    static final int FALLBACK_LENGTH = 20;

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");
    private static final String LOCALHOST = "localhost";

    private DisplayNames() {
    }

    /**
     * Never fails: when no host can be found the first {@value #FALLBACK_LENGTH} characters
     * of the url are used instead.
     *
     * @param url server url
     * @return display label
     */
    public static String fromUrl(String url) {
        String hostPart = hostPart(url);
        if (hostPart.isEmpty()) {
            return url.length() <= FALLBACK_LENGTH ? url : url.substring(0, FALLBACK_LENGTH);
        }

        if (hostPart.startsWith(LOCALHOST) || hostPart.startsWith("127.0.0.1")) {
            int colon = hostPart.indexOf(':');
            return colon < 0 ? LOCALHOST : LOCALHOST + hostPart.substring(colon);
        }
        if (hostPart.startsWith("192.168.") || hostPart.startsWith("10.")) {
            return hostPart;
        }

        String[] labels = hostPart.split("\\.");
        if (labels.length >= 2) {
            return labels[labels.length - 2] + "." + labels[labels.length - 1];
        }
        return hostPart;
    }

    private static String hostPart(String url) {
        String clean = SCHEME.matcher(url.trim()).replaceFirst("");
        while (clean.endsWith("/")) {
            clean = clean.substring(0, clean.length() - 1);
        }
        int end = clean.length();
        for (char delimiter : new char[]{ '/', '?', '#' }) {
            int index = clean.indexOf(delimiter);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return clean.substring(0, end);
    }
}
