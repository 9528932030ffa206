package org.tarik.retry.controller;

import java.util.Arrays;

import static java.util.Arrays.stream;

/**
 * The way the caller is authenticated against the remote service. Only interactive (non API key) authentication may
 * be offered a fallback to another model after persistent rate limiting, API key quotas are the caller's own concern.
 */
public enum AuthMode {
    LOGIN_WITH_GOOGLE("oauth-personal", false),
    USE_GEMINI("gemini-api-key", true),
    USE_VERTEX_AI("vertex-ai", false),
    CLOUD_SHELL("cloud-shell", false);

    private final String value;
    private final boolean apiKeyBased;

    AuthMode(String value, boolean apiKeyBased) {
        this.value = value;
        this.apiKeyBased = apiKeyBased;
    }

    public String getValue() {
        return value;
    }

    public boolean isApiKeyBased() {
        return apiKeyBased;
    }

    public boolean allowsEscalation() {
        return !apiKeyBased;
    }

    public static AuthMode fromValue(String value) {
        return stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException(
                        "%s is not a supported auth mode. Supported ones: %s".formatted(value,
                                Arrays.toString(stream(values()).map(AuthMode::getValue).toArray()))));
    }
}
