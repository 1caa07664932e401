package io.remind4j.letta;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for a Letta server.
 *
 * <p>Auth token resolution: {@code apiKey}, else {@code serverPassword} sent as the bearer token,
 * else {@link #UNSECURED_TOKEN} for local servers running without auth.
 */
public record LettaClientSettings(
        String baseUrl,
        String apiKey,
        String serverPassword,
        Duration connectTimeout,
        Duration readTimeout
) {

    public static final String DEFAULT_BASE_URL = "http://localhost:8283";
    public static final String UNSECURED_TOKEN = "dummy-token-for-unsecured-server";

    public LettaClientSettings {
        baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }

    public static LettaClientSettings defaults() {
        return new LettaClientSettings(null, null, null, null, null);
    }

    /**
     * Reads {@code LETTA_BASE_URL}, {@code LETTA_API_KEY} and {@code LETTA_SERVER_PASSWORD}.
     */
    public static LettaClientSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        return new LettaClientSettings(
                env.get("LETTA_BASE_URL"),
                env.get("LETTA_API_KEY"),
                env.get("LETTA_SERVER_PASSWORD"),
                null,
                null
        );
    }

    public String resolveToken() {
        if (!isBlank(apiKey)) {
            return apiKey.trim();
        }
        if (!isBlank(serverPassword)) {
            return serverPassword.trim();
        }
        return UNSECURED_TOKEN;
    }

    public String authMethod() {
        if (!isBlank(apiKey)) {
            return "api_key";
        }
        return isBlank(serverPassword) ? "unsecured" : "server_password";
    }

    @Override
    public String toString() {
        return "LettaClientSettings[baseUrl=" + baseUrl + ", auth=" + authMethod()
                + ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout + "]";
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
