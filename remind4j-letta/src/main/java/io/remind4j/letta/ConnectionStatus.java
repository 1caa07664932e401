package io.remind4j.letta;

/**
 * Result of {@link LettaMessagingApi#testConnection()}.
 *
 * @param recipientCount agents visible to the configured credentials; -1 when not reachable
 */
public record ConnectionStatus(
        boolean ok,
        String baseUrl,
        int recipientCount,
        String error
) {

    public static ConnectionStatus ok(String baseUrl, int recipientCount) {
        return new ConnectionStatus(true, baseUrl, recipientCount, null);
    }

    public static ConnectionStatus failed(String baseUrl, String error) {
        return new ConnectionStatus(false, baseUrl, -1, error);
    }
}
