package io.remind4j.delivery;

/**
 * Transport to the agent-messaging service. One instance is built at startup and injected.
 */
public interface MessagingApi {

    /**
     * Send one user message to the recipient over the standard endpoint.
     */
    void send(String recipientId, String message) throws MessagingApiException;

    /**
     * Send the same message over the streaming endpoint, consuming the stream to completion.
     */
    void sendStreaming(String recipientId, String message) throws MessagingApiException;
}
