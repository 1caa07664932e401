package io.remind4j.support;

import io.remind4j.delivery.MessagingApi;
import io.remind4j.delivery.MessagingApiException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Scripted {@link MessagingApi}: queued failures per recipient are thrown in order, then sends succeed.
 */
public class FakeMessagingApi implements MessagingApi {

    private final Map<String, Deque<MessagingApiException>> sendFailures = new HashMap<>();
    private final Map<String, Deque<MessagingApiException>> streamFailures = new HashMap<>();
    private final List<String> sent = Collections.synchronizedList(new ArrayList<>());
    private final List<String> streamed = Collections.synchronizedList(new ArrayList<>());
    private volatile int sendCalls;
    private volatile Consumer<String> afterSend = recipientId -> {
    };

    public synchronized FakeMessagingApi failSend(String recipientId, MessagingApiException... failures) {
        Deque<MessagingApiException> q = sendFailures.computeIfAbsent(recipientId, k -> new ArrayDeque<>());
        Collections.addAll(q, failures);
        return this;
    }

    public synchronized FakeMessagingApi failStreaming(String recipientId, MessagingApiException... failures) {
        Deque<MessagingApiException> q = streamFailures.computeIfAbsent(recipientId, k -> new ArrayDeque<>());
        Collections.addAll(q, failures);
        return this;
    }

    /**
     * Runs {@code hook} with the recipient id after each successful primary send, on the sending thread.
     */
    public FakeMessagingApi afterSend(Consumer<String> hook) {
        this.afterSend = hook;
        return this;
    }

    @Override
    public void send(String recipientId, String message) {
        MessagingApiException failure;
        synchronized (this) {
            sendCalls++;
            failure = poll(sendFailures, recipientId);
        }
        if (failure != null) {
            throw failure;
        }
        sent.add(recipientId + ":" + message);
        afterSend.accept(recipientId);
    }

    @Override
    public void sendStreaming(String recipientId, String message) {
        MessagingApiException failure;
        synchronized (this) {
            failure = poll(streamFailures, recipientId);
        }
        if (failure != null) {
            throw failure;
        }
        streamed.add(recipientId + ":" + message);
    }

    private static MessagingApiException poll(Map<String, Deque<MessagingApiException>> failures, String recipientId) {
        Deque<MessagingApiException> q = failures.get(recipientId);
        return q == null ? null : q.poll();
    }

    public List<String> sent() {
        return List.copyOf(sent);
    }

    public List<String> streamed() {
        return List.copyOf(streamed);
    }

    public int sendCalls() {
        return sendCalls;
    }

    public static MessagingApiException status(int code) {
        return new MessagingApiException(code, "HTTP " + code, null);
    }

    public static MessagingApiException malformed() {
        return new MessagingApiException(500,
                "KeyError: 'description' in ChatMLInnerMonologueWrapper", null);
    }

    public static MessagingApiException unreachable() {
        return MessagingApiException.noResponse("Connection refused", null);
    }
}
