package io.remind4j.delivery;

/**
 * Delivers one message to one recipient. Performs network calls only; never touches the store.
 */
public interface DeliveryClient {

    DeliveryOutcome deliver(String recipientId, String message);
}
