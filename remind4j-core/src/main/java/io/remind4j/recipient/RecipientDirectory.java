package io.remind4j.recipient;

import io.remind4j.delivery.MessagingApiException;

import java.util.List;

/**
 * Lookup of recipients known to the messaging service.
 */
public interface RecipientDirectory {

    List<RecipientInfo> listRecipients() throws MessagingApiException;

    default boolean exists(String recipientId) throws MessagingApiException {
        if (recipientId == null) {
            return false;
        }
        for (RecipientInfo r : listRecipients()) {
            if (recipientId.equals(r.id())) {
                return true;
            }
        }
        return false;
    }
}
