package io.remind4j.recipient;

import java.time.Instant;

public record RecipientInfo(
        String id,
        String name,
        Instant createdAt
) {
}
