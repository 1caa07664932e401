package io.remind4j.delivery;

import java.util.Objects;

/**
 * Maps {@link MessagingApiException}s to retry decisions.
 *
 * <ul>
 *   <li>MALFORMED_RESPONSE: the recipient-side response serialization defect; eligible for the streaming fallback</li>
 *   <li>PERMANENT: 401/403 (auth), 404 (unknown recipient), 400/413/422 (payload rejected)</li>
 *   <li>TRANSIENT: no response, 408, 429, 5xx and anything unrecognised</li>
 * </ul>
 */
public final class DeliveryFailureClassifier {

    static final String SIGNATURE_FIELD = "'description'";
    static final String SIGNATURE_WRAPPER = "ChatMLInnerMonologueWrapper";

    public enum FailureKind {
        TRANSIENT,
        PERMANENT,
        MALFORMED_RESPONSE
    }

    private DeliveryFailureClassifier() {
    }

    public static FailureKind classify(MessagingApiException ex) {
        Objects.requireNonNull(ex, "ex must not be null");

        if (matchesMalformedSignature(ex.getMessage()) || matchesMalformedSignature(ex.responseBody())) {
            return FailureKind.MALFORMED_RESPONSE;
        }

        return switch (ex.statusCode()) {
            case 400, 401, 403, 404, 413, 422 -> FailureKind.PERMANENT;
            default -> FailureKind.TRANSIENT;
        };
    }

    /**
     * True when the text carries both markers of the known malformed-response defect.
     */
    public static boolean matchesMalformedSignature(String text) {
        return text != null && text.contains(SIGNATURE_FIELD) && text.contains(SIGNATURE_WRAPPER);
    }

    public static String describe(MessagingApiException ex) {
        if (!ex.hasResponse()) {
            return "no response: " + ex.getMessage();
        }
        return switch (ex.statusCode()) {
            case 401, 403 -> "authentication failed (" + ex.statusCode() + ")";
            case 404 -> "recipient not found (404)";
            case 400, 413, 422 -> "payload rejected (" + ex.statusCode() + ")";
            default -> "status " + ex.statusCode() + ": " + ex.getMessage();
        };
    }
}
