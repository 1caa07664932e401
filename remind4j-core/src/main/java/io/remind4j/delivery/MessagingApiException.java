package io.remind4j.delivery;

/**
 * Failure reported by a {@link MessagingApi}.
 *
 * <p>{@code statusCode} is the HTTP-like status of the response, or {@link #NO_RESPONSE} when the
 * call failed before a response arrived (connect error, timeout, broken stream).
 */
public class MessagingApiException extends RuntimeException {

    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String responseBody;

    public MessagingApiException(int statusCode, String message, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public MessagingApiException(int statusCode, String message, String responseBody) {
        this(statusCode, message, responseBody, null);
    }

    public static MessagingApiException noResponse(String message, Throwable cause) {
        return new MessagingApiException(NO_RESPONSE, message, null, cause);
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }

    public boolean hasResponse() {
        return statusCode != NO_RESPONSE;
    }
}
