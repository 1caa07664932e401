package io.remind4j.recipient;

import io.remind4j.delivery.MessagingApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the recipient for a new schedule when the caller did not name one.
 *
 * <p>Order: explicit argument, per-session default, process default, and finally the only
 * recipient known to the directory (when exactly one exists).
 */
public class RecipientResolver {
    private static final Logger log = LoggerFactory.getLogger(RecipientResolver.class);

    private final String processDefault;
    private final RecipientDirectory directory;
    private final Map<String, String> sessionDefaults = new ConcurrentHashMap<>();

    /**
     * @param processDefault default recipient for this process; may be null
     * @param directory      used for the single-recipient fallback; may be null to disable it
     */
    public RecipientResolver(String processDefault, RecipientDirectory directory) {
        this.processDefault = isBlank(processDefault) ? null : processDefault.trim();
        this.directory = directory;
    }

    public void setSessionDefault(String sessionId, String recipientId) {
        if (isBlank(sessionId)) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (isBlank(recipientId)) {
            throw new IllegalArgumentException("recipientId must not be blank");
        }
        sessionDefaults.put(sessionId, recipientId.trim());
    }

    public void clearSessionDefault(String sessionId) {
        if (sessionId != null) {
            sessionDefaults.remove(sessionId);
        }
    }

    /**
     * @param explicit  recipient named by the caller; may be null
     * @param sessionId caller session; may be null
     */
    public Optional<String> resolve(String explicit, String sessionId) {
        if (!isBlank(explicit)) {
            return Optional.of(explicit.trim());
        }
        if (sessionId != null) {
            String fromSession = sessionDefaults.get(sessionId);
            if (fromSession != null) {
                return Optional.of(fromSession);
            }
        }
        if (processDefault != null) {
            return Optional.of(processDefault);
        }
        return singleKnownRecipient();
    }

    private Optional<String> singleKnownRecipient() {
        if (directory == null) {
            return Optional.empty();
        }
        try {
            List<RecipientInfo> known = directory.listRecipients();
            if (known.size() == 1) {
                log.debug("remind recipient resolved from single known recipient id={}", known.get(0).id());
                return Optional.of(known.get(0).id());
            }
            log.debug("remind recipient fallback skipped knownCount={}", known.size());
            return Optional.empty();
        } catch (MessagingApiException ex) {
            log.warn("remind recipient lookup failed msg={}", ex.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
