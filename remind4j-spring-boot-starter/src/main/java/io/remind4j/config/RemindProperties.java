package io.remind4j.config;

import io.remind4j.RemindOptions;
import io.remind4j.letta.LettaClientSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the reminder engine, its delivery retries and the Letta connection.
 */
@ConfigurationProperties(prefix = "remind")
public class RemindProperties {
    private boolean enabled = true;
    private boolean autoStart = true;
    private Duration processEvery = Duration.ofSeconds(60);
    private Duration lockLifetime = Duration.ofMinutes(10);
    private int maxPerPass = 100;
    private int maxConsecutiveTransientFailures = 10; // 0 = never give up
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private boolean validateRecipients = false;
    private String defaultRecipientId;

    private final Delivery delivery = new Delivery();
    private final Letta letta = new Letta();

    public RemindOptions toOptions() {
        return new RemindOptions(processEvery, lockLifetime, maxPerPass, maxConsecutiveTransientFailures,
                workerId, validateRecipients);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public int getMaxPerPass() {
        return maxPerPass;
    }

    public void setMaxPerPass(int maxPerPass) {
        this.maxPerPass = maxPerPass;
    }

    public int getMaxConsecutiveTransientFailures() {
        return maxConsecutiveTransientFailures;
    }

    public void setMaxConsecutiveTransientFailures(int maxConsecutiveTransientFailures) {
        this.maxConsecutiveTransientFailures = maxConsecutiveTransientFailures;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isValidateRecipients() {
        return validateRecipients;
    }

    public void setValidateRecipients(boolean validateRecipients) {
        this.validateRecipients = validateRecipients;
    }

    public String getDefaultRecipientId() {
        return defaultRecipientId;
    }

    public void setDefaultRecipientId(String defaultRecipientId) {
        this.defaultRecipientId = defaultRecipientId;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Letta getLetta() {
        return letta;
    }

    /**
     * Per-message retry settings.
     */
    public static class Delivery {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Letta {
        private String baseUrl = LettaClientSettings.DEFAULT_BASE_URL;
        private String apiKey;
        private String serverPassword;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public LettaClientSettings toSettings() {
            return new LettaClientSettings(baseUrl, apiKey, serverPassword, connectTimeout, readTimeout);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getServerPassword() {
            return serverPassword;
        }

        public void setServerPassword(String serverPassword) {
            this.serverPassword = serverPassword;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
