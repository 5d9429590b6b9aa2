package com.ivamare.interactions;

import com.ivamare.interactions.model.DeferPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for interaction dispatch.
 *
 * <p>Example configuration:
 * <pre>
 * interactions:
 *   enabled: true
 *   application-id: 123456789012345678
 *   public-key: 8b2e...hex
 *   path: /interactions
 *   auto-defer:
 *     enabled: true
 *     timeout: 2s
 *     ephemeral: false
 *   followup:
 *     base-url: https://discord.com/api/v10
 *   continuation:
 *     shutdown-timeout: 10s
 * </pre>
 */
@ConfigurationProperties(prefix = "interactions")
public class InteractionsProperties {

    /**
     * Enable/disable interaction dispatch auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Application id used to address the follow-up webhook.
     */
    private String applicationId;

    /**
     * Hex-encoded Ed25519 public key used to verify inbound requests. The web
     * endpoint is only registered when this is set.
     */
    private String publicKey;

    /**
     * Request path of the interaction endpoint.
     */
    private String path = "/interactions";

    /**
     * Client-wide auto-defer defaults.
     */
    private AutoDeferProperties autoDefer = new AutoDeferProperties();

    /**
     * Follow-up webhook client configuration.
     */
    private FollowupProperties followup = new FollowupProperties();

    /**
     * Background continuation configuration.
     */
    private ContinuationProperties continuation = new ContinuationProperties();

    /**
     * @return client default defer policy built from {@code auto-defer.*}
     */
    public DeferPolicy toDeferPolicy() {
        return new DeferPolicy(autoDefer.isEnabled(), autoDefer.getTimeout(), autoDefer.isEphemeral());
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void setApplicationId(String applicationId) {
        this.applicationId = applicationId;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public AutoDeferProperties getAutoDefer() {
        return autoDefer;
    }

    public void setAutoDefer(AutoDeferProperties autoDefer) {
        this.autoDefer = autoDefer;
    }

    public FollowupProperties getFollowup() {
        return followup;
    }

    public void setFollowup(FollowupProperties followup) {
        this.followup = followup;
    }

    public ContinuationProperties getContinuation() {
        return continuation;
    }

    public void setContinuation(ContinuationProperties continuation) {
        this.continuation = continuation;
    }

    /**
     * Auto-defer configuration properties.
     */
    public static class AutoDeferProperties {

        /**
         * Race handlers against the defer timer unless a registration overrides it.
         */
        private boolean enabled = false;

        /**
         * How long a handler may run before a deferred acknowledgment is sent.
         */
        private Duration timeout = Duration.ofSeconds(2);

        /**
         * Whether automatic deferrals are ephemeral.
         */
        private boolean ephemeral = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isEphemeral() {
            return ephemeral;
        }

        public void setEphemeral(boolean ephemeral) {
            this.ephemeral = ephemeral;
        }
    }

    /**
     * Follow-up webhook configuration properties.
     */
    public static class FollowupProperties {

        /**
         * Base URL of the platform REST API.
         */
        private String baseUrl = "https://discord.com/api/v10";

        /**
         * User-Agent header sent with follow-up requests.
         */
        private String userAgent = "interaction-dispatch (https://github.com/ivamare, 0.1.0)";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    /**
     * Background continuation configuration properties.
     */
    public static class ContinuationProperties {

        /**
         * How long shutdown waits for in-flight continuations.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }
}
