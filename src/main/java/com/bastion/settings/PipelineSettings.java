package com.bastion.settings;

/**
 * Immutable snapshot of the runtime settings the pipeline reads.
 *
 * A snapshot is taken once per fetch or export run and handed to the
 * component explicitly, so one run never sees a half-applied settings change.
 */
public final class PipelineSettings {

    private final int defaultFetchInterval;
    private final int maxFileSize;
    private final int blacklistUpdateIntervalMinutes;
    private final boolean soarUrlEnabled;
    private final ProxySettings proxy;
    private final String domainCategory;
    private final String urlCategory;

    private PipelineSettings(Builder builder) {
        this.defaultFetchInterval = builder.defaultFetchInterval;
        this.maxFileSize = builder.maxFileSize;
        this.blacklistUpdateIntervalMinutes = builder.blacklistUpdateIntervalMinutes;
        this.soarUrlEnabled = builder.soarUrlEnabled;
        this.proxy = builder.proxy;
        this.domainCategory = builder.domainCategory;
        this.urlCategory = builder.urlCategory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings with every key at its default.
     */
    public static PipelineSettings defaults() {
        return builder().build();
    }

    public static class Builder {
        private int defaultFetchInterval = SettingsKeys.DEFAULT_FETCH_INTERVAL_SECONDS;
        private int maxFileSize = SettingsKeys.DEFAULT_MAX_FILE_SIZE;
        private int blacklistUpdateIntervalMinutes = SettingsKeys.DEFAULT_BLACKLIST_UPDATE_MINUTES;
        private boolean soarUrlEnabled;
        private ProxySettings proxy = ProxySettings.disabled();
        private String domainCategory = SettingsKeys.DEFAULT_DOMAIN_CATEGORY;
        private String urlCategory = SettingsKeys.DEFAULT_URL_CATEGORY;

        public Builder defaultFetchInterval(int defaultFetchInterval) {
            this.defaultFetchInterval = defaultFetchInterval;
            return this;
        }

        public Builder maxFileSize(int maxFileSize) {
            this.maxFileSize = maxFileSize;
            return this;
        }

        public Builder blacklistUpdateIntervalMinutes(int minutes) {
            this.blacklistUpdateIntervalMinutes = minutes;
            return this;
        }

        public Builder soarUrlEnabled(boolean soarUrlEnabled) {
            this.soarUrlEnabled = soarUrlEnabled;
            return this;
        }

        public Builder proxy(ProxySettings proxy) {
            this.proxy = proxy == null ? ProxySettings.disabled() : proxy;
            return this;
        }

        public Builder domainCategory(String domainCategory) {
            this.domainCategory = domainCategory;
            return this;
        }

        public Builder urlCategory(String urlCategory) {
            this.urlCategory = urlCategory;
            return this;
        }

        public PipelineSettings build() {
            if (maxFileSize < 1) {
                throw new IllegalArgumentException("maxFileSize must be positive: " + maxFileSize);
            }
            return new PipelineSettings(this);
        }
    }

    public int getDefaultFetchInterval() {
        return defaultFetchInterval;
    }

    public int getMaxFileSize() {
        return maxFileSize;
    }

    public int getBlacklistUpdateIntervalMinutes() {
        return blacklistUpdateIntervalMinutes;
    }

    public boolean isSoarUrlEnabled() {
        return soarUrlEnabled;
    }

    public ProxySettings getProxy() {
        return proxy;
    }

    public String getDomainCategory() {
        return domainCategory;
    }

    public String getUrlCategory() {
        return urlCategory;
    }

    @Override
    public String toString() {
        return "PipelineSettings{defaultFetchInterval=" + defaultFetchInterval + ", maxFileSize=" + maxFileSize
            + ", blacklistUpdateIntervalMinutes=" + blacklistUpdateIntervalMinutes
            + ", soarUrlEnabled=" + soarUrlEnabled + ", proxy=" + proxy + "}";
    }
}
