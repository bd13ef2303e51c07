package com.bastion.settings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings table keys read by the pipeline, with their seeded defaults.
 */
public final class SettingsKeys {

    public static final String DEFAULT_FETCH_INTERVAL = "system.defaultFetchInterval";
    public static final String MAX_FILE_SIZE = "system.maxFileSize";
    public static final String BLACKLIST_UPDATE_INTERVAL = "system.blacklistUpdateInterval";
    public static final String ENABLE_SOAR_URL = "system.enableSoarUrl";

    public static final String PROXY_ENABLED = "proxy.enabled";
    public static final String PROXY_HOST = "proxy.host";
    public static final String PROXY_PORT = "proxy.port";
    public static final String PROXY_USERNAME = "proxy.username";
    public static final String PROXY_PASSWORD = "proxy.password";

    public static final String PROXY_FORMAT_DOMAIN_CATEGORY = "proxyFormat.domainCategory";
    public static final String PROXY_FORMAT_URL_CATEGORY = "proxyFormat.urlCategory";

    public static final int DEFAULT_FETCH_INTERVAL_SECONDS = 3600;
    public static final int DEFAULT_MAX_FILE_SIZE = 100_000;
    public static final int DEFAULT_BLACKLIST_UPDATE_MINUTES = 5;
    public static final String DEFAULT_DOMAIN_CATEGORY = "blocked_domains";
    public static final String DEFAULT_URL_CATEGORY = "blocked_urls";

    private SettingsKeys() {
    }

    /**
     * Rows inserted at startup when missing. Proxy host and credentials have
     * no default and are left unset.
     */
    public static Map<String, String> defaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(DEFAULT_FETCH_INTERVAL, String.valueOf(DEFAULT_FETCH_INTERVAL_SECONDS));
        defaults.put(MAX_FILE_SIZE, String.valueOf(DEFAULT_MAX_FILE_SIZE));
        defaults.put(BLACKLIST_UPDATE_INTERVAL, String.valueOf(DEFAULT_BLACKLIST_UPDATE_MINUTES));
        defaults.put(ENABLE_SOAR_URL, "false");
        defaults.put(PROXY_ENABLED, "false");
        defaults.put(PROXY_FORMAT_DOMAIN_CATEGORY, DEFAULT_DOMAIN_CATEGORY);
        defaults.put(PROXY_FORMAT_URL_CATEGORY, DEFAULT_URL_CATEGORY);
        return defaults;
    }
}
