package com.bastion.settings;

import com.bastion.storage.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Builds {@link PipelineSettings} snapshots from the settings table.
 *
 * Missing or unparseable values fall back to their defaults; a bad value in
 * the table never stops a fetch or export from running.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final SettingsRepository settingsRepository;

    public SettingsService(SettingsRepository settingsRepository) {
        this.settingsRepository = settingsRepository;
    }

    public PipelineSettings snapshot() {
        return fromMap(settingsRepository.findAll());
    }

    static PipelineSettings fromMap(Map<String, String> raw) {
        ProxySettings proxy = new ProxySettings(
            parseBoolean(raw.get(SettingsKeys.PROXY_ENABLED)),
            blankToNull(raw.get(SettingsKeys.PROXY_HOST)),
            parseInt(raw, SettingsKeys.PROXY_PORT, 0),
            blankToNull(raw.get(SettingsKeys.PROXY_USERNAME)),
            raw.get(SettingsKeys.PROXY_PASSWORD));

        int maxFileSize = parseInt(raw, SettingsKeys.MAX_FILE_SIZE, SettingsKeys.DEFAULT_MAX_FILE_SIZE);
        if (maxFileSize < 1) {
            log.warn("Ignoring non-positive {}={}, using {}", SettingsKeys.MAX_FILE_SIZE, maxFileSize,
                SettingsKeys.DEFAULT_MAX_FILE_SIZE);
            maxFileSize = SettingsKeys.DEFAULT_MAX_FILE_SIZE;
        }

        return PipelineSettings.builder()
            .defaultFetchInterval(parseInt(raw, SettingsKeys.DEFAULT_FETCH_INTERVAL,
                SettingsKeys.DEFAULT_FETCH_INTERVAL_SECONDS))
            .maxFileSize(maxFileSize)
            .blacklistUpdateIntervalMinutes(parseInt(raw, SettingsKeys.BLACKLIST_UPDATE_INTERVAL,
                SettingsKeys.DEFAULT_BLACKLIST_UPDATE_MINUTES))
            .soarUrlEnabled(parseBoolean(raw.get(SettingsKeys.ENABLE_SOAR_URL)))
            .proxy(proxy)
            .domainCategory(orDefault(raw.get(SettingsKeys.PROXY_FORMAT_DOMAIN_CATEGORY),
                SettingsKeys.DEFAULT_DOMAIN_CATEGORY))
            .urlCategory(orDefault(raw.get(SettingsKeys.PROXY_FORMAT_URL_CATEGORY),
                SettingsKeys.DEFAULT_URL_CATEGORY))
            .build();
    }

    private static int parseInt(Map<String, String> raw, String key, int fallback) {
        String value = raw.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for setting {}: '{}', using {}", key, value, fallback);
            return fallback;
        }
    }

    private static boolean parseBoolean(String value) {
        return value != null && Boolean.parseBoolean(value.trim());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
