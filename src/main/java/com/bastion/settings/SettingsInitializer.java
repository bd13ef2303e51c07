package com.bastion.settings;

import com.bastion.export.BlacklistExporter;
import com.bastion.storage.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Startup step: seeds missing settings rows with their defaults and creates
 * the export directory tree. Existing values are left alone.
 */
@Component
public class SettingsInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SettingsInitializer.class);

    private final SettingsRepository settingsRepository;
    private final BlacklistExporter exporter;
    private final Clock clock;

    public SettingsInitializer(SettingsRepository settingsRepository, BlacklistExporter exporter, Clock clock) {
        this.settingsRepository = settingsRepository;
        this.exporter = exporter;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        seedDefaults();
        exporter.ensureDirectories();
        log.info("Blacklist export directory: {}", exporter.getBaseDir());
    }

    int seedDefaults() {
        Instant now = clock.instant();
        int seeded = 0;
        for (Map.Entry<String, String> entry : SettingsKeys.defaults().entrySet()) {
            if (settingsRepository.insertIfAbsent(entry.getKey(), entry.getValue(), now)) {
                log.info("Seeded default setting {}={}", entry.getKey(), entry.getValue());
                seeded++;
            }
        }
        return seeded;
    }
}
