package com.bastion.export;

import com.bastion.domain.HashType;
import com.bastion.domain.IndicatorType;
import com.bastion.settings.PipelineSettings;
import com.bastion.storage.IndicatorRepository;
import com.bastion.storage.TestDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BlacklistExporter Tests")
class BlacklistExporterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path baseDir;

    private IndicatorRepository repository;
    private BlacklistExporter exporter;

    @BeforeEach
    void setUp() {
        repository = new IndicatorRepository(TestDatabase.create());
        exporter = new BlacklistExporter(repository, new AtomicFileWriter(),
            new ExportMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), baseDir);
    }

    @Test
    @DisplayName("Should split entries into files of at most maxFileSize lines")
    void shouldChunkByMaxFileSize() throws IOException {
        // Given
        for (int i = 1; i <= 5; i++) {
            add("192.0.2." + i, IndicatorType.IP);
        }

        // When
        ExportReport report = exporter.generate(settings(2, false));

        // Then
        assertThat(report.hasErrors()).isFalse();
        assertThat(report.fileCount(ExportTarget.IP)).isEqualTo(3);
        assertThat(report.entryCount(ExportTarget.IP)).isEqualTo(5);
        assertThat(read("IP/BlackIP0.txt")).containsExactly("192.0.2.1", "192.0.2.2");
        assertThat(read("IP/BlackIP1.txt")).containsExactly("192.0.2.3", "192.0.2.4");
        assertThat(read("IP/BlackIP2.txt")).containsExactly("192.0.2.5");
        assertThat(Files.readString(baseDir.resolve("IP/BlackIP2.txt"))).isEqualTo("192.0.2.5\n");
    }

    @Test
    @DisplayName("Should publish each domain bare and as a wildcard")
    void shouldExpandDomains() throws IOException {
        // Given
        add("evil.example.com", IndicatorType.DOMAIN);

        // When
        exporter.generate(settings(100, false));

        // Then
        assertThat(read("Domain/BlackDomain0.txt")).containsExactly("evil.example.com", "*.evil.example.com");
    }

    @Test
    @DisplayName("Should leave inactive indicators out of the files")
    void shouldSkipInactiveIndicators() throws IOException {
        // Given
        add("198.51.100.1", IndicatorType.IP);
        add("198.51.100.2", IndicatorType.IP);
        var inactive = repository.findByValueAndType("198.51.100.2", IndicatorType.IP).orElseThrow();
        inactive.setActive(false);
        repository.update(inactive, NOW);

        // When
        exporter.generate(settings(100, false));

        // Then
        assertThat(read("IP/BlackIP0.txt")).containsExactly("198.51.100.1");
    }

    @Test
    @DisplayName("Should wrap proxy entries in quoted category blocks")
    void shouldWriteProxyFormat() throws IOException {
        // Given
        add("evil.example.com", IndicatorType.DOMAIN);
        add("http://bad.example.net/a\"b", IndicatorType.URL);
        PipelineSettings settings = PipelineSettings.builder()
            .maxFileSize(100)
            .domainCategory("threat_domains")
            .build();

        // When
        exporter.generate(settings);

        // Then
        assertThat(read("Proxy/ProxyDomain0.txt"))
            .containsExactly("define category threat_domains", "\"evil.example.com\"", "end");
        assertThat(read("Proxy/ProxyURL0.txt"))
            .containsExactly("define category blocked_urls", "\"http://bad.example.net/a%22b\"", "end");
        assertThat(read("URL/BlackURL0.txt")).containsExactly("http://bad.example.net/a\"b");
    }

    @Test
    @DisplayName("Should delete numbered files left over from a larger generation")
    void shouldRemoveStaleFiles() throws IOException {
        // Given
        for (int i = 1; i <= 5; i++) {
            add("0123456789abcdef0123456789abcde" + i, IndicatorType.HASH);
        }
        exporter.generate(settings(2, false));
        Path unrelated = baseDir.resolve("Hash/README.txt");
        Files.writeString(unrelated, "keep me");

        // When
        exporter.generate(settings(10, false));

        // Then
        assertThat(baseDir.resolve("Hash/BlackHash0.txt")).exists();
        assertThat(baseDir.resolve("Hash/BlackHash1.txt")).doesNotExist();
        assertThat(baseDir.resolve("Hash/BlackHash2.txt")).doesNotExist();
        assertThat(unrelated).exists();
        assertThat(read("Hash/BlackHash0.txt")).hasSize(5);
    }

    @Test
    @DisplayName("Should publish soar-url files only while the feature is enabled")
    void shouldToggleSoarUrlFiles() {
        // Given
        add("https://phish.example.org/login", IndicatorType.SOAR_URL);
        exporter.generate(settings(100, true));
        assertThat(baseDir.resolve("SoarURL/BlackSoarURL0.txt")).exists();

        // When
        ExportReport report = exporter.generate(settings(100, false));

        // Then
        assertThat(report.fileCount(ExportTarget.SOAR_URL)).isZero();
        assertThat(baseDir.resolve("SoarURL/BlackSoarURL0.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Should produce no files for an empty store")
    void shouldHandleEmptyStore() {
        ExportReport report = exporter.generate(settings(100, false));

        assertThat(report.hasErrors()).isFalse();
        assertThat(exporter.listPublishedFiles())
            .containsOnlyKeys("IP", "Domain", "Hash", "URL", "Proxy")
            .allSatisfy((dir, files) -> assertThat(files).isEmpty());
    }

    @Test
    @DisplayName("Should list published files in natural order with public paths")
    void shouldListPublishedFiles() {
        // Given
        for (int i = 1; i <= 12; i++) {
            add("203.0.113." + i, IndicatorType.IP);
        }
        exporter.generate(settings(1, false));

        // When
        Map<String, List<PublishedFile>> files = exporter.listPublishedFiles();

        // Then
        assertThat(files.get("IP")).hasSize(12);
        assertThat(files.get("IP").get(2).getName()).isEqualTo("BlackIP2.txt");
        assertThat(files.get("IP").get(10).getName()).isEqualTo("BlackIP10.txt");
        assertThat(files.get("IP").get(0).getPath()).isEqualTo("/public/blacklist/IP/BlackIP0.txt");
    }

    private void add(String value, IndicatorType type) {
        HashType hashType = type == IndicatorType.HASH ? HashType.MD5 : null;
        repository.upsert(value, type, hashType, "test-feed", null, NOW);
    }

    private List<String> read(String relative) throws IOException {
        return Files.readAllLines(baseDir.resolve(relative), StandardCharsets.UTF_8);
    }

    private static PipelineSettings settings(int maxFileSize, boolean soarUrlEnabled) {
        return PipelineSettings.builder()
            .maxFileSize(maxFileSize)
            .soarUrlEnabled(soarUrlEnabled)
            .build();
    }
}
