package com.bastion.export;

import com.bastion.domain.IndicatorType;
import com.bastion.settings.PipelineSettings;
import com.bastion.storage.IndicatorRepository;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Materialises the active indicator set as numbered plain-text files.
 *
 * Layout under the base directory:
 * <pre>
 * IP/BlackIP0.txt ...           one address or CIDR per line
 * Domain/BlackDomain0.txt ...   each domain twice: bare and *.domain
 * Hash/BlackHash0.txt ...
 * URL/BlackURL0.txt ...
 * SoarURL/BlackSoarURL0.txt ... only while soar-url is enabled
 * Proxy/ProxyDomain0.txt ...    define category / "entry" / end blocks
 * Proxy/ProxyURL0.txt ...
 * </pre>
 *
 * Key Responsibilities:
 * - Read the active values per indicator type from {@link IndicatorRepository}
 * - Split each family into files of at most maxFileSize entries, numbered
 *   from 0 in repository order
 * - Write each file through {@link AtomicFileWriter} so a reader never sees
 *   a half-written file
 * - Delete numbered files left over from a larger previous generation once
 *   the new set is in place, leaving unrelated files in the directories alone
 * - Render the proxy category files using the category names from
 *   {@link PipelineSettings}
 *
 * Generations never overlap; a single lock serialises every caller.
 * Files are served read-only under {@value #PUBLIC_URL_PREFIX}.
 *
 * @see BlacklistExportService
 * @see ExportReport
 */
@Component
public class BlacklistExporter {

    private static final Logger log = LoggerFactory.getLogger(BlacklistExporter.class);

    public static final String PUBLIC_URL_PREFIX = "/public/blacklist";

    private static final String[] DIRECTORIES = {"IP", "Domain", "Hash", "URL", "Proxy"};

    private final IndicatorRepository indicatorRepository;
    private final AtomicFileWriter fileWriter;
    private final ExportMetrics metrics;
    private final Clock clock;
    private final Path baseDir;
    private final ReentrantLock generationLock = new ReentrantLock();

    @Autowired
    public BlacklistExporter(IndicatorRepository indicatorRepository,
                             AtomicFileWriter fileWriter,
                             ExportMetrics metrics,
                             Clock clock,
                             @Value("${bastion.export.base-dir:./public/blacklist}") String baseDir) {
        this(indicatorRepository, fileWriter, metrics, clock, Paths.get(baseDir));
    }

    BlacklistExporter(IndicatorRepository indicatorRepository, AtomicFileWriter fileWriter,
                      ExportMetrics metrics, Clock clock, Path baseDir) {
        this.indicatorRepository = indicatorRepository;
        this.fileWriter = fileWriter;
        this.metrics = metrics;
        this.clock = clock;
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    /**
     * Regenerate every file family from the current store contents.
     * Blocks while another generation is in progress.
     */
    public ExportReport generate(PipelineSettings settings) {
        generationLock.lock();
        try {
            long start = System.nanoTime();
            ExportReport report = new ExportReport(clock.instant());
            ensureDirectories();

            for (ExportTarget target : ExportTarget.values()) {
                try {
                    publish(target, settings, report);
                } catch (IOException | UncheckedIOException | DataAccessException e) {
                    log.error("Failed to publish {} files", target.getPrefix(), e);
                    report.failed(target, e.getMessage());
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            report.finish(elapsed);
            metrics.recordGeneration(report, elapsed);
            log.info("Blacklist export finished: {}", report);
            return report;
        } finally {
            generationLock.unlock();
        }
    }

    public void ensureDirectories() {
        for (String directory : DIRECTORIES) {
            try {
                Files.createDirectories(baseDir.resolve(directory));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create export directory " + directory, e);
            }
        }
    }

    /**
     * Files currently published, grouped by directory.
     */
    public Map<String, List<PublishedFile>> listPublishedFiles() {
        Map<String, List<PublishedFile>> result = new LinkedHashMap<>();
        for (String directory : publishedDirectories()) {
            Path dir = baseDir.resolve(directory);
            List<PublishedFile> files = new ArrayList<>();
            if (Files.isDirectory(dir)) {
                try (Stream<Path> stream = Files.list(dir)) {
                    stream.filter(p -> p.getFileName().toString().endsWith(".txt"))
                        .sorted(Comparator.comparing(BlacklistExporter::naturalKey))
                        .forEach(p -> files.add(describe(directory, p)));
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot list " + dir, e);
                }
            }
            result.put(directory, files);
        }
        return result;
    }

    public Map<IndicatorType, Long> getIndicatorCounts() {
        return indicatorRepository.countActiveByType();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    private void publish(ExportTarget target, PipelineSettings settings, ExportReport report) throws IOException {
        List<String> entries = entriesFor(target, settings);
        List<List<String>> chunks = entries.isEmpty()
            ? List.of()
            : Lists.partition(entries, settings.getMaxFileSize());

        Path dir = baseDir.resolve(target.getDirectory());
        for (int i = 0; i < chunks.size(); i++) {
            List<String> lines = target.isProxyFormat()
                ? proxyBlock(categoryFor(target, settings), chunks.get(i))
                : chunks.get(i);
            fileWriter.write(dir.resolve(target.fileName(i)), lines);
        }
        removeStaleFiles(dir, target, chunks.size());

        report.published(target, chunks.size(), entries.size());
        log.debug("Published {} {} file(s) with {} entries", chunks.size(), target.getPrefix(), entries.size());
    }

    private List<String> entriesFor(ExportTarget target, PipelineSettings settings) {
        if (target == ExportTarget.SOAR_URL && !settings.isSoarUrlEnabled()) {
            return List.of();
        }

        List<String> values = indicatorRepository.findActiveValues(target.getType());
        if (target == ExportTarget.DOMAIN) {
            List<String> expanded = new ArrayList<>(values.size() * 2);
            for (String domain : values) {
                expanded.add(domain);
                expanded.add("*." + domain);
            }
            return expanded;
        }
        if (target.isProxyFormat()) {
            List<String> quoted = new ArrayList<>(values.size());
            for (String value : values) {
                quoted.add("\"" + value.replace("\"", "%22") + "\"");
            }
            return quoted;
        }
        return values;
    }

    private static String categoryFor(ExportTarget target, PipelineSettings settings) {
        return target == ExportTarget.PROXY_DOMAIN ? settings.getDomainCategory() : settings.getUrlCategory();
    }

    static List<String> proxyBlock(String category, List<String> quotedEntries) {
        List<String> lines = new ArrayList<>(quotedEntries.size() + 2);
        lines.add("define category " + category);
        lines.addAll(quotedEntries);
        lines.add("end");
        return lines;
    }

    /**
     * Delete {@code <prefix><n>.txt} for every n at or beyond {@code keep}.
     */
    private void removeStaleFiles(Path dir, ExportTarget target, int keep) throws IOException {
        if (!Files.isDirectory(dir)) {
            return;
        }
        Pattern numbered = Pattern.compile("^" + Pattern.quote(target.getPrefix()) + "(\\d+)\\.txt$");
        List<Path> stale = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.forEach(path -> {
                Matcher matcher = numbered.matcher(path.getFileName().toString());
                if (matcher.matches() && Integer.parseInt(matcher.group(1)) >= keep) {
                    stale.add(path);
                }
            });
        }
        for (Path path : stale) {
            Files.deleteIfExists(path);
            log.debug("Removed stale export file {}", path.getFileName());
        }
    }

    private List<String> publishedDirectories() {
        List<String> directories = new ArrayList<>(List.of(DIRECTORIES));
        if (Files.isDirectory(baseDir.resolve(ExportTarget.SOAR_URL.getDirectory()))) {
            directories.add(ExportTarget.SOAR_URL.getDirectory());
        }
        return directories;
    }

    private PublishedFile describe(String directory, Path file) {
        try {
            String name = file.getFileName().toString();
            return new PublishedFile(name, PUBLIC_URL_PREFIX + "/" + directory + "/" + name,
                Files.size(file), Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + file, e);
        }
    }

    /**
     * Sort key that orders BlackIP2 before BlackIP10.
     */
    private static String naturalKey(Path path) {
        String name = path.getFileName().toString();
        Matcher matcher = Pattern.compile("^(\\D*)(\\d+)(.*)$").matcher(name);
        if (matcher.matches()) {
            return matcher.group(1) + String.format("%010d", Long.parseLong(matcher.group(2))) + matcher.group(3);
        }
        return name;
    }
}
