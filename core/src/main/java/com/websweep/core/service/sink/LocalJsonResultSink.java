package com.websweep.core.service.sink;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.util.Json;
import com.websweep.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;

/**
 * 로컬 파일시스템 JSON 싱크. output_dir 에 7개 파일을 덮어쓴다:
 * vulnerabilities.json, scanned_links.json, scanned_forms.json, scan_summary.json,
 * scan_config.json, scanned_urls.txt, detailed_results.json.
 */
public class LocalJsonResultSink implements ResultSink {
    private static final Logger LOG = LoggerFactory.getLogger(LocalJsonResultSink.class);
    private static final StructuredLog SLOG = StructuredLog.get(LocalJsonResultSink.class);

    public static final String VULNERABILITIES = "vulnerabilities.json";
    public static final String SCANNED_LINKS = "scanned_links.json";
    public static final String SCANNED_FORMS = "scanned_forms.json";
    public static final String SCAN_SUMMARY = "scan_summary.json";
    public static final String SCAN_CONFIG = "scan_config.json";
    public static final String SCANNED_URLS = "scanned_urls.txt";
    public static final String DETAILED_RESULTS = "detailed_results.json";

    private final Path outputDir;
    private final ObjectWriter writer = Json.mapper().writerWithDefaultPrettyPrinter();

    public LocalJsonResultSink(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    public Path outputDir() { return outputDir; }

    @Override
    public SinkResult saveResults(String scanId, ScanResultBundle bundle) {
        try {
            Files.createDirectories(outputDir);

            writeJson(VULNERABILITIES, bundle.vulnerabilities());
            writeJson(SCANNED_LINKS, bundle.scannedLinks());
            writeJson(SCANNED_FORMS, bundle.scannedForms());
            writeJson(SCAN_SUMMARY, bundle.summary());
            writeJson(SCAN_CONFIG, bundle.config() != null ? bundle.config() : Map.of());
            writeText(SCANNED_URLS, String.join(System.lineSeparator(), bundle.scannedUrls()));
            writeJson(DETAILED_RESULTS, bundle);

            LOG.info("Results saved: scanId={}, dir={}, vulnerabilities={}",
                    scanId, outputDir.toAbsolutePath(), bundle.vulnerabilities().size());
            SLOG.info("results-saved",
                    "scanId", scanId,
                    "dir", outputDir.toAbsolutePath().toString(),
                    "vulnerabilities", bundle.vulnerabilities().size());
            return SinkResult.ok("Results saved to " + outputDir.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to save results to {}: {}", outputDir, e.toString());
            SLOG.error("results-save-failed", e, "scanId", scanId, "dir", outputDir.toString());
            return SinkResult.failed("Local save failed: " + e.getMessage());
        }
    }

    /** 로컬 저장소는 진행률을 로그로만 남긴다 */
    @Override
    public SinkResult updateProgress(String scanId, int percent, String message) {
        LOG.debug("progress scanId={} {}% {}", scanId, percent, message);
        return SinkResult.ok("logged");
    }

    /* --- 헬퍼 --- */

    private void writeJson(String name, Object value) throws IOException {
        writeText(name, writer.writeValueAsString(value));
    }

    private void writeText(String name, String content) throws IOException {
        Files.writeString(outputDir.resolve(name), content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
