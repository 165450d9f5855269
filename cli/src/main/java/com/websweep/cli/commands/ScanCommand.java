package com.websweep.cli.commands;

import com.websweep.cli.ConsoleReport;
import com.websweep.cli.logging.LogSetup;
import com.websweep.core.event.ScanEventListener;
import com.websweep.core.event.StructuredLogEventListener;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.service.ScanException;
import com.websweep.core.service.ScanService;
import com.websweep.core.service.ScanState;
import com.websweep.core.service.sink.FallbackResultSink;
import com.websweep.core.service.sink.LocalJsonResultSink;
import com.websweep.core.service.sink.RemoteResultSink;
import com.websweep.core.service.sink.ResultSink;
import com.websweep.core.util.ProgressListener;
import com.websweep.core.util.UrlUtils;
import com.websweep.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * websweep scan &lt;url&gt;.
 * 설정 적용 순서: 기본값 → --config(YAML/JSON) → SCANNER_* 환경변수 → CLI 옵션.
 * 종료 코드: 0 완료(발견 여부 무관), 1 스캔 실패, 2 설정 오류.
 */
@CommandLine.Command(name = "scan", description = "Crawl a target and run all enabled security checks")
public class ScanCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ScanCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCAN_FAILED = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    /** 종료 훅이 drain + 저장을 기다리는 여유(request_timeout 에 더함) */
    static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(30);

    @CommandLine.Parameters(index = "0", description = "Target URL (http/https)")
    String target;
    @CommandLine.Option(names = "--scan-id", description = "Scan ID (default: random UUID)")
    String scanId;
    @CommandLine.Option(names = "--config", description = "Config file (scan.yml or .json)")
    Path configFile;
    @CommandLine.Option(names = "--output-dir", description = "Directory for result files and logs")
    Path outputDir;
    @CommandLine.Option(names = "--max-depth", description = "Crawl depth cap")
    Integer maxDepth;
    @CommandLine.Option(names = "--max-pages", description = "Total visited-page cap")
    Integer maxPages;
    @CommandLine.Option(names = "--threads", description = "Worker pool size")
    Integer threads;
    @CommandLine.Option(names = "--remote-endpoint", description = "Remote result store base URL (falls back to local JSON)")
    String remoteEndpoint;

    private final Map<String, String> env;
    private final PrintStream out;

    public ScanCommand() {
        this(System.getenv(), System.out);
    }

    ScanCommand(Map<String, String> env, PrintStream out) {
        this.env = env;
        this.out = out;
    }

    @Override
    public Integer call() {
        // ---- 1) 설정 ----
        ScanConfig config;
        try {
            config = buildConfig();
            config.validate();
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        LogSetup.configure(config.getOutputDir());

        // ---- 2) 싱크 ----
        ScanEventListener events = new StructuredLogEventListener();
        ResultSink local = new LocalJsonResultSink(config.getOutputDir());
        ResultSink sink = local;
        if (remoteEndpoint != null && !remoteEndpoint.isBlank()) {
            URI endpoint = UrlUtils.parse(remoteEndpoint);
            if (endpoint == null) {
                System.err.println("Configuration error: invalid --remote-endpoint " + remoteEndpoint);
                return EXIT_CONFIG_ERROR;
            }
            sink = new FallbackResultSink(new RemoteResultSink(endpoint), local, events);
        }

        // ---- 3) 스캔 ----
        ScanService service = ScanService.builder(config)
                .sink(sink)
                .events(events)
                .progress(progressLogger())
                .build();
        Thread hook = new Thread(() -> cancelAndWait(service, shutdownGrace(config)), "ws-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            service.startScan(target, scanId);
        } catch (ScanException e) {
            LOG.error("Scan failed: {}", e.getMessage());
            System.err.println("Scan failed: " + e.getMessage());
            return EXIT_SCAN_FAILED;
        } finally {
            removeHook(hook);
        }

        // ---- 4) 요약 ----
        ScanResultBundle bundle = service.getResults();
        ConsoleReport.print(bundle, config.getOutputDir().toAbsolutePath().toString(), out);
        return service.state() == ScanState.COMPLETED ? EXIT_OK : EXIT_SCAN_FAILED;
    }

    /** 기본값 → 파일 → 환경변수 → CLI 옵션 */
    ScanConfig buildConfig() throws IOException {
        ScanConfig cfg = ScanConfig.defaults();
        if (configFile != null) YamlConfigLoader.applyFile(configFile, cfg);
        YamlConfigLoader.applyEnvironment(cfg, env);

        cfg.setTarget(target);
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (maxDepth != null) cfg.setMaxDepth(maxDepth);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (threads != null) cfg.setThreads(threads);
        return cfg;
    }

    /* --- 헬퍼 --- */

    private static ProgressListener progressLogger() {
        return (percent, phase, done, total) -> LOG.debug("progress {}% phase={} pages={}/{}", percent, phase, done, total);
    }

    /** 종료 훅 본체: 취소 후 진행 중 페이지 drain 과 결과 저장이 끝나기를 기다린다 */
    static boolean cancelAndWait(ScanService service, Duration grace) {
        service.cancel();
        try {
            boolean done = service.awaitCompletion(grace);
            if (!done) LOG.warn("Scan did not finish within {}; exiting without saved results", grace);
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Duration shutdownGrace(ScanConfig config) {
        return config.getRequestTimeout().plus(SHUTDOWN_MARGIN);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM shutting down; hook stays registered");
        }
    }
}
