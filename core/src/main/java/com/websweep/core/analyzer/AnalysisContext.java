package com.websweep.core.analyzer;

import com.websweep.core.analyzer.budget.ActiveProbeGate;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.api.IHttpClient;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.event.ScanEventListener;
import com.websweep.core.http.CachingTlsProbe;
import com.websweep.core.http.SocketTlsProbe;
import com.websweep.core.http.TlsProbe;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.DefaultSleeper;
import com.websweep.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 체크들이 공유하는 스캔 단위 협력 객체 묶음.
 * 체크 자체는 상태를 갖지 않고, 스캔 범위 상태(1회성 키, 프로브 예산)는 여기에만 둔다.
 */
public final class AnalysisContext {

    private final ScanConfig config;
    private final IHttpClient http;
    private final ActiveProbeGate gate;
    private final Sleeper sleeper;
    private final TlsProbe tlsProbe;
    private final VulnerableLibraryTable libraries;
    private final ScanEventListener events;
    private final Set<String> onceKeys = ConcurrentHashMap.newKeySet();

    private AnalysisContext(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.http = Objects.requireNonNull(b.http, "http");
        this.gate = (b.gate != null) ? b.gate : ActiveProbeGate.from(b.config);
        this.sleeper = (b.sleeper != null) ? b.sleeper : DefaultSleeper.INSTANCE;
        this.tlsProbe = (b.tlsProbe != null) ? b.tlsProbe : new CachingTlsProbe(new SocketTlsProbe());
        this.libraries = (b.libraries != null) ? b.libraries : VulnerableLibraryTable.load(b.config.getVulnerableLibrariesFile());
        this.events = (b.events != null) ? b.events : ScanEventListener.NONE;
    }

    public ScanConfig config() { return config; }
    public IHttpClient http() { return http; }
    public ActiveProbeGate gate() { return gate; }
    public Sleeper sleeper() { return sleeper; }
    public TlsProbe tlsProbe() { return tlsProbe; }
    public VulnerableLibraryTable libraries() { return libraries; }
    public ScanEventListener events() { return events; }

    /** 스캔 중 key가 처음이면 true (origin당 1회 스윕 등) */
    public boolean firstTime(String key) {
        return onceKeys.add(key);
    }

    /**
     * 능동 프로브 시작 허가: 토글이 꺼져 있으면 조용히 false,
     * 예산이 모자라면 PROBE_SKIPPED 이벤트 후 false.
     */
    public boolean reserve(ActiveProbeGate.Probe probe, int requests, String target) {
        if (!gate.isEnabled(probe)) return false;
        if (gate.tryReserve(requests)) return true;
        events.onEvent(ScanEvent.of(ScanEvent.Kind.PROBE_SKIPPED, "active probe budget exhausted",
                "probe", probe.name(), "target", target, "requests", requests, "remaining", gate.remaining()));
        return false;
    }

    /** 능동 요청 사이 대기. 인터럽트되면 플래그를 복구하고 false. */
    public boolean pause(Duration d) {
        try {
            sleeper.sleep(d);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** 능동 요청 직전 RPS 대기. 인터럽트되면 false. */
    public boolean pace() {
        try {
            gate.pace();
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder(ScanConfig config, IHttpClient http) {
        return new Builder(config, http);
    }

    public static final class Builder {
        private final ScanConfig config;
        private final IHttpClient http;
        private ActiveProbeGate gate;
        private Sleeper sleeper;
        private TlsProbe tlsProbe;
        private VulnerableLibraryTable libraries;
        private ScanEventListener events;

        private Builder(ScanConfig config, IHttpClient http) {
            this.config = config;
            this.http = http;
        }

        public Builder gate(ActiveProbeGate gate) { this.gate = gate; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
        public Builder tlsProbe(TlsProbe tlsProbe) { this.tlsProbe = tlsProbe; return this; }
        public Builder libraries(VulnerableLibraryTable libraries) { this.libraries = libraries; return this; }
        public Builder events(ScanEventListener events) { this.events = events; return this; }

        public AnalysisContext build() { return new AnalysisContext(this); }
    }
}
