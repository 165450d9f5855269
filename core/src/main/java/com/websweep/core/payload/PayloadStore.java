package com.websweep.core.payload;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * SQLi/XSS 페이로드 저장소.
 * <p>
 * payload_dir 아래 파일을 읽고, 없거나 읽을 수 없으면 {@link DefaultPayloads}로 채운다.
 * <ul>
 *   <li>{@code sqli_payloads.json}: [{name, payload, expected_result}] (없으면 내장 5종)</li>
 *   <li>{@code sql.txt}: 한 줄에 하나, 구조화 목록 뒤에 중복 없이 덧붙는다</li>
 *   <li>{@code xss.txt}: 한 줄에 하나 (없으면 내장 21종)</li>
 * </ul>
 * 스캐너 스레드가 동시에 읽으므로 {@link ReentrantReadWriteLock}으로 보호한다.
 * 디스크 I/O가 실패해도 메모리 상태로 계속 동작한다.
 */
public final class PayloadStore {
    private static final Logger LOG = LoggerFactory.getLogger(PayloadStore.class);

    public static final String SQL_JSON = "sqli_payloads.json";
    public static final String SQL_TXT = "sql.txt";
    public static final String XSS_TXT = "xss.txt";

    private final Path dir;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private List<SqlPayload> sql = List.of();
    private List<String> xss = List.of();

    /** dir이 null이면 내장 기본값만 사용 */
    public PayloadStore(Path dir) {
        this.dir = dir;
        reload();
    }

    public static PayloadStore defaults() {
        return new PayloadStore(null);
    }

    /**
     * 설정 기반 생성. sql_payloads/xss_payloads가 명시되어 있으면 파일보다 우선한다.
     */
    public static PayloadStore from(ScanConfig cfg) {
        PayloadStore store = new PayloadStore(cfg.getPayloadDir());
        if (cfg.getSqlPayloads() != null) {
            store.replaceSql(cfg.getSqlPayloads().stream().map(SqlPayload::plain).toList());
        }
        if (cfg.getXssPayloads() != null) {
            store.replaceXss(cfg.getXssPayloads());
        }
        return store;
    }

    // -----------------------------------------------------------------------
    // 조회
    // -----------------------------------------------------------------------

    public List<SqlPayload> sqlPayloads() {
        lock.readLock().lock();
        try {
            return sql;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> xssPayloads() {
        lock.readLock().lock();
        try {
            return xss;
        } finally {
            lock.readLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // 변경
    // -----------------------------------------------------------------------

    /** 디렉터리에서 다시 읽는다 */
    public void reload() {
        List<SqlPayload> s = loadSql();
        List<String> x = readLines(XSS_TXT);
        if (x.isEmpty()) x = DefaultPayloads.XSS;

        lock.writeLock().lock();
        try {
            this.sql = s;
            this.xss = List.copyOf(x);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("payloads loaded: sql={} xss={} dir={}", s.size(), x.size(), dir);
    }

    public void replaceSql(List<SqlPayload> payloads) {
        List<SqlPayload> copy = dedupe(payloads);
        lock.writeLock().lock();
        try {
            this.sql = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void replaceXss(List<String> payloads) {
        List<String> copy = new ArrayList<>(new LinkedHashSet<>(nonBlank(payloads)));
        lock.writeLock().lock();
        try {
            this.xss = List.copyOf(copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -----------------------------------------------------------------------
    // 파일 I/O
    // -----------------------------------------------------------------------

    private List<SqlPayload> loadSql() {
        List<SqlPayload> out = new ArrayList<>(readStructured());
        if (out.isEmpty()) out.addAll(DefaultPayloads.SQL_STRUCTURED);

        List<String> plain = readLines(SQL_TXT);
        if (plain.isEmpty()) plain = DefaultPayloads.SQL_PLAIN;
        for (String p : plain) out.add(SqlPayload.plain(p));
        return dedupe(out);
    }

    private List<SqlPayload> readStructured() {
        Path f = resolve(SQL_JSON);
        if (f == null) return List.of();
        try {
            List<SqlPayload> list = Json.mapper().readValue(f.toFile(), new TypeReference<List<SqlPayload>>() {});
            return list == null ? List.of() : list.stream().filter(p -> !p.payload().isBlank()).toList();
        } catch (JacksonException e) {
            LOG.warn("{} is not a valid payload list ({}); using built-in payloads", f, e.getOriginalMessage());
            return List.of();
        } catch (IOException e) {
            LOG.warn("cannot read {}: {}; using built-in payloads", f, e.getMessage());
            return List.of();
        }
    }

    private List<String> readLines(String name) {
        Path f = resolve(name);
        if (f == null) return List.of();
        try {
            return nonBlank(Files.readAllLines(f, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("cannot read {}: {}; using built-in payloads", f, e.getMessage());
            return List.of();
        }
    }

    private Path resolve(String name) {
        if (dir == null) return null;
        Path f = dir.resolve(name);
        return Files.isRegularFile(f) ? f : null;
    }

    private static List<String> nonBlank(List<String> lines) {
        if (lines == null) return List.of();
        return lines.stream().filter(l -> l != null && !l.isBlank()).map(String::strip).toList();
    }

    /** 같은 payload 문자열은 처음 것만 유지 */
    private static List<SqlPayload> dedupe(List<SqlPayload> in) {
        Set<String> seen = new LinkedHashSet<>();
        List<SqlPayload> out = new ArrayList<>();
        if (in == null) return List.of();
        for (SqlPayload p : in) {
            if (p != null && !p.payload().isBlank() && seen.add(p.payload())) out.add(p);
        }
        return List.copyOf(out);
    }
}
