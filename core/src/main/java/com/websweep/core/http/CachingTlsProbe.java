package com.websweep.core.http;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** host:port 별로 한 번만 핸드셰이크한다(스캔 단위 캐시). */
public final class CachingTlsProbe implements TlsProbe {
    private final TlsProbe delegate;
    private final Map<String, Optional<String>> cache = new ConcurrentHashMap<>();

    public CachingTlsProbe(TlsProbe delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Optional<String> negotiatedProtocol(String host, int port) {
        if (host == null) return Optional.empty();
        String key = host.toLowerCase(Locale.ROOT) + ":" + port;
        return cache.computeIfAbsent(key, k -> delegate.negotiatedProtocol(host, port));
    }
}
