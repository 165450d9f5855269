package com.websweep.core.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * 실제 소켓 핸드셰이크. 클라이언트가 지원하는 모든 프로토콜을 켜고 서버가 고른 버전을 읽는다.
 * JDK 보안 설정(jdk.tls.disabledAlgorithms)이 막는 버전은 협상되지 않으므로,
 * 서버가 TLSv1.2 이상을 거부(protocol_version)하면 {@link TlsProbe#LEGACY_ONLY}를 돌려준다.
 */
public final class SocketTlsProbe implements TlsProbe {
    private static final Logger LOG = LoggerFactory.getLogger(SocketTlsProbe.class);

    private final Duration timeout;

    public SocketTlsProbe() {
        this(Duration.ofSeconds(5));
    }

    public SocketTlsProbe(Duration timeout) {
        this.timeout = (timeout == null ? Duration.ofSeconds(5) : timeout);
    }

    @Override
    public Optional<String> negotiatedProtocol(String host, int port) {
        if (host == null || host.isBlank()) return Optional.empty();
        int ms = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        SSLSocketFactory factory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        try (SSLSocket socket = (SSLSocket) factory.createSocket()) {
            socket.connect(new InetSocketAddress(host, port), ms);
            socket.setSoTimeout(ms);
            socket.setEnabledProtocols(socket.getSupportedProtocols());
            socket.startHandshake();
            return Optional.ofNullable(socket.getSession().getProtocol());
        } catch (SSLHandshakeException e) {
            if (isLegacyRefusal(e)) {
                LOG.info("TLS handshake with {}:{} refused modern protocols: {}", host, port, e.getMessage());
                return Optional.of(LEGACY_ONLY);
            }
            LOG.info("TLS handshake with {}:{} failed: {}", host, port, e.toString());
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            LOG.info("TLS handshake with {}:{} failed: {}", host, port, e.toString());
            return Optional.empty();
        }
    }

    /** 서버의 protocol_version alert(우리가 켠 TLSv1.2+ 를 모두 거부) */
    static boolean isLegacyRefusal(SSLHandshakeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String m = t.getMessage();
            if (m != null && m.toLowerCase(Locale.ROOT).contains("protocol_version")) return true;
        }
        return false;
    }
}
