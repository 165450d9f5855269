package com.websweep.core.http;

import java.util.Optional;

/** 호스트와 TLS 핸드셰이크 후 협상된 프로토콜 버전(TLSv1.2 등)을 알려준다. */
@FunctionalInterface
public interface TlsProbe {
    /** 서버가 TLSv1.2 이상을 거부해 핸드셰이크가 protocol_version 으로 끝난 경우의 결과 */
    String LEGACY_ONLY = "TLSv1.1-or-older";

    /** 핸드셰이크 실패 시 empty */
    Optional<String> negotiatedProtocol(String host, int port);
}
