package com.websweep.core.model;

import java.util.Objects;

/** 모든 Finding details에 공통으로 들어가는 네 필드. */
public record Advice(Severity severity, String description, String recommendation, String consequences) {

    public Advice {
        Objects.requireNonNull(severity, "severity");
        description = (description == null ? "" : description);
        recommendation = (recommendation == null ? "" : recommendation);
        consequences = (consequences == null ? "" : consequences);
    }

    public static Advice of(Severity severity, String description, String recommendation, String consequences) {
        return new Advice(severity, description, recommendation, consequences);
    }

    public Advice withSeverity(Severity s) {
        return new Advice(s, description, recommendation, consequences);
    }

    public Advice withDescription(String d) {
        return new Advice(severity, d, recommendation, consequences);
    }
}
