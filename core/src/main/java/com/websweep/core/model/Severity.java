package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 탐지 심각도. JSON에는 "High" 같은 라벨로 기록된다. */
public enum Severity {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    INFO("Info");

    private final String label;

    Severity(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    /** 라벨/상수명 모두 허용. 알 수 없으면 def. */
    public static Severity parse(String s, Severity def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim();
        for (Severity sev : values()) {
            if (sev.label.equalsIgnoreCase(v) || sev.name().equalsIgnoreCase(v)) return sev;
        }
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "crit" -> CRITICAL;
            case "med" -> MEDIUM;
            default -> def;
        };
    }
}
