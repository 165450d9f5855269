package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;
import java.util.Set;

/** 폼 입력 필드 하나. type은 소문자로 정규화. */
public record FormInput(String name, String type, String value) {

    private static final Set<String> NON_FILLABLE = Set.of("submit", "button", "image", "reset");

    public FormInput {
        name = (name == null ? "" : name);
        type = (type == null || type.isBlank()) ? "text" : type.trim().toLowerCase(Locale.ROOT);
        value = (value == null ? "" : value);
    }

    /** 페이로드를 넣을 수 있는 필드인가(submit/button/image/reset 제외) */
    @JsonIgnore
    public boolean isFillable() {
        return !name.isEmpty() && !NON_FILLABLE.contains(type);
    }
}
