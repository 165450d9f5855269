package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 페이지에서 추출한 폼. 페이지마다 새로 추출되며 페이지 간 중복 제거하지 않는다.
 * action은 절대 URL, method는 "get" | "post".
 */
public record Form(String action, String method, List<FormInput> inputs) {

    public Form {
        action = (action == null ? "" : action);
        method = (method == null || method.isBlank()) ? "get" : method.trim().toLowerCase(Locale.ROOT);
        if (!method.equals("get") && !method.equals("post")) method = "get";
        inputs = (inputs == null ? List.of() : List.copyOf(inputs));
    }

    @JsonIgnore
    public boolean isPost() { return "post".equals(method); }

    @JsonIgnore
    public List<FormInput> fillableInputs() {
        return inputs.stream().filter(FormInput::isFillable).toList();
    }

    @JsonIgnore
    public boolean hasInputOfType(String type) {
        String t = type.toLowerCase(Locale.ROOT);
        return inputs.stream().anyMatch(i -> i.type().equals(t));
    }

    /** 비밀번호 필드가 있으면 로그인 폼으로 간주 */
    @JsonIgnore
    public boolean isLoginForm() { return hasInputOfType("password"); }

    /** 원래 값 기준 필드 맵(이름 없는 필드 제외, 입력 순서 유지) */
    @JsonIgnore
    public Map<String, String> defaultFields() {
        Map<String, String> m = new LinkedHashMap<>();
        for (FormInput in : inputs) {
            if (in.name().isEmpty()) continue;
            m.putIfAbsent(in.name(), in.value());
        }
        return m;
    }
}
