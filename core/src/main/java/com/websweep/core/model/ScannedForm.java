package com.websweep.core.model;

import java.util.List;

/** 발견된 폼 기록(발견 페이지 url 포함). */
public record ScannedForm(String url, String action, String method, List<FormInput> inputs, String timestamp) {

    public static ScannedForm of(String pageUrl, Form form, String timestamp) {
        return new ScannedForm(pageUrl, form.action(), form.method(), form.inputs(), timestamp);
    }
}
