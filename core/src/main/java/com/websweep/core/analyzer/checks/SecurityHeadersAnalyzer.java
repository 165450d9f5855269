package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;

import java.util.ArrayList;
import java.util.List;

/** 보안 헤더 6종 존재 여부(대소문자 무시). 없는 헤더마다 missing_* 하나. */
public final class SecurityHeadersAnalyzer implements ResponseAnalyzer {

    /** 검사 대상 헤더: 이름, 설명, 부재 시 영향 */
    public record TrackedHeader(String name, String description, String consequences) {}

    public static final List<TrackedHeader> TRACKED = List.of(
            new TrackedHeader("X-Frame-Options",
                    "Protects against clickjacking attacks",
                    "Without this header, attackers could embed your site in a malicious webpage and trick users into clicking on elements they didn't intend to, potentially leading to unwanted actions or data theft."),
            new TrackedHeader("X-Content-Type-Options",
                    "Prevents MIME-sniffing attacks",
                    "Without this header, browsers might interpret files as a different type than what you intended, allowing attackers to potentially execute malicious scripts even when they shouldn't be executable."),
            new TrackedHeader("Content-Security-Policy",
                    "Controls resources the browser is allowed to load",
                    "Without this header, your site could load resources from any source, making it vulnerable to script injection attacks that could compromise user data or take control of page behavior."),
            new TrackedHeader("Strict-Transport-Security",
                    "Forces HTTPS connections",
                    "Without this header, communications between your site and users might be downgraded to insecure HTTP, allowing attackers to intercept and modify data in transit, or perform man-in-the-middle attacks."),
            new TrackedHeader("Referrer-Policy",
                    "Controls how much referrer information is included with requests",
                    "Without this header, sensitive information might be leaked in the referrer header when users navigate from your site to other sites, potentially exposing private data or user activity."),
            new TrackedHeader("Permissions-Policy",
                    "Controls which browser features can be used",
                    "Without Permissions-Policy, sensitive device features might be accessible to untrusted code")
    );

    @Override
    public CheckCategory category() { return CheckCategory.SECURITY_HEADERS; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        return check(page.response(), page.url().toString());
    }

    /** 응답만으로 판정(스캐너 밖에서도 쓰는 순수 함수) */
    public static List<Finding> check(HttpResponseData resp, String url) {
        List<Finding> out = new ArrayList<>();
        for (TrackedHeader h : TRACKED) {
            if (!resp.headers(h.name()).isEmpty()) continue;
            Advice advice = Advice.of(Severity.MEDIUM,
                    "Missing " + h.name() + ": " + h.description(),
                    "Implement the " + h.name() + " header to improve security",
                    h.consequences());
            out.add(Finding.of(FindingType.missingHeader(h.name()), url,
                    new FindingDetails.MissingHeader(advice, h.name(), h.description())));
        }
        return out;
    }
}
