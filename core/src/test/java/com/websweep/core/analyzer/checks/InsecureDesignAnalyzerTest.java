package com.websweep.core.analyzer.checks;

import com.websweep.core.crawler.Page;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.testutil.FakeHttpClient;
import com.websweep.core.testutil.TestPages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("InsecureDesignAnalyzer")
class InsecureDesignAnalyzerTest {

    private static final String CONTACT = "<html><body><form action=\"/contact\" method=\"post\">"
            + "<input type=\"email\" name=\"email\"><input name=\"message\">"
            + "<input type=\"submit\" value=\"Send\"></form></body></html>";

    private static Page contactPage() {
        return TestPages.page("http://t.test/", CONTACT);
    }

    @Test
    @DisplayName("CSRF 토큰 없는 POST 폼 + 3회 제출 모두 수락이면 CSRF 와 레이트리밋 누락")
    void csrfAndNoRateLimit() {
        FakeHttpClient http = FakeHttpClient.always(200, "<p>Thanks!</p>");

        List<Finding> out = new InsecureDesignAnalyzer().analyze(contactPage(), TestPages.context(ScanConfig.defaults(), http));

        assertThat(out).extracting(Finding::getType).containsExactly(
                FindingType.INSECURE_DESIGN_CSRF, FindingType.INSECURE_DESIGN_NO_RATE_LIMITING);
        FindingDetails.FormCheck d = (FindingDetails.FormCheck) out.get(0).getDetails();
        assertEquals("http://t.test/contact", d.formAction());
        assertEquals("post", d.formMethod());

        assertEquals(InsecureDesignAnalyzer.PROBE_SUBMISSIONS, http.requests().size());
        assertThat(http.requests()).allSatisfy(r -> {
            assertThat(r.method()).isEqualTo("POST");
            assertThat(r.form()).containsKeys("email", "message");
            assertThat(r.form().get("email")).endsWith("@example.com");
        });
    }

    @Test
    @DisplayName("429 나 제한 문구가 나오면 레이트리밋 있음")
    void rateLimited() {
        FakeHttpClient tooMany = FakeHttpClient.always(429, "slow down");
        List<Finding> out = new InsecureDesignAnalyzer().analyze(contactPage(), TestPages.context(ScanConfig.defaults(), tooMany));
        assertThat(out).extracting(Finding::getType).containsExactly(FindingType.INSECURE_DESIGN_CSRF);
        assertEquals(1, tooMany.requests().size());

        FakeHttpClient text = FakeHttpClient.always(200, "Too many requests, try later");
        out = new InsecureDesignAnalyzer().analyze(contactPage(), TestPages.context(ScanConfig.defaults(), text));
        assertThat(out).extracting(Finding::getType).doesNotContain(FindingType.INSECURE_DESIGN_NO_RATE_LIMITING);
    }

    @Test
    @DisplayName("능동 프로브가 꺼져 있으면 요청 없이 CSRF 만")
    void passiveOnlyCsrf() {
        FakeHttpClient http = FakeHttpClient.always(200, "ok");

        List<Finding> out = new InsecureDesignAnalyzer().analyze(contactPage(), TestPages.passive(http));

        assertThat(out).extracting(Finding::getType).containsExactly(FindingType.INSECURE_DESIGN_CSRF);
        assertTrue(http.requests().isEmpty());
    }

    @Test
    @DisplayName("CSRF 흔적: 필드 이름, meta 태그, 본문의 헤더 이름")
    void csrfProtectionSignals() {
        Page hidden = TestPages.page("http://t.test/", "<form action=\"/c\" method=\"post\">"
                + "<input type=\"hidden\" name=\"csrfmiddlewaretoken\" value=\"x\"><input name=\"q\"></form>");
        Page meta = TestPages.page("http://t.test/", "<html><head><meta name=\"csrf-token\" content=\"x\"></head>"
                + "<body><form action=\"/c\" method=\"post\"><input name=\"q\"></form></body></html>");
        Page header = TestPages.page("http://t.test/", "<form action=\"/c\" method=\"post\"><input name=\"q\"></form>"
                + "<script>fetch('/c', {headers: {'X-CSRF-Token': t}})</script>");

        for (Page p : List.of(hidden, meta, header)) {
            assertTrue(InsecureDesignAnalyzer.hasCsrfProtection(p.forms().get(0), p.document(), p.response().bodyLower()));
        }
        Page bare = contactPage();
        assertFalse(InsecureDesignAnalyzer.hasCsrfProtection(bare.forms().get(0), bare.document(), bare.response().bodyLower()));
    }
}
