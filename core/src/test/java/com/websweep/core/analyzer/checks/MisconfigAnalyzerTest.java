package com.websweep.core.analyzer.checks;

import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.testutil.FakeHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MisconfigAnalyzer")
class MisconfigAnalyzerTest {

    private static List<Finding> check(String url, int status, String body) {
        HttpResponseData resp = FakeHttpClient.response(URI.create(url), status, body);
        return MisconfigAnalyzer.check(resp, url);
    }

    @Test
    @DisplayName("200 디렉터리 리스팅")
    void directoryListing() {
        List<Finding> out = check("http://t.test/files/", 200,
                "<html><head><title>Index of /files</title></head><body><a href=\"../\">Parent Directory</a></body></html>");

        assertThat(out).singleElement().satisfies(f -> {
            assertThat(f.getType()).isEqualTo(FindingType.MISCONFIG_DIRECTORY_LISTING);
            assertThat(((FindingDetails.Evidence) f.getDetails()).evidence()).isNotBlank();
        });
    }

    @Test
    @DisplayName("상세 에러는 4xx/5xx 에서만")
    void verboseErrorsOnlyOnErrorStatus() {
        String body = "<b>Fatal error</b>: Uncaught exception in /var/www/app.php";

        assertThat(check("http://t.test/x", 500, body)).extracting(Finding::getType)
                .containsExactly(FindingType.MISCONFIG_VERBOSE_ERRORS);
        assertThat(check("http://t.test/x", 200, body)).isEmpty();
    }

    @Test
    @DisplayName("기본 설정 파일 경로나 기본 자격증명 문구")
    void defaultConfigs() {
        assertThat(check("http://t.test/phpinfo.php", 200, "<p>PHP</p>")).extracting(Finding::getType)
                .containsExactly(FindingType.MISCONFIG_DEFAULT_CONFIGS);
        assertThat(check("http://t.test/", 200, "The default password is admin")).extracting(Finding::getType)
                .containsExactly(FindingType.MISCONFIG_DEFAULT_CONFIGS);
        assertThat(check("http://t.test/", 200, "<p>welcome</p>")).isEmpty();
    }
}
