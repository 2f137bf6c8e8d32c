package dev.safeurl.service;

import dev.safeurl.metrics.UrlSanitizerMetrics;
import dev.safeurl.util.SafeUrl;
import dev.safeurl.util.UrlClassification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("UrlSanitizerService")
class UrlSanitizerServiceTest {

    @Mock
    private UrlSanitizerMetrics metrics;

    private UrlSanitizerService service;

    @BeforeEach
    void setUp() {
        service = new UrlSanitizerService(metrics, true, 10);
    }

    @Nested
    @DisplayName("sanitize")
    class Sanitize {

        @Test
        @DisplayName("should pass a safe URL through and record the verdict")
        void shouldPassSafeUrl() {
            SafeUrl result = service.sanitize("https://example.com");

            assertThat(result.getValue()).isEqualTo("https://example.com");
            verify(metrics).record(UrlClassification.ALLOWED_SCHEME);
        }

        @Test
        @DisplayName("should replace an unsafe URL and record the verdict")
        void shouldReplaceUnsafeUrl() {
            SafeUrl result = service.sanitize("javascript:alert(1)");

            assertThat(result).isEqualTo(SafeUrl.innocuous());
            verify(metrics).record(UrlClassification.DISALLOWED_SCHEME);
        }

        @Test
        @DisplayName("should tolerate null")
        void shouldTolerateNull() {
            assertThat(service.sanitize(null)).isEqualTo(SafeUrl.innocuous());
            verify(metrics).record(UrlClassification.NULL_INPUT);
        }

        @Test
        @DisplayName("should agree with SafeUrl.sanitize")
        void shouldAgreeWithSafeUrl() {
            for (String url : new String[] {"/a", "data:image/png;base64,AAAA", "data:text/html;base64,AAAA", "ftp://x"}) {
                assertThat(service.sanitize(url)).isEqualTo(SafeUrl.sanitize(url));
            }
        }
    }

    @Nested
    @DisplayName("isSafe")
    class IsSafe {

        @Test
        @DisplayName("should classify without touching metrics")
        void shouldClassify() {
            assertThat(service.isSafe("mailto:user@example.com")).isTrue();
            assertThat(service.isSafe("vbscript:x")).isFalse();
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("forLog")
    class ForLog {

        @Test
        @DisplayName("should replace line breaks")
        void shouldReplaceLineBreaks() {
            assertThat(service.forLog("a\r\nb")).isEqualTo("a__b");
        }

        @Test
        @DisplayName("should truncate long input")
        void shouldTruncate() {
            assertThat(service.forLog("javascript:alert(1)")).isEqualTo("javascript...(19 chars)");
        }

        @Test
        @DisplayName("should render null")
        void shouldRenderNull() {
            assertThat(service.forLog(null)).isEqualTo("null");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("should reject a negative max logged length")
        void shouldRejectNegativeLength() {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> new UrlSanitizerService(metrics, true, -1))
                    .withMessageContaining("max-logged-length");
        }

        @Test
        @DisplayName("should count with a real registry when logging is off")
        void shouldCountWithRealRegistry() {
            UrlSanitizerMetrics realMetrics = new UrlSanitizerMetrics(new SimpleMeterRegistry());
            realMetrics.init();
            UrlSanitizerService quiet = new UrlSanitizerService(realMetrics, false, 200);

            quiet.sanitize("javascript:alert(1)");
            quiet.sanitize("/ok");

            assertThat(realMetrics.rejectedCount()).isEqualTo(1.0);
            assertThat(realMetrics.acceptedCount()).isEqualTo(1.0);
        }
    }
}
