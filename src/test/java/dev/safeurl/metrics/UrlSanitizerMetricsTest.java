package dev.safeurl.metrics;

import dev.safeurl.util.UrlClassification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("UrlSanitizerMetrics")
class UrlSanitizerMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private UrlSanitizerMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new UrlSanitizerMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        @DisplayName("should pre-register one counter per classification")
        void shouldRegisterCounters() {
            metrics.init();

            assertThat(meterRegistry.find(UrlSanitizerMetrics.ACCEPTED).counters()).hasSize(3);
            assertThat(meterRegistry.find(UrlSanitizerMetrics.REJECTED).counters()).hasSize(3);
            assertThat(meterRegistry.find(UrlSanitizerMetrics.REJECTED)
                    .tag("classification", "disallowed_scheme").counter()).isNotNull();
        }
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("should increment the counter tagged with the classification")
        void shouldIncrementTaggedCounter() {
            metrics.init();

            metrics.record(UrlClassification.RELATIVE);
            metrics.record(UrlClassification.RELATIVE);
            metrics.record(UrlClassification.UNSAFE_DATA_URL);

            Counter relative = meterRegistry.find(UrlSanitizerMetrics.ACCEPTED)
                    .tag("classification", "relative").counter();
            assertThat(relative).isNotNull();
            assertThat(relative.count()).isEqualTo(2.0);
            assertThat(metrics.acceptedCount()).isEqualTo(2.0);
            assertThat(metrics.rejectedCount()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should not fail before init")
        void shouldNotFailBeforeInit() {
            assertThatCode(() -> metrics.record(UrlClassification.ALLOWED_SCHEME)).doesNotThrowAnyException();
            assertThat(metrics.acceptedCount()).isZero();
        }
    }
}
