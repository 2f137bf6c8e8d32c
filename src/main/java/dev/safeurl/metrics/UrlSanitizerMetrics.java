package dev.safeurl.metrics;

import dev.safeurl.util.UrlClassification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class UrlSanitizerMetrics {

    static final String ACCEPTED = "url.sanitizer.accepted";
    static final String REJECTED = "url.sanitizer.rejected";

    private final MeterRegistry meterRegistry;

    // Written once in init(), read-only afterwards
    private final Map<UrlClassification, Counter> counters = new EnumMap<>(UrlClassification.class);

    @PostConstruct
    public void init() {
        for (UrlClassification classification : UrlClassification.values()) {
            String name = classification.isSafe() ? ACCEPTED : REJECTED;
            counters.put(classification, Counter.builder(name)
                    .description(classification.isSafe()
                            ? "URLs passed through unchanged"
                            : "URLs replaced by the innocuous URL")
                    .tag("classification", classification.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        log.debug("Registered {} URL sanitizer counters", counters.size());
    }

    public void record(UrlClassification classification) {
        Counter counter = counters.get(classification);
        if (counter == null) {
            log.warn("URL sanitizer metrics used before init, dropping {}", classification);
            return;
        }
        counter.increment();
    }

    public double acceptedCount() {
        return sum(true);
    }

    public double rejectedCount() {
        return sum(false);
    }

    private double sum(boolean safe) {
        return counters.entrySet().stream()
                .filter(e -> e.getKey().isSafe() == safe)
                .mapToDouble(e -> e.getValue().count())
                .sum();
    }
}
