package dev.safeurl.service;

import dev.safeurl.metrics.UrlSanitizerMetrics;
import dev.safeurl.util.SafeUrl;
import dev.safeurl.util.UrlClassification;
import dev.safeurl.util.UrlSafety;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Sanitizes untrusted URLs for hyperlink contexts, counting every verdict and
 * logging rejected input.
 * Unsafe URLs are never reported as errors: they come back as {@link SafeUrl#innocuous()}.
 */
@Service
@Slf4j
public class UrlSanitizerService {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]");

    private final UrlSanitizerMetrics metrics;
    private final boolean logRejections;
    private final int maxLoggedLength;

    public UrlSanitizerService(
            UrlSanitizerMetrics metrics,
            @Value("${url-sanitizer.log-rejections:true}") boolean logRejections,
            @Value("${url-sanitizer.max-logged-length:200}") int maxLoggedLength) {
        if (maxLoggedLength < 0) {
            throw new IllegalArgumentException("url-sanitizer.max-logged-length must be >= 0, got: " + maxLoggedLength);
        }
        this.metrics = metrics;
        this.logRejections = logRejections;
        this.maxLoggedLength = maxLoggedLength;
    }

    /**
     * Sanitize a URL destined for an href or similar attribute.
     *
     * @param url untrusted input, may be null
     * @return the input unchanged if safe, otherwise the innocuous URL
     */
    public SafeUrl sanitize(String url) {
        return SafeUrl.sanitize(url, classification -> onClassified(url, classification));
    }

    public boolean isSafe(String url) {
        return UrlSafety.isSafe(url);
    }

    private void onClassified(String url, UrlClassification classification) {
        metrics.record(classification);
        if (!classification.isSafe() && logRejections) {
            log.warn("Replaced unsafe URL ({}): {}", classification, forLog(url));
        }
    }

    /**
     * Truncate and strip line breaks so a hostile URL cannot forge log entries.
     */
    String forLog(String url) {
        if (url == null) {
            return "null";
        }
        String shortened = url.length() > maxLoggedLength
                ? url.substring(0, maxLoggedLength) + "...(" + url.length() + " chars)"
                : url;
        return LINE_BREAKS.matcher(shortened).replaceAll("_");
    }
}
