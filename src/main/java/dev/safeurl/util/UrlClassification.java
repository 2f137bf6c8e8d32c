package dev.safeurl.util;

/**
 * Verdict produced by {@link UrlSafety#classify(String)}.
 */
public enum UrlClassification {

    /** Starts with http:, https:, mailto: or ftp:. */
    ALLOWED_SCHEME(true),

    /** No scheme: the first ':' (if any) follows a '/', '?' or '#'. */
    RELATIVE(true),

    /** Base64 data URL with an allowlisted audio, image or video MIME type. */
    SAFE_DATA_URL(true),

    /** data: URL with a disallowed MIME type, parameters, or a malformed payload. */
    UNSAFE_DATA_URL(false),

    DISALLOWED_SCHEME(false),

    NULL_INPUT(false);

    private final boolean safe;

    UrlClassification(boolean safe) {
        this.safe = safe;
    }

    public boolean isSafe() {
        return safe;
    }
}
