package dev.safeurl.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a string can be used as a hyperlink URL in an HTML document
 * without causing script execution.
 *
 * <p>A string is safe when it either
 * <ul>
 *   <li>starts with an allowlisted scheme ({@code http}, {@code https}, {@code mailto}, {@code ftp}),</li>
 *   <li>has no scheme at all, i.e. its first {@code ':'} comes after a {@code '/'}, {@code '?'} or
 *       {@code '#'} (or it has no {@code ':'}), which makes it scheme-relative, path-absolute or
 *       path-relative, or</li>
 *   <li>is a base64 {@code data:} URL whose media type is one of a fixed set of audio, image and
 *       video types.</li>
 * </ul>
 *
 * <p>Matching is ASCII case-insensitive. No percent-decoding or normalization is attempted.
 * All patterns are compiled once and are safe for concurrent use.
 */
public final class UrlSafety {

    /**
     * Anchored at the start of the input. A ':' seen before any of [/?#] ends the scheme,
     * so it must belong to one of the allowed schemes.
     */
    private static final Pattern SAFE_URL = Pattern.compile(
            "(?<scheme>(?:https?|mailto|ftp):)|[^:/?#]*(?:[/?#]|\\z)",
            Pattern.CASE_INSENSITIVE);

    /**
     * Base64 data URL (RFC 2397). Group 1 is the media type. Media types with parameters
     * (e.g. {@code text/javascript;charset=UTF-8}) never match, which is fine because none
     * of the allowed types carry parameters.
     */
    private static final Pattern DATA_URL = Pattern.compile(
            "data:([^;,]*);base64,[a-z0-9+/]+=*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATA_SCHEME = Pattern.compile("data:", Pattern.CASE_INSENSITIVE);

    private static final Pattern SAFE_MIME_TYPE = Pattern.compile(
            "audio/(?:3gpp2|3gpp|aac|midi|mp3|mp4|mpeg|oga|ogg|opus|x-m4a|x-matroska|x-wav|wav|webm)"
                    + "|image/(?:bmp|gif|jpeg|jpg|png|tiff|webp|x-icon)"
                    + "|video/(?:mpeg|mp4|ogg|webm|x-matroska)",
            Pattern.CASE_INSENSITIVE);

    private UrlSafety() {
        // utility class
    }

    /**
     * Check whether {@code url} is safe to use in a hyperlink context.
     *
     * @param url arbitrary input, may be null
     * @return true if the URL cannot trigger script execution when followed
     */
    public static boolean isSafe(String url) {
        return classify(url).isSafe();
    }

    /**
     * Classify {@code url}, reporting which rule accepted or rejected it.
     *
     * @param url arbitrary input, may be null
     * @return the verdict, never null
     */
    public static UrlClassification classify(String url) {
        if (url == null) {
            return UrlClassification.NULL_INPUT;
        }

        Matcher safe = SAFE_URL.matcher(url);
        if (safe.lookingAt()) {
            return safe.group("scheme") != null
                    ? UrlClassification.ALLOWED_SCHEME
                    : UrlClassification.RELATIVE;
        }

        Matcher data = DATA_URL.matcher(url);
        if (data.matches() && isSafeMimeType(data.group(1))) {
            return UrlClassification.SAFE_DATA_URL;
        }

        return DATA_SCHEME.matcher(url).lookingAt()
                ? UrlClassification.UNSAFE_DATA_URL
                : UrlClassification.DISALLOWED_SCHEME;
    }

    /**
     * Check whether a bare MIME type (no parameters) may be embedded in a data URL.
     */
    public static boolean isSafeMimeType(String mimeType) {
        return mimeType != null && SAFE_MIME_TYPE.matcher(mimeType).matches();
    }
}
