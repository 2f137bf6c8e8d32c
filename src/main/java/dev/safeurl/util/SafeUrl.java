package dev.safeurl.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.Consumer;

/**
 * A URL that is safe to use in URL/hyperlink contexts of an HTML document, such as the
 * {@code href} attribute of an anchor.
 *
 * <p>Instances can only be obtained through the {@code sanitize} factories or {@link #innocuous()},
 * so holding a {@code SafeUrl} means the value went through {@link UrlSafety}. HTML attribute
 * escaping is still the caller's job (see {@link HtmlUtils#hrefAttribute(SafeUrl)}).
 *
 * <p>The guarantee covers hyperlink use only. A {@code SafeUrl} says nothing about the resource
 * it points to and must not be used where that resource is executed, e.g. a script {@code src}.
 */
public final class SafeUrl {

    /**
     * Returned in place of any URL that fails validation. {@code about:invalid} refers to a
     * non-existent document; the fragment is ignored when the about URL is resolved.
     */
    public static final String INNOCUOUS_URL = "about:invalid#zSafeUrlz";

    private static final SafeUrl INNOCUOUS = new SafeUrl(INNOCUOUS_URL);

    private final String value;

    private SafeUrl(String value) {
        this.value = value;
    }

    /**
     * Wrap {@code url} if it is safe, otherwise return the innocuous URL.
     * Never throws; null input yields the innocuous URL.
     *
     * @param url untrusted input
     * @return {@code url} unchanged, or {@link #INNOCUOUS_URL}
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SafeUrl sanitize(String url) {
        if (!UrlSafety.isSafe(url)) {
            return INNOCUOUS;
        }
        return new SafeUrl(url);
    }

    /**
     * Same as {@link #sanitize(String)}, reporting the verdict to {@code observer} before returning.
     *
     * @param url      untrusted input
     * @param observer receives the classification of {@code url}
     * @return {@code url} unchanged, or {@link #INNOCUOUS_URL}
     */
    public static SafeUrl sanitize(String url, Consumer<UrlClassification> observer) {
        UrlClassification classification = UrlSafety.classify(url);
        observer.accept(classification);
        return classification.isSafe() ? new SafeUrl(url) : INNOCUOUS;
    }

    public static SafeUrl innocuous() {
        return INNOCUOUS;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isInnocuous() {
        return INNOCUOUS_URL.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SafeUrl that = (SafeUrl) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
