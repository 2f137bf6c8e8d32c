package dev.safeurl.util;

/**
 * HTML emission helpers for sanitized URLs.
 * A {@link SafeUrl} is vetted against script schemes but not escaped; these methods add
 * the attribute escaping every caller still needs.
 */
public final class HtmlUtils {

    private HtmlUtils() {}

    /**
     * Escape HTML special characters for text and quoted attribute contexts.
     * Escapes: &amp; &lt; &gt; &quot; &#x27;
     */
    public static String escapeHtml(String input) {
        if (input == null) return "";
        return input
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#x27;");
    }

    /**
     * Render a double-quoted {@code href} attribute, including the leading space.
     */
    public static String hrefAttribute(SafeUrl url) {
        SafeUrl target = url != null ? url : SafeUrl.innocuous();
        return " href=\"" + escapeHtml(target.getValue()) + "\"";
    }

    /**
     * Render an anchor element linking to {@code url}. The link text is escaped.
     */
    public static String anchor(SafeUrl url, String text) {
        return "<a" + hrefAttribute(url) + ">" + escapeHtml(text) + "</a>";
    }
}
