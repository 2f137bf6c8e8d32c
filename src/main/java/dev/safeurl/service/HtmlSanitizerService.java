package dev.safeurl.service;

import dev.safeurl.util.HtmlUtils;
import dev.safeurl.util.SafeUrl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies URL sanitization to HTML produced elsewhere (templates, user content).
 * Uses JSoup to locate URL-valued attributes. The result is the fragment as JSoup
 * re-serializes it: attribute quoting, entity encoding and implied end tags are normalized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HtmlSanitizerService {

    /**
     * Attributes whose value is navigated to or loaded as a hyperlink-grade URL.
     * Namespaced variants such as {@code xlink:href} are matched by their local name.
     */
    static final Set<String> URL_ATTRIBUTES = Set.of(
            "href", "src", "action", "formaction", "cite", "poster", "background");

    static final String SRCSET = "srcset";

    /**
     * Elements whose URL is fetched and run as code or as a nested document. A hyperlink-safe
     * URL is not enough there, so the URL is always replaced.
     */
    static final Set<String> RESOURCE_ELEMENTS = Set.of("script", "iframe", "frame", "embed", "object");

    static final Set<String> RESOURCE_ATTRIBUTES = Set.of("src", "data");

    private final UrlSanitizerService urlSanitizer;

    /**
     * Replace every unsafe URL attribute value in an HTML fragment with the innocuous URL.
     * Attribute values are compared after entity decoding, the way a browser reads them.
     * Each candidate of a {@code srcset} is checked on its own. Resource URLs of
     * script, iframe, frame, embed and object elements are replaced unconditionally.
     *
     * @param html HTML fragment
     * @return the JSoup-normalized fragment with URL attributes sanitized
     */
    public String sanitizeUrlAttributes(String html) {
        if (html == null || html.isEmpty()) {
            return html;
        }
        log.debug("Sanitizing URL attributes, length={}", html.length());

        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);

        int replaced = 0;
        for (Element element : document.body().getAllElements()) {
            boolean resourceElement = RESOURCE_ELEMENTS.contains(element.normalName());

            List<String> keys = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                keys.add(attribute.getKey());
            }

            for (String key : keys) {
                String original = element.attr(key);
                String sanitized = sanitizeAttribute(resourceElement, localName(key), original);
                if (sanitized != null && !sanitized.equals(original)) {
                    element.attr(key, sanitized);
                    replaced++;
                }
            }
        }

        if (replaced > 0) {
            log.debug("Replaced {} unsafe URL attribute(s)", replaced);
        }
        return document.body().html();
    }

    /**
     * Render an anchor for an untrusted URL. Both the URL and the text are escaped.
     */
    public String renderLink(String rawUrl, String text) {
        return HtmlUtils.anchor(urlSanitizer.sanitize(rawUrl), text);
    }

    /**
     * @return the new value, or null if the attribute carries no URL
     */
    private String sanitizeAttribute(boolean resourceElement, String name, String value) {
        if (resourceElement && RESOURCE_ATTRIBUTES.contains(name)) {
            return SafeUrl.INNOCUOUS_URL;
        }
        if (SRCSET.equals(name)) {
            return sanitizeSrcset(value);
        }
        if (URL_ATTRIBUTES.contains(name)) {
            return urlSanitizer.sanitize(value).getValue();
        }
        return null;
    }

    /**
     * Sanitize each image candidate of a srcset, keeping its width or density descriptor.
     * A candidate URL is a run of non-whitespace; it may itself contain commas (data URLs).
     */
    String sanitizeSrcset(String srcset) {
        List<String> candidates = new ArrayList<>();
        int length = srcset.length();
        int i = 0;
        while (i < length) {
            while (i < length && (Character.isWhitespace(srcset.charAt(i)) || srcset.charAt(i) == ',')) {
                i++;
            }
            if (i >= length) {
                break;
            }

            int urlStart = i;
            while (i < length && !Character.isWhitespace(srcset.charAt(i))) {
                i++;
            }
            String url = srcset.substring(urlStart, i);
            String descriptor = "";
            if (url.endsWith(",")) {
                url = url.replaceAll(",+$", "");
            } else {
                int descriptorStart = i;
                while (i < length && srcset.charAt(i) != ',') {
                    i++;
                }
                descriptor = srcset.substring(descriptorStart, i).trim();
            }

            String safe = urlSanitizer.sanitize(url).getValue();
            candidates.add(descriptor.isEmpty() ? safe : safe + " " + descriptor);
        }
        return String.join(", ", candidates);
    }

    private static String localName(String key) {
        String name = key.toLowerCase(Locale.ROOT);
        int colon = name.lastIndexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
