package dev.safeurl.config.converter;

import dev.safeurl.util.SafeUrl;
import org.springframework.core.convert.converter.Converter;

/**
 * String → SafeUrl. Every conversion goes through {@link SafeUrl#sanitize(String)}.
 */
public class StringToSafeUrlConverter implements Converter<String, SafeUrl> {

    @Override
    public SafeUrl convert(String source) {
        return SafeUrl.sanitize(source);
    }
}
