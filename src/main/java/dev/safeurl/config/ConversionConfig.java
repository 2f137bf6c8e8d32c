package dev.safeurl.config;

import dev.safeurl.config.converter.StringToSafeUrlConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.ConversionService;

/**
 * Publishes the context-wide {@code conversionService} so that {@code @Value} injection and
 * programmatic conversion into {@link dev.safeurl.util.SafeUrl} are sanitized.
 */
@Configuration
@Slf4j
public class ConversionConfig {

    @Bean
    public ConversionService conversionService() {
        ApplicationConversionService conversionService = new ApplicationConversionService();
        conversionService.addConverter(new StringToSafeUrlConverter());
        log.debug("Registered SafeUrl converter");
        return conversionService;
    }
}
