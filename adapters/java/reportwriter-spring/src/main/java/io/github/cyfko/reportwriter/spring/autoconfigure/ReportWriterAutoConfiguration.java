package io.github.cyfko.reportwriter.spring.autoconfigure;

import io.github.cyfko.reportwriter.core.config.PagingConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes the application-wide {@link PagingConfig} built from {@link ReportWriterProperties}.
 * <p>
 * Invalid properties fail the context start with a
 * {@link io.github.cyfko.reportwriter.core.exception.ReportConfigurationException}.
 * </p>
 */
@AutoConfiguration
@EnableConfigurationProperties(ReportWriterProperties.class)
public class ReportWriterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PagingConfig reportPagingConfig(ReportWriterProperties properties) {
        return properties.getPaging().toPagingConfig();
    }

}
