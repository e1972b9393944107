package com.snowman.balance.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Fails fast on a missing or non-PostgreSQL JDBC URL instead of a generic Hikari error later.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    @Value("${spring.datasource.url:}")
    private String jdbcUrl;

    @Value("${spring.datasource.username:}")
    private String username;

    @PostConstruct
    void validate() {
        String redactedUser = username == null || username.isBlank() ? "<none>" : username;
        log.info("DataSource diagnostics: url='{}' user='{}'", redact(jdbcUrl), redactedUser);
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("spring.datasource.url is blank (ensure SPRING_DATASOURCE_URL is set)");
        }
        if (!jdbcUrl.startsWith("jdbc:postgresql://")) {
            throw new IllegalStateException("spring.datasource.url must start with 'jdbc:postgresql://' (actual='" + redact(jdbcUrl) + "')");
        }
    }

    static String redact(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)(password=)[^&]+", "$1***");
    }
}
