package com.hotskills.config;

import com.hotskills.domain.model.Language;
import com.hotskills.domain.model.LanguageCatalog;
import com.hotskills.infrastructure.persistence.repository.LanguageRepository;
import com.hotskills.infrastructure.persistence.repository.SnapshotQueryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Process-scoped collaborators of the aggregate resolver.
 *
 * The connection pools are owned by Spring Boot (Hikari, Lettuce) and closed
 * on shutdown. The language catalog is loaded here once and never refreshed.
 */
@Slf4j
@Configuration
public class StatisticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Languages in reference table order. Startup fails if the table cannot
     * be read.
     */
    @Bean
    public LanguageCatalog languageCatalog(LanguageRepository languageRepository) {
        List<Language> languages = languageRepository.findAllByOrderByIdAsc().stream()
                .map(entity -> Language.builder()
                        .code(entity.getCode())
                        .name(entity.getName())
                        .color(entity.getColor())
                        .build())
                .collect(Collectors.toList());

        log.info("Loaded {} programming languages", languages.size());
        return LanguageCatalog.of(languages);
    }

    @Bean
    public SnapshotQueryBuilder snapshotQueryBuilder(LanguageCatalog languageCatalog) {
        return new SnapshotQueryBuilder(languageCatalog);
    }

    /**
     * Snapshot queries give up after the configured timeout instead of
     * holding a pooled connection indefinitely.
     */
    @Bean
    public NamedParameterJdbcTemplate snapshotJdbcTemplate(
            DataSource dataSource,
            @Value("${app.query.timeout-seconds:10}") int queryTimeoutSeconds) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }
}
