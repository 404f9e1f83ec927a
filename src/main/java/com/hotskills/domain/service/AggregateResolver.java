package com.hotskills.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotskills.domain.exception.CacheUnavailableException;
import com.hotskills.domain.exception.EncodingException;
import com.hotskills.domain.exception.StoreUnavailableException;
import com.hotskills.domain.model.AggregateKind;
import com.hotskills.domain.model.Language;
import com.hotskills.domain.model.LanguageCatalog;
import com.hotskills.domain.model.LanguageProfile;
import com.hotskills.domain.model.MetricSeries;
import com.hotskills.domain.model.SalaryEntry;
import com.hotskills.domain.model.SnapshotRow;
import com.hotskills.infrastructure.cache.CacheStore;
import com.hotskills.infrastructure.persistence.repository.SnapshotRepository;
import com.hotskills.infrastructure.persistence.repository.SnapshotTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Read-through resolver for every cached aggregate.
 *
 * Query Flow:
 * 1. Build the cache key from aggregate kind and filter
 * 2. Check cache (Redis); a hit returns without touching the database
 * 3. On miss, query the snapshot tables for exactly the requested columns
 * 4. Reduce rows into daily/hourly series
 * 5. Store the JSON in cache with the TTL of the aggregate kind
 * 6. Return result
 *
 * Failure Handling:
 * - Database failure: StoreUnavailableException, nothing cached
 * - Serialization failure: EncodingException, nothing cached
 * - Cache failure: logged, treated as miss (read) or skipped (write)
 *
 * Concurrent misses for the same key are not coalesced: each one queries the
 * database and writes the cache, last write wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregateResolver {

    static final String RESUMES_METRIC = "resumes";

    private static final TypeReference<List<SalaryEntry>> SALARY_TABLE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Language>> LANGUAGE_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, MetricSeries>> SERIES_TYPE = new TypeReference<>() {};
    private static final TypeReference<JsonNode> SKILL_LIST_TYPE = new TypeReference<>() {};

    private final SnapshotRepository snapshotRepository;
    private final CacheStore cacheStore;
    private final FreshnessPolicy freshnessPolicy;
    private final SeriesReducer seriesReducer;
    private final LanguageCatalog catalog;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Resolve any aggregate by kind.
     *
     * @param filter metric code for {@link AggregateKind#VACANCY_SERIES}, language
     *               code for {@link AggregateKind#SKILL_LIST}; ignored otherwise
     */
    public Object resolve(AggregateKind kind, String filter) {
        return switch (kind) {
            case SALARY_TABLE -> resolveSalaries();
            case LANGUAGE_LIST -> resolveLanguages();
            case SKILL_LIST -> resolveSkills(filter);
            case VACANCY_SERIES -> resolveVacancyStatistics(filter);
            case RESUME_SERIES -> resolveResumeStatistics();
        };
    }

    /**
     * Salary ranges per language from the latest salary snapshot, in
     * reference list order. Empty if no snapshot exists yet.
     */
    public List<SalaryEntry> resolveSalaries() {
        return resolveCached(AggregateKind.SALARY_TABLE, null, SALARY_TABLE_TYPE, this::loadSalaries, any -> true);
    }

    public List<Language> resolveLanguages() {
        return resolveCached(AggregateKind.LANGUAGE_LIST, null, LANGUAGE_LIST_TYPE,
                () -> new ArrayList<>(catalog.getLanguages()), any -> true);
    }

    /**
     * Daily and hourly vacancy counts.
     *
     * No filter gives every language plus the profession. A filter that is
     * neither a language code nor the profession tag gives an empty map
     * without touching cache or database.
     */
    public Map<String, MetricSeries> resolveVacancyStatistics(String filter) {
        if (filter != null && !catalog.isKnownMetric(filter)) {
            log.debug("Unknown vacancy statistics filter: {}", filter);
            return new LinkedHashMap<>();
        }
        return resolveCached(AggregateKind.VACANCY_SERIES, filter, SERIES_TYPE,
                () -> loadVacancyStatistics(filter), any -> true);
    }

    public Map<String, MetricSeries> resolveResumeStatistics() {
        return resolveCached(AggregateKind.RESUME_SERIES, null, SERIES_TYPE, this::loadResumeStatistics, any -> true);
    }

    /**
     * Latest hot skills of a language, or an empty array if none were
     * collected. Empty results are not cached so the next collection shows
     * up without waiting for the TTL.
     */
    public JsonNode resolveSkills(String languageCode) {
        if (languageCode == null || !catalog.isLanguage(languageCode)) {
            return objectMapper.createArrayNode();
        }
        return resolveCached(AggregateKind.SKILL_LIST, languageCode, SKILL_LIST_TYPE,
                () -> loadSkills(languageCode), skills -> !skills.isEmpty());
    }

    /**
     * Language page data. Codes are matched case-insensitively.
     *
     * @return empty if the code is not in the reference list
     */
    public Optional<LanguageProfile> resolveLanguageProfile(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return catalog.find(code.toLowerCase(Locale.ROOT))
                .map(language -> LanguageProfile.builder()
                        .code(language.getCode())
                        .name(language.getName())
                        .color(language.getColor())
                        .skills(resolveSkills(language.getCode()))
                        .build());
    }

    private <T> T resolveCached(AggregateKind kind,
                                String filter,
                                TypeReference<T> type,
                                Supplier<T> loader,
                                Predicate<T> cacheable) {
        String cacheKey = freshnessPolicy.cacheKey(kind, filter);

        Optional<T> cached = readCache(kind, cacheKey, type);
        if (cached.isPresent()) {
            log.debug("Cache hit for aggregate: {}", cacheKey);
            cacheCounter(kind, "hit").increment();
            return cached.get();
        }

        log.debug("Cache miss for aggregate: {}", cacheKey);
        cacheCounter(kind, "miss").increment();

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        T result;
        try {
            result = loader.get();
        } catch (DataAccessException e) {
            log.error("Snapshot store query failed for {} [{}]: {}", kind, cacheKey, e.getMessage(), e);
            executedCounter(kind, "error").increment();
            throw new StoreUnavailableException(kind, cacheKey, e);
        }

        String payload = encode(kind, cacheKey, result);
        if (cacheable.test(result)) {
            writeCache(kind, cacheKey, payload);
        }

        sample.stop(Timer.builder("aggregate.latency")
                .tag("kind", kind.name())
                .register(meterRegistry));
        executedCounter(kind, "ok").increment();

        log.info("Aggregate {} derived in {} ms", cacheKey, System.currentTimeMillis() - startTime);
        return result;
    }

    private <T> Optional<T> readCache(AggregateKind kind, String cacheKey, TypeReference<T> type) {
        Optional<String> raw;
        try {
            raw = cacheStore.get(cacheKey);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, reading {} from snapshot store: {}", cacheKey, e.getMessage());
            unavailableCounter(kind).increment();
            return Optional.empty();
        }

        if (raw.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(AggregateKind kind, String cacheKey, String payload) {
        try {
            cacheStore.set(cacheKey, payload, freshnessPolicy.ttlFor(kind).orElse(null));
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, {} not cached: {}", cacheKey, e.getMessage());
            unavailableCounter(kind).increment();
        }
    }

    private String encode(AggregateKind kind, String cacheKey, Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} [{}]: {}", kind, cacheKey, e.getMessage(), e);
            executedCounter(kind, "error").increment();
            throw new EncodingException(kind, cacheKey, e);
        }
    }

    // Loaders, called on cache miss only

    private List<SalaryEntry> loadSalaries() {
        List<SalaryEntry> entries = new ArrayList<>();
        if (catalog.size() == 0) {
            return entries;
        }

        Optional<SnapshotRow> latest = snapshotRepository.findLatest(SnapshotTable.SALARIES, catalog.getCodes());
        if (latest.isEmpty()) {
            log.info("No salary snapshot found");
            return entries;
        }

        SnapshotRow row = latest.get();
        for (Language language : catalog.getLanguages()) {
            entries.add(SalaryEntry.builder()
                    .code(language.getCode())
                    .name(language.getName())
                    .moscow(SalaryRanges.forRegion(row.valueOf(language.getCode()), SalaryRanges.Region.MOSCOW))
                    .russia(SalaryRanges.forRegion(row.valueOf(language.getCode()), SalaryRanges.Region.RUSSIA))
                    .build());
        }
        return entries;
    }

    private Map<String, MetricSeries> loadVacancyStatistics(String filter) {
        Instant now = clock.instant();
        Map<String, MetricSeries> result = new LinkedHashMap<>();

        List<String> languageColumns;
        if (filter == null) {
            languageColumns = catalog.getCodes();
        } else if (catalog.isLanguage(filter)) {
            languageColumns = List.of(filter);
        } else {
            languageColumns = List.of();
        }

        if (!languageColumns.isEmpty()) {
            result.putAll(loadSeries(SnapshotTable.LANGUAGE_VACANCIES, languageColumns, now));
        }
        if (filter == null || LanguageCatalog.SOFTWARE_DEVELOPER.equals(filter)) {
            result.putAll(loadSeries(SnapshotTable.PROFESSION_VACANCIES,
                    List.of(LanguageCatalog.SOFTWARE_DEVELOPER), now));
        }
        return result;
    }

    private Map<String, MetricSeries> loadResumeStatistics() {
        Map<String, MetricSeries> series = loadSeries(SnapshotTable.RESUMES,
                List.of(LanguageCatalog.SOFTWARE_DEVELOPER), clock.instant());

        Map<String, MetricSeries> result = new LinkedHashMap<>();
        result.put(RESUMES_METRIC, series.get(LanguageCatalog.SOFTWARE_DEVELOPER));
        return result;
    }

    private Map<String, MetricSeries> loadSeries(SnapshotTable table, List<String> columns, Instant now) {
        List<SnapshotRow> daily = snapshotRepository.findLatestPerDay(table, columns, seriesReducer.dailyWindowStart(now));
        List<SnapshotRow> hourly = snapshotRepository.findSince(table, columns, seriesReducer.hourlyWindowStart(now));

        log.debug("Loaded {} daily and {} hourly rows from {}", daily.size(), hourly.size(), table.getQualifiedName());
        return seriesReducer.reduce(columns, daily, hourly, now);
    }

    private JsonNode loadSkills(String languageCode) {
        Optional<String> document = snapshotRepository.findLatestDocument(SnapshotTable.HOT_SKILLS, languageCode);
        if (document.isEmpty() || document.get().isBlank()) {
            return objectMapper.createArrayNode();
        }

        try {
            JsonNode skills = objectMapper.readTree(document.get());
            return skills == null || skills.isNull() ? objectMapper.createArrayNode() : skills;
        } catch (JsonProcessingException e) {
            String cacheKey = freshnessPolicy.cacheKey(AggregateKind.SKILL_LIST, languageCode);
            log.error("Stored skills for {} are not valid JSON: {}", languageCode, e.getMessage());
            throw new EncodingException(AggregateKind.SKILL_LIST, cacheKey, e);
        }
    }

    private Counter cacheCounter(AggregateKind kind, String result) {
        return Counter.builder("aggregate.cache")
                .tag("kind", kind.name())
                .tag("result", result)
                .register(meterRegistry);
    }

    private Counter executedCounter(AggregateKind kind, String result) {
        return Counter.builder("aggregate.executed")
                .tag("kind", kind.name())
                .tag("result", result)
                .register(meterRegistry);
    }

    private Counter unavailableCounter(AggregateKind kind) {
        return Counter.builder("aggregate.cache.unavailable")
                .tag("kind", kind.name())
                .register(meterRegistry);
    }
}
