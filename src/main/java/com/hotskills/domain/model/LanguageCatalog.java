package com.hotskills.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The metric registry: languages loaded from the reference table at startup
 * plus the built-in profession tag.
 *
 * Immutable. Adding a language requires a restart.
 */
public final class LanguageCatalog {

    public static final String SOFTWARE_DEVELOPER = "software_developer";

    private final List<Language> languages;
    private final Map<String, Language> byCode;

    private LanguageCatalog(List<Language> languages) {
        Map<String, Language> index = new LinkedHashMap<>();
        for (Language language : languages) {
            index.put(language.getCode(), language);
        }
        this.languages = Collections.unmodifiableList(new ArrayList<>(languages));
        this.byCode = Collections.unmodifiableMap(index);
    }

    /**
     * @param languages reference list in ascending id order
     */
    public static LanguageCatalog of(List<Language> languages) {
        return new LanguageCatalog(languages);
    }

    public List<Language> getLanguages() {
        return languages;
    }

    public List<String> getCodes() {
        return new ArrayList<>(byCode.keySet());
    }

    public Optional<Language> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public boolean isLanguage(String code) {
        return byCode.containsKey(code);
    }

    /**
     * True for every name that may appear as a metric column.
     */
    public boolean isKnownMetric(String code) {
        return isLanguage(code) || SOFTWARE_DEVELOPER.equals(code);
    }

    public int size() {
        return languages.size();
    }
}
