package com.hotskills.config;

import com.hotskills.domain.model.LanguageCatalog;
import com.hotskills.infrastructure.persistence.entity.LanguageEntity;
import com.hotskills.infrastructure.persistence.repository.LanguageRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatisticsConfigTest {

    @Mock
    private LanguageRepository languageRepository;

    private final StatisticsConfig config = new StatisticsConfig();

    @Test
    void testLanguageCatalog_KeepsReferenceOrder() {
        // Given
        when(languageRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                LanguageEntity.builder().id(1L).code("one_c").name("1C").color("#E31E24").build(),
                LanguageEntity.builder().id(2L).code("python").name("Python").build()));

        // When
        LanguageCatalog catalog = config.languageCatalog(languageRepository);

        // Then
        assertEquals(List.of("one_c", "python"), catalog.getCodes());
        assertEquals("1C", catalog.find("one_c").orElseThrow().getName());
        assertNull(catalog.find("python").orElseThrow().getColor());
        assertTrue(catalog.isKnownMetric(LanguageCatalog.SOFTWARE_DEVELOPER));
        assertFalse(catalog.isLanguage(LanguageCatalog.SOFTWARE_DEVELOPER));
    }

    @Test
    void testLanguageCatalog_EmptyTable() {
        when(languageRepository.findAllByOrderByIdAsc()).thenReturn(List.of());

        LanguageCatalog catalog = config.languageCatalog(languageRepository);

        assertEquals(0, catalog.size());
        assertTrue(catalog.find("python").isEmpty());
    }
}
