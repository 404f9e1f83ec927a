package com.hotskills.domain.service;

import com.hotskills.domain.model.MetricValue;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SalaryRangesTest {

    @Test
    void testFormat_RoundsToHundredsWithGrouping() {
        assertEquals("123\u00A0500 ₽ – 789\u00A0000 ₽", SalaryRanges.format(123456L, 789012L));
        assertEquals("500 ₽ – 1\u00A0000 ₽", SalaryRanges.format(450L, 1049L));
    }

    @Test
    void testFormat_ZeroPairIsNoData() {
        assertEquals(SalaryRanges.NO_DATA, SalaryRanges.format(0L, 0L));
        assertEquals(SalaryRanges.NO_DATA, SalaryRanges.format(null, null));
    }

    @Test
    void testFormat_OneSidedRange() {
        assertEquals("0 ₽ – 150\u00A0000 ₽", SalaryRanges.format(0L, 150000L));
    }

    @Test
    void testRoundToHundreds() {
        assertEquals(123500, SalaryRanges.roundToHundreds(123456));
        assertEquals(123400, SalaryRanges.roundToHundreds(123449));
        assertEquals(0, SalaryRanges.roundToHundreds(49));
    }

    @Test
    void testForRegion_ReadsRegionOffset() {
        // Given
        MetricValue bounds = MetricValue.ofVector(Arrays.asList(
                100000L, 200000L, 0L, 0L, 0L, 0L, 0L, 0L,
                50000L, 90000L, 0L, 0L, 0L, 0L, null, 300000L));

        // When
        List<String> moscow = SalaryRanges.forRegion(bounds, SalaryRanges.Region.MOSCOW);
        List<String> russia = SalaryRanges.forRegion(bounds, SalaryRanges.Region.RUSSIA);

        // Then
        assertEquals(List.of("100\u00A0000 ₽ – 200\u00A0000 ₽", SalaryRanges.NO_DATA, SalaryRanges.NO_DATA, SalaryRanges.NO_DATA),
                moscow);
        assertEquals("50\u00A0000 ₽ – 90\u00A0000 ₽", russia.get(0));
        assertEquals("0 ₽ – 300\u00A0000 ₽", russia.get(3));
    }

    @Test
    void testForRegion_MissingValue() {
        assertEquals(List.of(SalaryRanges.NO_DATA, SalaryRanges.NO_DATA, SalaryRanges.NO_DATA, SalaryRanges.NO_DATA),
                SalaryRanges.forRegion(null, SalaryRanges.Region.MOSCOW));
    }

    @Test
    void testForRegion_ShortVector() {
        MetricValue bounds = MetricValue.ofVector(List.of(100000L, 200000L));

        List<String> russia = SalaryRanges.forRegion(bounds, SalaryRanges.Region.RUSSIA);

        assertEquals(4, russia.size());
        assertTrue(russia.stream().allMatch(SalaryRanges.NO_DATA::equals));
    }
}
