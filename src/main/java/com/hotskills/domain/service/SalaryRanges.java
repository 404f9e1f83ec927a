package com.hotskills.domain.service;

import com.hotskills.domain.model.MetricValue;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats salary bounds for the salary table.
 *
 * A salary value holds 16 bounds: four (min, max) pairs for Moscow followed
 * by four pairs for Russia. A (0, 0) pair means no vacancies carried a
 * salary for that bracket.
 */
public final class SalaryRanges {

    public static final String NO_DATA = "нет данных";

    public static final int BRACKETS = 4;

    private static final char NBSP = '\u00A0';

    public enum Region {
        MOSCOW(0),
        RUSSIA(BRACKETS * 2);

        private final int offset;

        Region(int offset) {
            this.offset = offset;
        }
    }

    private SalaryRanges() {
    }

    /**
     * Four formatted ranges for one region. A missing value gives four
     * no-data markers.
     */
    public static List<String> forRegion(MetricValue value, Region region) {
        List<String> ranges = new ArrayList<>(BRACKETS);
        for (int bracket = 0; bracket < BRACKETS; bracket++) {
            int index = region.offset + bracket * 2;
            Long min = value == null ? null : value.component(index);
            Long max = value == null ? null : value.component(index + 1);
            ranges.add(format(min, max));
        }
        return ranges;
    }

    /**
     * "80 000 ₽ – 120 000 ₽" with both bounds rounded to the nearest hundred,
     * or {@link #NO_DATA} for a (0, 0) pair. NULL bounds count as 0.
     */
    public static String format(Long min, Long max) {
        long low = min == null ? 0 : min;
        long high = max == null ? 0 : max;

        if (low == 0 && high == 0) {
            return NO_DATA;
        }

        DecimalFormat amount = amountFormat();
        return amount.format(roundToHundreds(low)) + " ₽ – " + amount.format(roundToHundreds(high)) + " ₽";
    }

    static long roundToHundreds(long value) {
        return Math.round(value / 100.0) * 100;
    }

    // DecimalFormat is not thread-safe
    private static DecimalFormat amountFormat() {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.forLanguageTag("ru-RU"));
        symbols.setGroupingSeparator(NBSP);
        return new DecimalFormat("#,##0", symbols);
    }
}
