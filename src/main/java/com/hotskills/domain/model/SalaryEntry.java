package com.hotskills.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Salary table row for one language.
 *
 * Each region holds four formatted ranges, one per experience bracket
 * (none, 1-3 years, 3-6 years, 6+ years).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalaryEntry {

    private String code;
    private String name;
    private List<String> moscow;
    private List<String> russia;
}
