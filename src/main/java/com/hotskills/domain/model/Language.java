package com.hotskills.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the language reference list.
 *
 * The code doubles as the metric name: it is the column name in every
 * per-language snapshot table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Language {

    private String code;
    private String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String color;
}
