package com.hotskills.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the language page needs: identity plus the current hot skills.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageProfile {

    private String code;
    private String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String color;

    // Stored as-is by the collector, usually [[skill, mentions], ...]
    private JsonNode skills;
}
