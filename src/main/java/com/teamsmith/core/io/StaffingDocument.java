package com.teamsmith.core.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw shape of an input document, bound as-is before validation.
 *
 * @param tasks  entries under {@code Tasks}
 * @param people entries under {@code Peoples}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaffingDocument(
    @JsonProperty("Tasks") List<TaskEntry> tasks,
    @JsonProperty("Peoples") List<PersonEntry> people
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskEntry(
        String name,
        List<String> skills
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersonEntry(
        String name,
        BigDecimal salary,
        List<String> skills
    ) {
    }
}
