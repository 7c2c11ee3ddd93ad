package it.aw.sectionrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Sezione promossa dal selettore. {@code importanceRank} è 1-based.
 */
@JsonPropertyOrder({"document", "page", "title", "importance_rank"})
public record SelectedSection(
        @JsonProperty("document")        String document,
        @JsonProperty("page")            int    page,
        @JsonProperty("title")           String title,
        @JsonProperty("importance_rank") int    importanceRank
) {}
