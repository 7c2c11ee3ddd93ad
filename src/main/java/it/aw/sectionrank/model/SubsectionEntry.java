package it.aw.sectionrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Estratto testuale rifinito: sottostringa verbatim (eventualmente troncata
 * con "...") del contenuto di una pagina.
 */
@JsonPropertyOrder({"document", "page", "refined_text"})
public record SubsectionEntry(
        @JsonProperty("document")     String document,
        @JsonProperty("page")         int    page,
        @JsonProperty("refined_text") String refinedText
) {}
