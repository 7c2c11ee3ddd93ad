package it.aw.sectionrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Risultato finale di un'elaborazione, serializzato in {@code predicted_output.json}.
 * I nomi dei campi JSON sono un contratto con i valutatori a valle.
 */
@JsonPropertyOrder({"metadata", "extracted_sections", "subsection_analysis"})
public record OutputResult(
        @JsonProperty("metadata")            Metadata              metadata,
        @JsonProperty("extracted_sections")  List<SelectedSection> extractedSections,
        @JsonProperty("subsection_analysis") List<SubsectionEntry> subsectionAnalysis
) {

    public OutputResult {
        extractedSections = List.copyOf(extractedSections);
        subsectionAnalysis = List.copyOf(subsectionAnalysis);
    }

    @JsonPropertyOrder({"input_documents", "persona", "job", "timestamp"})
    public record Metadata(
            @JsonProperty("input_documents") List<String> inputDocuments,
            @JsonProperty("persona")         String       persona,
            @JsonProperty("job")             String       job,
            @JsonProperty("timestamp")       String       timestamp
    ) {
        public Metadata {
            inputDocuments = List.copyOf(inputDocuments);
        }
    }
}
