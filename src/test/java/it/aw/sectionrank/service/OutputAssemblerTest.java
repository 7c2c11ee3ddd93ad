package it.aw.sectionrank.service;

import it.aw.sectionrank.model.InputSpec;
import it.aw.sectionrank.model.OutputResult;
import it.aw.sectionrank.model.SelectedSection;
import it.aw.sectionrank.model.SubsectionEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutputAssembler")
class OutputAssemblerTest {

    private final OutputAssembler assembler = new OutputAssembler();

    @Test
    @DisplayName("riporta metadati e liste così come ricevuti")
    void shouldCopyMetadataAndListsVerbatim() {
        InputSpec spec = new InputSpec(List.of("b.pdf", "a.pdf"), "Travel Planner", "Plan a trip");
        List<SelectedSection> sections = List.of(new SelectedSection("a.pdf", 2, "Coastal Adventures", 1));
        List<SubsectionEntry> subsections = List.of(new SubsectionEntry("b.pdf", 1, "Beaches are nearby."));

        OutputResult result = assembler.assemble(spec, "2025-01-01T10:00:00Z", sections, subsections);

        assertThat(result.metadata().inputDocuments()).containsExactly("b.pdf", "a.pdf");
        assertThat(result.metadata().persona()).isEqualTo("Travel Planner");
        assertThat(result.metadata().job()).isEqualTo("Plan a trip");
        assertThat(result.metadata().timestamp()).isEqualTo("2025-01-01T10:00:00Z");
        assertThat(result.extractedSections()).isEqualTo(sections);
        assertThat(result.subsectionAnalysis()).isEqualTo(subsections);
    }

    @Test
    @DisplayName("liste vuote restano vuote")
    void shouldAcceptEmptyLists() {
        OutputResult result = assembler.assemble(new InputSpec(List.of("a.pdf"), "", ""),
                "2025-01-01T10:00:00Z", List.of(), List.of());

        assertThat(result.extractedSections()).isEmpty();
        assertThat(result.subsectionAnalysis()).isEmpty();
        assertThat(result.metadata().persona()).isEmpty();
    }
}
