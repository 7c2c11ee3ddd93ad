package it.aw.sectionrank.service;

import it.aw.sectionrank.model.InputSpec;
import it.aw.sectionrank.model.OutputResult;
import it.aw.sectionrank.model.SelectedSection;
import it.aw.sectionrank.model.SubsectionEntry;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compone il risultato finale. Pura aggregazione: nessun filtro né punteggio,
 * il timestamp arriva dal chiamante.
 */
@Service
public class OutputAssembler {

    public OutputResult assemble(InputSpec spec,
                                 String timestamp,
                                 List<SelectedSection> sections,
                                 List<SubsectionEntry> subsections) {
        OutputResult.Metadata metadata = new OutputResult.Metadata(
                spec.documents(), spec.persona(), spec.job(), timestamp);
        return new OutputResult(metadata, sections, subsections);
    }
}
