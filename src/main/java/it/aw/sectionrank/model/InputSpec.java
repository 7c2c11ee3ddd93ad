package it.aw.sectionrank.model;

import java.util.List;

/**
 * Specifica di input di una collezione: documenti da analizzare, persona e job.
 * Persona e job sono stringhe vuote quando non specificati.
 */
public record InputSpec(List<String> documents, String persona, String job) {

    public InputSpec {
        documents = List.copyOf(documents);
        persona = persona != null ? persona : "";
        job = job != null ? job : "";
    }
}
