package it.aw.sectionrank.model;

import java.util.List;

/**
 * Titolo e struttura di heading di un singolo documento.
 */
public record DocumentOutline(String title, List<OutlineEntry> outline) {

    public DocumentOutline {
        outline = List.copyOf(outline);
    }
}
