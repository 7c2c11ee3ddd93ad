package it.aw.sectionrank.model;

import java.util.List;

/**
 * Span di una singola pagina, nell'ordine di lettura del parser.
 */
public record PageRecord(int pageNumber, List<TextSpan> spans) {

    public PageRecord {
        spans = List.copyOf(spans);
    }
}
