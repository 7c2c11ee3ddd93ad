package it.aw.sectionrank.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Documento PDF convertito in span: una {@link PageRecord} per pagina.
 *
 * @param filename nome del file così come compare nella specifica di input
 * @param title    titolo dal dizionario Info del PDF, null se assente
 * @param pages    pagine in ordine
 */
public record Document(String filename, String title, List<PageRecord> pages) {

    public Document {
        pages = List.copyOf(pages);
    }

    /** Tutti gli span del documento, pagina per pagina. */
    public Stream<TextSpan> spans() {
        return pages.stream().flatMap(p -> p.spans().stream());
    }
}
