package it.aw.sectionrank.model;

/**
 * Frammento di testo contiguo con font e posizione omogenei, così come
 * riportato dal parser PDF. Immutabile.
 */
public record TextSpan(
        String       text,
        float        fontSize,     // in punti
        boolean      bold,
        SpanPosition position,
        int          pageNumber    // 1-based
) {}
