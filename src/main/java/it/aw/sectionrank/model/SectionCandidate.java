package it.aw.sectionrank.model;

import java.util.Comparator;

/**
 * Span ipotizzato come heading, con il suo punteggio composito.
 */
public record SectionCandidate(
        String   document,
        int      page,
        String   title,
        double   score,
        TextSpan span
) {

    /**
     * Ordine di ranking: punteggio decrescente, poi pagina crescente,
     * poi posizione dall'alto verso il basso e da sinistra a destra.
     */
    public static final Comparator<SectionCandidate> RANKING =
            Comparator.comparingDouble(SectionCandidate::score).reversed()
                    .thenComparingInt(SectionCandidate::page)
                    .thenComparingDouble(c -> c.span().position().y())
                    .thenComparingDouble(c -> c.span().position().x());
}
