package eu.virtualparadox.lobbymap.rag.stance;

import java.util.Locale;

/**
 * How per-item scores are weighted in the overall stance.
 */
public enum AggregationWeighting {
    /** Every valid item counts once. */
    SIMPLE,
    /** Items count proportionally to their chunk token count. */
    TOKEN;

    public static AggregationWeighting fromConfig(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
