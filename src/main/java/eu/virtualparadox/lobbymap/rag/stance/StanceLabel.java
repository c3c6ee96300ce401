package eu.virtualparadox.lobbymap.rag.stance;

public enum StanceLabel {
    STRONGLY_OPPOSING,
    OPPOSING,
    NO_CLEAR_POSITION,
    SUPPORTING,
    STRONGLY_SUPPORTING,
    /** No evidence item could be scored. */
    INSUFFICIENT_EVIDENCE;

    public static StanceLabel of(final Integer score) {
        if (score == null) {
            return INSUFFICIENT_EVIDENCE;
        }
        switch (score) {
            case -2: return STRONGLY_OPPOSING;
            case -1: return OPPOSING;
            case 0: return NO_CLEAR_POSITION;
            case 1: return SUPPORTING;
            case 2: return STRONGLY_SUPPORTING;
            default: throw new IllegalArgumentException("score out of range: " + score);
        }
    }
}
