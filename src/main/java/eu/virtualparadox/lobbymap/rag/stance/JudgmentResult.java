package eu.virtualparadox.lobbymap.rag.stance;

/**
 * Validated judgment for one evidence item.
 *
 * @param score  stance score in [-2, 2]
 * @param reason model rationale
 */
public record JudgmentResult(int score, String reason) {

    public static final int MIN_SCORE = -2;
    public static final int MAX_SCORE = 2;

    public JudgmentResult {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be within [-2, 2], got " + score);
        }
    }
}
