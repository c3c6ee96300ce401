package eu.virtualparadox.lobbymap.rag.stance;

import java.util.List;

/**
 * Pure aggregation of per-item stance scores. Depends only on the scored evidence list, so a stored
 * verdict can always be recomputed.
 *
 * <ul>
 *   <li>Overall score: simple or token-weighted mean of valid scores, rounded to the nearest integer
 *       with exact halves rounded away from zero.</li>
 *   <li>Confidence: share of valid items whose score has the same sign as the overall score.</li>
 *   <li>Excluded items are counted but never weighted.</li>
 * </ul>
 */
public final class StanceAggregation {

    private StanceAggregation() {
        // prevent instantiation
    }

    public record Result(Integer overallScore, double confidence, int validCount, int excludedCount) {
    }

    public static Result aggregate(final List<ScoredEvidence> items, final AggregationWeighting weighting) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        int valid = 0;
        int excluded = 0;

        for (final ScoredEvidence item : items) {
            if (!item.isValid()) {
                excluded++;
                continue;
            }
            final double weight = weightOf(item, weighting);
            weightedSum += weight * item.score();
            totalWeight += weight;
            valid++;
        }

        if (valid == 0 || totalWeight == 0.0) {
            return new Result(null, 0.0, valid, excluded);
        }

        final int overall = roundHalfAwayFromZero(weightedSum / totalWeight);
        int agreeing = 0;
        for (final ScoredEvidence item : items) {
            if (item.isValid() && Integer.signum(item.score()) == Integer.signum(overall)) {
                agreeing++;
            }
        }
        return new Result(overall, (double) agreeing / valid, valid, excluded);
    }

    static int roundHalfAwayFromZero(final double value) {
        final long rounded = (long) Math.floor(Math.abs(value) + 0.5);
        final int signed = (int) (value < 0 ? -rounded : rounded);
        return Math.max(JudgmentResult.MIN_SCORE, Math.min(JudgmentResult.MAX_SCORE, signed));
    }

    private static double weightOf(final ScoredEvidence item, final AggregationWeighting weighting) {
        if (weighting == AggregationWeighting.TOKEN) {
            return Math.max(1, item.evidence().metadata().tokenCount());
        }
        return 1.0;
    }
}
