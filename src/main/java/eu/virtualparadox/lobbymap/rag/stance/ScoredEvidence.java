package eu.virtualparadox.lobbymap.rag.stance;

import eu.virtualparadox.lobbymap.rag.retriever.Evidence;

/**
 * Evidence after stance scoring. Exactly one of {@code score} and {@code exclusionReason} is set.
 *
 * @param evidence        the retrieved evidence
 * @param score           stance score in [-2, 2], {@code null} when excluded
 * @param rationale       model rationale, {@code null} when excluded
 * @param exclusionReason why the item was left out of the aggregate
 */
public record ScoredEvidence(Evidence evidence, Integer score, String rationale, String exclusionReason) {

    public static ScoredEvidence scored(final Evidence evidence, final JudgmentResult judgment) {
        return new ScoredEvidence(evidence, judgment.score(), judgment.reason(), null);
    }

    public static ScoredEvidence excluded(final Evidence evidence, final String reason) {
        return new ScoredEvidence(evidence, null, null, reason);
    }

    public boolean isValid() {
        return score != null;
    }
}
