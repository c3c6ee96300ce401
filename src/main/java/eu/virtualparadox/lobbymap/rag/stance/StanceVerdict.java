package eu.virtualparadox.lobbymap.rag.stance;

import eu.virtualparadox.lobbymap.query.citation.Citation;

import java.util.List;

/**
 * Aggregate stance for one (company, policy question) pair with the full scored evidence list.
 *
 * @param subject        company under assessment, may be {@code null}
 * @param policyQuestion the question the evidence was judged against
 * @param overallScore   aggregate score in [-2, 2], {@code null} if nothing could be scored
 * @param label          label of the overall score
 * @param confidence     share of valid items agreeing in sign with the overall score
 * @param validCount     items that contributed
 * @param excludedCount  items left out because their judgment failed
 * @param weighting      weighting used for the aggregate
 * @param evidence       every evidence item in retrieval order, with its score or exclusion reason
 * @param citations      documents and pages behind the valid evidence
 * @param diagnostics    one line per excluded item
 */
public record StanceVerdict(String subject,
                            String policyQuestion,
                            Integer overallScore,
                            StanceLabel label,
                            double confidence,
                            int validCount,
                            int excludedCount,
                            AggregationWeighting weighting,
                            List<ScoredEvidence> evidence,
                            List<Citation> citations,
                            List<String> diagnostics) {
}
