package eu.virtualparadox.lobbymap.rag.stance;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.application.executor.FanOutExecutor;
import eu.virtualparadox.lobbymap.application.executor.FanOutResult;
import eu.virtualparadox.lobbymap.application.executor.ModelCallGuard;
import eu.virtualparadox.lobbymap.exception.ExternalServiceTimeoutException;
import eu.virtualparadox.lobbymap.exception.JudgmentParseException;
import eu.virtualparadox.lobbymap.query.citation.Citation;
import eu.virtualparadox.lobbymap.query.citation.CitationResolverService;
import eu.virtualparadox.lobbymap.rag.retriever.Evidence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scores every evidence item against a policy question and folds the scores into one verdict.
 * <p>
 * Items are judged in parallel. An item whose judgment times out, fails or cannot be parsed is kept in
 * the verdict as excluded, with a diagnostic line, and does not take part in the aggregate.
 */
@Service
@Slf4j
public class StanceAggregator {

    private final JudgmentModel judgmentModel;
    private final StancePromptTemplate promptTemplate;
    private final ModelCallGuard guard;
    private final FanOutExecutor fanOutExecutor;
    private final CitationResolverService citationResolver;
    private final AggregationWeighting weighting;

    @Autowired
    public StanceAggregator(final JudgmentModel judgmentModel,
                            final StancePromptTemplate promptTemplate,
                            final ModelCallGuard guard,
                            final FanOutExecutor fanOutExecutor,
                            final CitationResolverService citationResolver,
                            final ApplicationConfig config) {
        this(judgmentModel, promptTemplate, guard, fanOutExecutor, citationResolver,
                AggregationWeighting.fromConfig(config.getStance().getWeighting()));
    }

    public StanceAggregator(final JudgmentModel judgmentModel,
                            final StancePromptTemplate promptTemplate,
                            final ModelCallGuard guard,
                            final FanOutExecutor fanOutExecutor,
                            final CitationResolverService citationResolver,
                            final AggregationWeighting weighting) {
        this.judgmentModel = judgmentModel;
        this.promptTemplate = promptTemplate;
        this.guard = guard;
        this.fanOutExecutor = fanOutExecutor;
        this.citationResolver = citationResolver;
        this.weighting = weighting;
    }

    public StanceVerdict assess(final List<Evidence> evidence, final String policyQuestion) {
        return assess(evidence, policyQuestion, null);
    }

    /**
     * @param evidence       retrieved evidence, in retrieval order
     * @param policyQuestion non-blank policy question
     * @param subject        company the evidence is about, {@code null} if unknown
     */
    public StanceVerdict assess(final List<Evidence> evidence, final String policyQuestion, final String subject) {
        if (policyQuestion == null || policyQuestion.isBlank()) {
            throw new IllegalArgumentException("policyQuestion must not be blank");
        }
        if (evidence == null || evidence.isEmpty()) {
            log.info("No evidence to assess for '{}'", policyQuestion);
            return verdict(subject, policyQuestion, Collections.emptyList(), Collections.emptyList());
        }

        final String prompt = promptTemplate.render(policyQuestion, subject);
        final List<Callable<JudgmentResult>> tasks = new ArrayList<>(evidence.size());
        for (final Evidence item : evidence) {
            tasks.add(() -> guard.call("judge", () -> judgmentModel.judge(prompt, item.text())));
        }
        final List<FanOutResult<JudgmentResult>> judgments = fanOutExecutor.invokeAll(tasks);

        final List<ScoredEvidence> scored = new ArrayList<>(evidence.size());
        final List<String> diagnostics = new ArrayList<>();
        for (int i = 0; i < evidence.size(); i++) {
            final Evidence item = evidence.get(i);
            final FanOutResult<JudgmentResult> judgment = judgments.get(i);
            if (judgment.isSuccess()) {
                scored.add(ScoredEvidence.scored(item, judgment.value()));
                continue;
            }
            final String reason = exclusionReason(judgment.failure());
            log.warn("Evidence {} excluded from stance: {}", item.chunkId(), reason);
            diagnostics.add(item.chunkId() + ": " + reason);
            scored.add(ScoredEvidence.excluded(item, reason));
        }
        return verdict(subject, policyQuestion, scored, diagnostics);
    }

    private StanceVerdict verdict(final String subject,
                                  final String policyQuestion,
                                  final List<ScoredEvidence> scored,
                                  final List<String> diagnostics) {
        final StanceAggregation.Result result = StanceAggregation.aggregate(scored, weighting);

        final List<Evidence> valid = new ArrayList<>();
        for (final ScoredEvidence item : scored) {
            if (item.isValid()) {
                valid.add(item.evidence());
            }
        }
        final List<Citation> citations = citationResolver.getCitations(valid);

        log.info("Stance for '{}' ({}): score={}, confidence={}, valid={}, excluded={}",
                policyQuestion, subject, result.overallScore(), result.confidence(),
                result.validCount(), result.excludedCount());

        return new StanceVerdict(subject, policyQuestion, result.overallScore(), StanceLabel.of(result.overallScore()),
                result.confidence(), result.validCount(), result.excludedCount(), weighting,
                Collections.unmodifiableList(scored), citations, Collections.unmodifiableList(diagnostics));
    }

    private static String exclusionReason(final Throwable failure) {
        if (failure instanceof JudgmentParseException) {
            return "malformed judgment: " + failure.getMessage();
        }
        if (failure instanceof ExternalServiceTimeoutException) {
            return "judgment timed out: " + failure.getMessage();
        }
        return "judgment failed: " + failure;
    }
}
