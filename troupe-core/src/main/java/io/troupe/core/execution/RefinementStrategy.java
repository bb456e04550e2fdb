package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.criteria.CriteriaVerdict;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.Tier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Producer/reviewer loop for outputs that benefit from iterative critique.
 *
 * <p>The plan holds exactly two specs: the producer first, the reviewer second. Each round:
 *
 * <ol>
 *   <li>the producer runs with the accumulated {@code review_feedback}
 *   <li>the reviewer runs with the producer's output as {@code draft}
 *   <li>the producer's success criteria are evaluated against the reviewer's output
 * </ol>
 *
 * The loop stops at the first passing round or after {@code maxRefinementRounds}. Attempts of
 * every round accumulate into one result per spec. If either agent fails outright the loop
 * stops; a reviewer that never ran is recorded as skipped with {@code DEPENDENCY_UNMET}.
 */
public class RefinementStrategy implements ExecutionStrategy {

    private static final Logger logger = Logger.getLogger(RefinementStrategy.class.getName());

    static final String FEEDBACK_KEY = "review_feedback";
    static final String DRAFT_KEY = "draft";
    static final String ROUND_KEY = "refinement_round";

    private static final String NOT_STARTED = "plan cancelled before start";

    @Override
    public StrategyType type() {
        return StrategyType.REFINEMENT;
    }

    @Override
    public Optional<String> validate(ExecutionPlan plan) {
        if (plan.getSpecs().size() != 2) {
            return Optional.of(
                    "refinement needs exactly a producer and a reviewer, got "
                            + plan.getSpecs().size()
                            + " agent(s)");
        }
        return Optional.empty();
    }

    @Override
    public StrategyResult execute(ExecutionPlan plan, StrategyContext context) {
        AgentSpec producer = plan.getSpecs().get(0);
        AgentSpec reviewer = plan.getSpecs().get(1);
        int maxRounds = Math.max(1, context.maxRefinementRounds());

        List<String> feedback = new ArrayList<>();
        List<TierAttempt> producerAttempts = new ArrayList<>();
        List<TierAttempt> reviewerAttempts = new ArrayList<>();
        List<String> producerWarnings = new ArrayList<>();
        List<String> reviewerWarnings = new ArrayList<>();

        AgentResult lastProducer = null;
        AgentResult lastReviewer = null;
        CriteriaVerdict verdict = null;
        int round = 0;

        while (round < maxRounds) {
            if (context.cancellation().isCancelled()) {
                break;
            }
            round++;

            Map<String, Object> producerContext = new LinkedHashMap<>(plan.getInitialContext());
            producerContext.put(ROUND_KEY, round);
            producerContext.put(FEEDBACK_KEY, List.copyOf(feedback));
            lastProducer = context.run(producer, producerContext, false);
            producerAttempts.addAll(lastProducer.attempts());
            producerWarnings.addAll(lastProducer.warnings());
            if (!lastProducer.isSuccess()) {
                break;
            }

            Map<String, Object> reviewerContext = new LinkedHashMap<>(plan.getInitialContext());
            reviewerContext.put(ROUND_KEY, round);
            reviewerContext.put(DRAFT_KEY, lastProducer.output());
            reviewerContext.put(producer.getRole() + "_output", lastProducer.output());
            lastReviewer = context.run(reviewer, reviewerContext, true);
            reviewerAttempts.addAll(lastReviewer.attempts());
            reviewerWarnings.addAll(lastReviewer.warnings());
            if (!lastReviewer.isSuccess()) {
                break;
            }

            verdict = producer.getSuccessCriteria().evaluate(lastReviewer.output());
            if (verdict.passed()) {
                logger.info("Refinement of " + producer.getRole() + " passed in round " + round);
                break;
            }
            feedback.add(feedbackFrom(lastReviewer.output(), verdict));
            logger.info(
                    "Refinement round "
                            + round
                            + " of "
                            + producer.getRole()
                            + " rejected: "
                            + verdict.summary());
        }

        AgentResult producerResult;
        AgentResult reviewerResult;
        if (lastProducer == null) {
            producerResult = context.skip(producer, ErrorKind.CANCELLED, NOT_STARTED);
            reviewerResult = context.skip(reviewer, ErrorKind.CANCELLED, NOT_STARTED);
            return new StrategyResult(List.of(producerResult, reviewerResult), 0);
        }

        if (!lastProducer.isSuccess()) {
            producerResult =
                    accumulate(lastProducer, producerAttempts, producerWarnings, null, null);
        } else if (lastReviewer == null || !lastReviewer.isSuccess()) {
            producerResult =
                    accumulate(
                            lastProducer,
                            producerAttempts,
                            producerWarnings,
                            ErrorKind.CRITERIA_NOT_MET,
                            "draft was not accepted: review unavailable");
        } else if (verdict != null && verdict.passed()) {
            producerResult =
                    accumulate(lastProducer, producerAttempts, producerWarnings, null, null);
        } else {
            boolean cancelled = context.cancellation().isCancelled() && round < maxRounds;
            producerResult =
                    accumulate(
                            lastProducer,
                            producerAttempts,
                            producerWarnings,
                            cancelled ? ErrorKind.CANCELLED : ErrorKind.CRITERIA_NOT_MET,
                            (cancelled ? "plan cancelled" : "criteria not met")
                                    + " after "
                                    + round
                                    + " round(s): "
                                    + (verdict != null ? verdict.summary() : "no verdict"));
        }

        if (lastReviewer == null) {
            reviewerResult =
                    context.skip(
                            reviewer,
                            ErrorKind.DEPENDENCY_UNMET,
                            "producer " + producer.getRole() + " did not produce a draft");
        } else {
            reviewerResult =
                    accumulate(lastReviewer, reviewerAttempts, reviewerWarnings, null, null);
        }
        return new StrategyResult(List.of(producerResult, reviewerResult), round);
    }

    /**
     * Rebuilds a round's result with every attempt of the loop, optionally overriding the
     * outcome as a failure.
     */
    private static AgentResult accumulate(
            AgentResult last,
            List<TierAttempt> attempts,
            List<String> warnings,
            ErrorKind failureKind,
            String failureMessage) {
        if (failureKind == null) {
            return new AgentResult(
                    last.agentId(),
                    last.role(),
                    last.status(),
                    last.output(),
                    last.finalTier(),
                    last.errorKind(),
                    last.message(),
                    attempts,
                    warnings);
        }
        Tier finalTier = last.finalTier();
        return new AgentResult(
                last.agentId(),
                last.role(),
                AgentStatus.FAILED,
                last.output(),
                finalTier,
                failureKind,
                failureMessage,
                attempts,
                warnings);
    }

    private static String feedbackFrom(Map<String, Object> reviewOutput, CriteriaVerdict verdict) {
        Object feedback = reviewOutput.get("feedback");
        if (feedback instanceof List<?> items) {
            return String.join("; ", items.stream().map(String::valueOf).toList());
        }
        if (feedback != null) {
            return String.valueOf(feedback);
        }
        return verdict.summary();
    }
}
