package io.troupe.core.run;

import io.troupe.core.compose.CompositionResult;
import io.troupe.core.execution.ExecutionOutcome;
import io.troupe.core.execution.TierAttempt;
import io.troupe.core.form.FormResponse;
import io.troupe.core.report.Report;
import java.util.List;
import java.util.Objects;

/**
 * Everything one execution produced, keyed by a generated run id.
 *
 * @param runId run id, not null
 * @param templateId template executed, not null
 * @param response answers the agents were composed from, not null
 * @param composition composed agents and skipped rules, not null
 * @param outcome settled agent results, not null
 * @param report aggregated report, not null
 * @param attempts every tier attempt of the run, in agent order, never null
 * @param warnings run-level warnings such as unmet dependencies or a rejected plan, never null
 */
public record RunRecord(
        String runId,
        String templateId,
        FormResponse response,
        CompositionResult composition,
        ExecutionOutcome outcome,
        Report report,
        List<TierAttempt> attempts,
        List<String> warnings) {

    public RunRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(templateId, "templateId must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(composition, "composition must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(report, "report must not be null");
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
