package io.troupe.core.run;

import io.troupe.core.report.Report;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory run repository (default implementation).
 *
 * <p>Runs are indexed by run id and, in save order, by template id. Nothing survives the
 * process.
 *
 * @implNote Uses ConcurrentHashMap for thread-safety; per-template lists are guarded by their
 *     own monitor.
 */
public final class InMemoryRunRepository implements RunRepository {

    private final Map<String, RunRecord> runs = new ConcurrentHashMap<>();
    private final Map<String, List<RunRecord>> byTemplate = new ConcurrentHashMap<>();

    @Override
    public void save(RunRecord run) {
        Objects.requireNonNull(run, "run must not be null");

        RunRecord previous = runs.put(run.runId(), run);
        List<RunRecord> history =
                byTemplate.computeIfAbsent(run.templateId(), k -> new ArrayList<>());
        synchronized (history) {
            if (previous != null) {
                history.remove(previous);
            }
            history.add(run);
        }
    }

    @Override
    public Optional<RunRecord> findById(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public Optional<Report> findPreviousReport(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");

        List<RunRecord> history = byTemplate.get(templateId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return history.isEmpty()
                    ? Optional.empty()
                    : Optional.of(history.get(history.size() - 1).report());
        }
    }

    @Override
    public List<RunRecord> findByTemplate(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");

        List<RunRecord> history = byTemplate.get(templateId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public int count() {
        return runs.size();
    }

    /** Clears all data (useful for testing). */
    public void clear() {
        runs.clear();
        byTemplate.clear();
    }
}
