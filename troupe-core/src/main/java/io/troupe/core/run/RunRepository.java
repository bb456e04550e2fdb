package io.troupe.core.run;

import io.troupe.core.report.Report;
import java.util.List;
import java.util.Optional;

/**
 * Persistence sink for finished runs.
 *
 * <p>The engine reads it only to find the previous report of a template for trend
 * computation; an empty repository is not an error.
 *
 * @see InMemoryRunRepository
 */
public interface RunRepository {

    /**
     * Saves a run, overwriting any run with the same id.
     *
     * @param run finished run, not null
     * @throws NullPointerException if run is null
     */
    void save(RunRecord run);

    /**
     * Finds a run by id.
     *
     * @param runId run id, not null
     * @return the run if found, empty otherwise
     */
    Optional<RunRecord> findById(String runId);

    /**
     * Returns the report of the most recently saved run of a template.
     *
     * @param templateId template id, not null
     * @return the latest report, empty when the template never ran
     */
    Optional<Report> findPreviousReport(String templateId);

    /**
     * Lists every run of a template, oldest first.
     *
     * @param templateId template id, not null
     * @return runs, never null (may be empty)
     */
    List<RunRecord> findByTemplate(String templateId);
}
