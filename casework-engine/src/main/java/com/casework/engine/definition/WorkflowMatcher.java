package com.casework.engine.definition;

import com.casework.core.matching.CriteriaMatcher;
import com.casework.core.matching.MatchCriteria;
import com.casework.core.matching.MatchDimension;
import com.casework.core.matching.MatchResult;
import com.casework.core.model.RecordType;
import com.casework.core.model.Workflow;
import com.casework.core.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Selects the workflow for a new record.
 *
 * <p>Only active, non-deleted workflows of the record's type compete. They are ranked by
 * classification, location, department and channel. When the top tier is ambiguous and
 * contains the type's default workflow, the default wins. When no workflow's constraints
 * fit, the type's default workflow is used.
 */
public class WorkflowMatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowMatcher.class);

    private final WorkflowRepository repository;
    private final CriteriaMatcher matcher = CriteriaMatcher.over(
        MatchDimension.CLASSIFICATION,
        MatchDimension.LOCATION,
        MatchDimension.DEPARTMENT,
        MatchDimension.CHANNEL
    );

    public WorkflowMatcher(WorkflowRepository repository) {
        this.repository = repository;
    }

    /**
     * Raw ranking of the candidate workflows, ties included.
     */
    public MatchResult<Workflow> match(RecordType recordType, MatchCriteria criteria) {
        List<Workflow> candidates = repository.findWorkflows(recordType).stream()
            .filter(Workflow::isSelectable)
            .toList();
        return matcher.match(candidates, criteria);
    }

    /**
     * The workflow a record with these attributes should follow, if one can be chosen
     * without manual disambiguation.
     */
    public Optional<Workflow> resolve(RecordType recordType, MatchCriteria criteria) {
        MatchResult<Workflow> result = match(recordType, criteria);
        if (result.single()) {
            return result.winner();
        }
        if (result.isEmpty()) {
            return defaultFor(recordType);
        }
        Optional<Workflow> fallback = result.matches().stream()
            .filter(Workflow::defaultForType)
            .findFirst();
        if (fallback.isEmpty()) {
            log.info("Ambiguous workflow match for {}: {} candidates tie", recordType, result.matches().size());
        }
        return fallback;
    }

    /**
     * The active default workflow of a record type, used when no workflow's constraints fit.
     */
    public Optional<Workflow> defaultFor(RecordType recordType) {
        return repository.findWorkflows(recordType).stream()
            .filter(Workflow::isSelectable)
            .filter(Workflow::defaultForType)
            .findFirst();
    }
}
