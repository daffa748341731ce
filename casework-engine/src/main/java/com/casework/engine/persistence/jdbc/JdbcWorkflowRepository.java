package com.casework.engine.persistence.jdbc;

import com.casework.core.exception.WorkflowValidationException;
import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.RecordType;
import com.casework.core.model.Requirement;
import com.casework.core.model.Transition;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowLifecycle;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.repository.WorkflowRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.casework.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.casework.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of WorkflowRepository.
 * Requirements, actions and allowed roles are stored as JSONB on the transition row.
 */
public class JdbcWorkflowRepository implements WorkflowRepository {

    private static final TypeReference<Map<MatchDimension, Set<String>>> CONSTRAINTS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {};
    private static final TypeReference<List<Requirement>> REQUIREMENTS = new TypeReference<>() {};
    private static final TypeReference<List<ActionDefinition>> ACTIONS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Workflow> workflowMapper = new WorkflowRowMapper();
    private final RowMapper<WorkflowStateDefinition> stateMapper = new StateRowMapper();
    private final RowMapper<Transition> transitionMapper = new TransitionRowMapper();

    public JdbcWorkflowRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    // ========== Workflows ==========

    @Override
    @Transactional
    public void saveWorkflow(Workflow workflow) {
        String sql = """
            INSERT INTO workflows (
                id, code, name, description, record_type, active, default_for_type,
                lifecycle, constraints, required_fields, created_by, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                workflow.id(),
                workflow.code(),
                workflow.name(),
                workflow.description(),
                workflow.recordType().name(),
                workflow.active(),
                workflow.defaultForType(),
                workflow.lifecycle().name(),
                json.toJson(workflow.constraints().values()),
                json.toJson(workflow.requiredFields()),
                workflow.createdBy(),
                toTimestamp(workflow.createdAt()),
                toTimestamp(workflow.updatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new WorkflowValidationException("code", "already in use: " + workflow.code());
        }
    }

    @Override
    @Transactional
    public void updateWorkflow(Workflow workflow) {
        String sql = """
            UPDATE workflows SET
                code = ?, name = ?, description = ?, record_type = ?, active = ?,
                default_for_type = ?, lifecycle = ?, constraints = ?::jsonb,
                required_fields = ?::jsonb, updated_at = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql,
            workflow.code(),
            workflow.name(),
            workflow.description(),
            workflow.recordType().name(),
            workflow.active(),
            workflow.defaultForType(),
            workflow.lifecycle().name(),
            json.toJson(workflow.constraints().values()),
            json.toJson(workflow.requiredFields()),
            toTimestamp(workflow.updatedAt()),
            workflow.id()
        );
    }

    @Override
    public Optional<Workflow> findWorkflow(UUID workflowId) {
        List<Workflow> results = jdbcTemplate.query("SELECT * FROM workflows WHERE id = ?", workflowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Workflow> findWorkflowByCode(String code) {
        List<Workflow> results = jdbcTemplate.query("SELECT * FROM workflows WHERE code = ?", workflowMapper, code);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Workflow> findWorkflows(RecordType recordType) {
        if (recordType == null) {
            return jdbcTemplate.query("SELECT * FROM workflows ORDER BY code", workflowMapper);
        }
        return jdbcTemplate.query(
            "SELECT * FROM workflows WHERE record_type = ? ORDER BY code", workflowMapper, recordType.name());
    }

    @Override
    @Transactional
    public void deleteWorkflow(UUID workflowId) {
        // states and transitions cascade
        jdbcTemplate.update("DELETE FROM workflows WHERE id = ?", workflowId);
    }

    // ========== States ==========

    @Override
    @Transactional
    public void saveState(WorkflowStateDefinition state) {
        String sql = """
            INSERT INTO workflow_states (
                id, workflow_id, code, name, is_initial, is_terminal, sla_hours, sort_order
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            state.id(), state.workflowId(), state.code(), state.name(),
            state.initial(), state.terminal(), state.slaHours(), state.sortOrder());
    }

    @Override
    @Transactional
    public void updateState(WorkflowStateDefinition state) {
        String sql = """
            UPDATE workflow_states SET
                code = ?, name = ?, is_initial = ?, is_terminal = ?, sla_hours = ?, sort_order = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql,
            state.code(), state.name(), state.initial(), state.terminal(),
            state.slaHours(), state.sortOrder(), state.id());
    }

    @Override
    @Transactional
    public void deleteState(UUID stateId) {
        jdbcTemplate.update("DELETE FROM workflow_states WHERE id = ?", stateId);
    }

    @Override
    public Optional<WorkflowStateDefinition> findState(UUID stateId) {
        List<WorkflowStateDefinition> results =
            jdbcTemplate.query("SELECT * FROM workflow_states WHERE id = ?", stateMapper, stateId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowStateDefinition> findStates(UUID workflowId) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_states WHERE workflow_id = ? ORDER BY sort_order, code", stateMapper, workflowId);
    }

    // ========== Transitions ==========

    @Override
    @Transactional
    public void saveTransition(Transition transition) {
        String sql = """
            INSERT INTO workflow_transitions (
                id, workflow_id, code, name, from_state_id, to_state_id,
                requirements, actions, allowed_roles, active, sort_order
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?)
            """;
        jdbcTemplate.update(sql,
            transition.id(),
            transition.workflowId(),
            transition.code(),
            transition.name(),
            transition.fromStateId(),
            transition.toStateId(),
            json.toJson(transition.requirements()),
            json.toJson(transition.actions()),
            json.toJson(transition.allowedRoles()),
            transition.active(),
            transition.sortOrder()
        );
    }

    @Override
    @Transactional
    public void updateTransition(Transition transition) {
        String sql = """
            UPDATE workflow_transitions SET
                code = ?, name = ?, from_state_id = ?, to_state_id = ?,
                requirements = ?::jsonb, actions = ?::jsonb, allowed_roles = ?::jsonb,
                active = ?, sort_order = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql,
            transition.code(),
            transition.name(),
            transition.fromStateId(),
            transition.toStateId(),
            json.toJson(transition.requirements()),
            json.toJson(transition.actions()),
            json.toJson(transition.allowedRoles()),
            transition.active(),
            transition.sortOrder(),
            transition.id()
        );
    }

    @Override
    @Transactional
    public void deleteTransition(UUID transitionId) {
        jdbcTemplate.update("DELETE FROM workflow_transitions WHERE id = ?", transitionId);
    }

    @Override
    public Optional<Transition> findTransition(UUID transitionId) {
        List<Transition> results =
            jdbcTemplate.query("SELECT * FROM workflow_transitions WHERE id = ?", transitionMapper, transitionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Transition> findTransitions(UUID workflowId) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_transitions WHERE workflow_id = ? ORDER BY sort_order, code",
            transitionMapper, workflowId);
    }

    @Override
    public List<Transition> findTransitionsFrom(UUID stateId) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_transitions WHERE from_state_id = ? ORDER BY sort_order, code",
            transitionMapper, stateId);
    }

    // ========== Row mappers ==========

    private class WorkflowRowMapper implements RowMapper<Workflow> {
        @Override
        public Workflow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Workflow(
                UUID.fromString(rs.getString("id")),
                rs.getString("code"),
                rs.getString("name"),
                rs.getString("description"),
                RecordType.valueOf(rs.getString("record_type")),
                rs.getBoolean("active"),
                rs.getBoolean("default_for_type"),
                WorkflowLifecycle.valueOf(rs.getString("lifecycle")),
                new MatchConstraints(json.fromJson(rs.getString("constraints"), CONSTRAINTS, Map.of())),
                json.fromJson(rs.getString("required_fields"), STRING_LIST, List.of()),
                rs.getString("created_by"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        }
    }

    private static class StateRowMapper implements RowMapper<WorkflowStateDefinition> {
        @Override
        public WorkflowStateDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkflowStateDefinition(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("workflow_id")),
                rs.getString("code"),
                rs.getString("name"),
                rs.getBoolean("is_initial"),
                rs.getBoolean("is_terminal"),
                rs.getObject("sla_hours", Integer.class),
                rs.getInt("sort_order")
            );
        }
    }

    private class TransitionRowMapper implements RowMapper<Transition> {
        @Override
        public Transition mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Transition(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("workflow_id")),
                rs.getString("code"),
                rs.getString("name"),
                UUID.fromString(rs.getString("from_state_id")),
                UUID.fromString(rs.getString("to_state_id")),
                json.fromJson(rs.getString("requirements"), REQUIREMENTS, List.of()),
                json.fromJson(rs.getString("actions"), ACTIONS, List.of()),
                json.fromJson(rs.getString("allowed_roles"), STRING_SET, Set.of()),
                rs.getBoolean("active"),
                rs.getInt("sort_order")
            );
        }
    }
}
