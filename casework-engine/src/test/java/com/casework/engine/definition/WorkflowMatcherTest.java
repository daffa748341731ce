package com.casework.engine.definition;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.MatchCriteria;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.RecordType;
import com.casework.core.model.Workflow;
import com.casework.engine.definition.WorkflowDefinitionService.WorkflowDraft;
import com.casework.engine.test.CaseworkFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.casework.engine.test.CaseworkFixture.ADMIN;
import static org.assertj.core.api.Assertions.assertThat;

class WorkflowMatcherTest {

    private CaseworkFixture fixture;
    private WorkflowMatcher matcher;

    @BeforeEach
    void setUp() {
        fixture = new CaseworkFixture();
        matcher = fixture.workflowMatcher;
    }

    private Workflow workflow(String code, boolean isDefault, MatchConstraints constraints) {
        WorkflowDraft draft = WorkflowDraft.of(code, code, RecordType.INCIDENT).withConstraints(constraints);
        return fixture.definitions.createWorkflow(isDefault ? draft.asDefault() : draft, ADMIN);
    }

    private static MatchConstraints classification(String... values) {
        return MatchConstraints.builder().accept(MatchDimension.CLASSIFICATION, values).build();
    }

    private static MatchCriteria criteria(String classification, String location) {
        return MatchCriteria.builder()
            .with(MatchDimension.CLASSIFICATION, classification)
            .with(MatchDimension.LOCATION, location)
            .build();
    }

    @Test
    @DisplayName("The workflow declaring more matching dimensions wins")
    void mostSpecificWins() {
        workflow("GENERAL", true, MatchConstraints.none());
        workflow("WATER", false, classification("leak"));
        Workflow waterNorth = workflow("WATER-NORTH", false, MatchConstraints.builder()
            .accept(MatchDimension.CLASSIFICATION, "leak")
            .accept(MatchDimension.LOCATION, "north")
            .build());

        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", "north"))).contains(waterNorth);
        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", "south")))
            .map(Workflow::code).contains("WATER");
    }

    @Test
    @DisplayName("When nothing fits, the record type's default is used")
    void fallsBackToDefault() {
        Workflow general = workflow("GENERAL", true, classification("noise"));
        workflow("WATER", false, classification("leak"));

        assertThat(matcher.match(RecordType.INCIDENT, criteria("pothole", null)).isEmpty()).isTrue();
        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("pothole", null))).contains(general);
    }

    @Test
    @DisplayName("A tie is broken by the default workflow when it is in the top tier")
    void tieBrokenByDefault() {
        Workflow first = workflow("A", true, classification("leak"));
        workflow("B", false, classification("leak"));

        assertThat(matcher.match(RecordType.INCIDENT, criteria("leak", null)).matches()).hasSize(2);
        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", null))).contains(first);
    }

    @Test
    @DisplayName("A tie without the default leaves the choice to the caller")
    void tieWithoutDefault() {
        workflow("A", false, classification("leak"));
        workflow("C", false, classification("leak", "flood"));

        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", null))).isEmpty();
    }

    @Test
    @DisplayName("Inactive and soft-deleted workflows are never selected")
    void onlySelectable() {
        Workflow deleted = workflow("DELETED", false, classification("leak"));
        fixture.definitions.softDelete(deleted.id(), ADMIN);
        fixture.definitions.createWorkflow(new WorkflowDraft(
            "INACTIVE", "Inactive", null, RecordType.INCIDENT, false, false, classification("leak"), null), ADMIN);

        assertThat(matcher.match(RecordType.INCIDENT, criteria("leak", null)).isEmpty()).isTrue();
        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", null))).isEmpty();
    }

    @Test
    @DisplayName("Workflows of other record types are ignored")
    void recordTypeScoped() {
        fixture.definitions.createWorkflow(
            WorkflowDraft.of("REQ", "Requests", RecordType.REQUEST).withConstraints(classification("leak")).asDefault(),
            ADMIN);

        assertThat(matcher.resolve(RecordType.INCIDENT, criteria("leak", null))).isEmpty();
    }
}
