package com.casework.scheduler;

import com.casework.core.model.CaseRecord;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.test.CaseworkFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.casework.engine.test.CaseworkFixture.AGENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevisionRetentionJobTest {

    private CaseworkFixture fixture;
    private RevisionRetentionJob job;

    @BeforeEach
    void setUp() {
        fixture = new CaseworkFixture();
        fixture.incidentWorkflow();
        job = new RevisionRetentionJob(fixture.revisions, fixture.metrics, fixture.clock,
            Duration.ofDays(30), Duration.ofHours(1));
    }

    @Test
    @DisplayName("Purges revisions past the retention period under the retention identity")
    void purgesOldRevisions() {
        CaseRecord record = fixture.newIncident("Old news");
        fixture.clock.advance(Duration.ofDays(31));
        fixture.records.addComment(record.id(), "follow-up", false, AGENT);

        assertThat(job.runOnce()).isEqualTo(1);
        assertThat(job.runOnce()).isZero();

        assertThat(fixture.revisions.revisionsOf(record.id()))
            .extracting(Revision::actionType)
            .containsExactly(RevisionActionType.COMMENT_ADDED);
        assertThat(fixture.metrics.registry().get(CaseMetrics.REVISIONS_PURGED).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Keeps everything inside the retention period")
    void keepsRecentRevisions() {
        CaseRecord record = fixture.newIncident("Fresh");
        fixture.clock.advance(Duration.ofDays(29));

        assertThat(job.runOnce()).isZero();
        assertThat(fixture.revisions.revisionsOf(record.id())).hasSize(1);
    }

    @Test
    @DisplayName("Rejects a non-positive retention period")
    void validatesRetention() {
        assertThatThrownBy(() -> new RevisionRetentionJob(fixture.revisions, fixture.metrics, fixture.clock,
            Duration.ZERO, Duration.ofHours(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
