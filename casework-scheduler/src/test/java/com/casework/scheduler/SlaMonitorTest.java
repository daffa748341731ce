package com.casework.scheduler;

import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Notification;
import com.casework.core.model.NotificationKind;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.persistence.InMemoryCaseRecordRepository;
import com.casework.engine.test.CaseworkFixture;
import com.casework.engine.test.CaseworkFixture.IncidentWorkflow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.casework.engine.test.CaseworkFixture.ADMIN;
import static com.casework.engine.test.CaseworkFixture.AGENT;
import static com.casework.engine.test.CaseworkFixture.REPORTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class SlaMonitorTest {

    private CaseworkFixture fixture;
    private IncidentWorkflow wf;
    private SlaMonitor monitor;

    @BeforeEach
    void setUp() {
        fixture = new CaseworkFixture();
        wf = fixture.incidentWorkflow();
        monitor = monitor(fixture.recordRepository);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private SlaMonitor monitor(CaseRecordRepository repository) {
        return new SlaMonitor(repository, fixture.revisions, fixture.dispatcher, fixture.unitOfWork,
            fixture.metrics, fixture.clock, Duration.ofMinutes(5), 200);
    }

    private List<Revision> breachRevisions(CaseRecord record) {
        return fixture.revisions.revisionsOf(record.id()).stream()
            .filter(r -> r.actionType() == RevisionActionType.SLA_BREACHED)
            .toList();
    }

    @Test
    @DisplayName("Overdue records are flagged once, with a revision and a notification")
    void flagsOverdueRecordOnce() {
        CaseRecord record = fixture.newIncident("Slow");
        fixture.clock.advanceHours(3);
        assertThat(monitor.runOnce()).isZero();

        fixture.clock.advanceHours(2);
        assertThat(monitor.runOnce()).isEqualTo(1);
        assertThat(monitor.runOnce()).isZero();

        CaseRecord flagged = fixture.reload(record.id());
        assertThat(flagged.slaBreached()).isTrue();
        assertThat(flagged.version()).isEqualTo(record.version() + 1);
        assertThat(breachRevisions(record)).singleElement()
            .satisfies(r -> assertThat(r.performedBy()).isEqualTo(Actor.SYSTEM_ID));

        List<Notification> sent = fixture.recordingNotifier().sent(NotificationKind.SLA_BREACHED);
        assertThat(sent).singleElement().satisfies(n -> {
            assertThat(n.recipients()).containsExactly(REPORTER.id());
            assertThat(n.subject()).contains(record.recordNumber());
        });
    }

    @Test
    @DisplayName("Closed records are never flagged")
    void skipsClosedRecords() {
        CaseRecord record = fixture.newIncident("Rejected");
        fixture.move(record, wf.reject(), ADMIN);
        fixture.clock.advanceHours(10);

        assertThat(monitor.runOnce()).isZero();
        assertThat(fixture.reload(record.id()).slaBreached()).isFalse();
    }

    @Test
    @DisplayName("Entering a state with an SLA re-arms the monitor")
    void reflagsAfterReset() {
        CaseRecord record = fixture.newIncident("Slow");
        fixture.clock.advanceHours(5);
        monitor.runOnce();

        fixture.move(fixture.reload(record.id()), wf.start(), AGENT);
        fixture.clock.advanceHours(7);
        assertThat(monitor.runOnce()).isZero();
        fixture.clock.advanceHours(2);
        assertThat(monitor.runOnce()).isEqualTo(1);

        assertThat(breachRevisions(record)).hasSize(2);
    }

    @Test
    @DisplayName("A deadline reset between scan and flip leaves the record unflagged")
    void skipsRecordRearmedAfterScan() {
        CaseRecord record = fixture.newIncident("Picked up late");
        InMemoryCaseRecordRepository racing = spy(fixture.recordRepository);
        doAnswer(invocation -> {
            Object candidates = invocation.callRealMethod();
            fixture.move(fixture.reload(record.id()), wf.start(), AGENT);
            return candidates;
        }).when(racing).findSlaBreachCandidates(any(Instant.class), anyInt());
        SlaMonitor raced = monitor(racing);
        fixture.clock.advanceHours(5);

        try {
            assertThat(raced.runOnce()).isZero();
        } finally {
            raced.stop();
        }

        CaseRecord current = fixture.reload(record.id());
        assertThat(current.slaBreached()).isFalse();
        assertThat(current.slaDueAt()).isAfter(fixture.clock.instant());
        assertThat(breachRevisions(record)).isEmpty();
        assertThat(fixture.recordingNotifier().sent(NotificationKind.SLA_BREACHED)).isEmpty();

        fixture.clock.advanceHours(9);
        assertThat(monitor.runOnce()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing record does not stop the scan")
    void isolatesFailures() {
        CaseRecord broken = fixture.newIncident("Broken");
        CaseRecord healthy = fixture.newIncident("Healthy");
        InMemoryCaseRecordRepository failing = spy(fixture.recordRepository);
        doThrow(new IllegalStateException("disk full"))
            .when(failing).markSlaBreached(eq(broken.id()), any(Instant.class));
        SlaMonitor flaky = monitor(failing);
        fixture.clock.advanceHours(5);

        try {
            assertThat(flaky.runOnce()).isEqualTo(1);
        } finally {
            flaky.stop();
        }

        assertThat(fixture.reload(healthy.id()).slaBreached()).isTrue();
        assertThat(fixture.reload(broken.id()).slaBreached()).isFalse();
        assertThat(breachRevisions(broken)).isEmpty();
    }

    @Test
    @DisplayName("Scans report flagged and open breached counts")
    void reportsMetrics() {
        fixture.newIncident("One");
        fixture.newIncident("Two");
        fixture.clock.advanceHours(5);

        monitor.runOnce();

        assertThat(fixture.metrics.registry().get(CaseMetrics.SLA_BREACHES).counter().count()).isEqualTo(2.0);
        assertThat(fixture.metrics.registry().get(CaseMetrics.SLA_BREACHED_OPEN).gauge().value()).isEqualTo(2.0);
        assertThat(fixture.metrics.registry().get(CaseMetrics.SLA_SCAN_DURATION).timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Start is idempotent and stop ends the schedule")
    void lifecycle() {
        monitor.start();
        monitor.start();
        assertThat(monitor.isRunning()).isTrue();

        monitor.stop();
        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Rejects a non-positive scan interval")
    void validatesInterval() {
        assertThatThrownBy(() -> new SlaMonitor(fixture.recordRepository, fixture.revisions, fixture.dispatcher,
            fixture.unitOfWork, fixture.metrics, fixture.clock, Duration.ZERO, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
