package com.casework.engine.transition;

import com.casework.core.exception.StaleVersionException;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.TransitionHistoryEntry;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.engine.test.CaseworkFixture;
import com.casework.engine.test.CaseworkFixture.IncidentWorkflow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.casework.engine.test.CaseworkFixture.ADMIN;
import static com.casework.engine.test.CaseworkFixture.AGENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Two writers racing on the same record version: exactly one wins.
 */
class ConcurrentTransitionTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    private CaseworkFixture fixture;
    private IncidentWorkflow wf;

    @BeforeEach
    void setUp() {
        fixture = new CaseworkFixture();
        wf = fixture.incidentWorkflow();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @RepeatedTest(20)
    @DisplayName("Concurrent transitions from the same version: one commits, the other gets StaleVersion")
    void exactlyOneWins() throws Exception {
        CaseRecord record = fixture.newIncident("Race");
        CountDownLatch go = new CountDownLatch(1);

        Callable<TransitionOutcome> viaStart = () -> {
            go.await();
            return fixture.move(record, wf.start(), AGENT);
        };
        Callable<TransitionOutcome> viaReject = () -> {
            go.await();
            return fixture.move(record, wf.reject(), ADMIN);
        };

        List<Future<TransitionOutcome>> futures = new ArrayList<>();
        futures.add(executor.submit(viaStart));
        futures.add(executor.submit(viaReject));
        go.countDown();

        int succeeded = 0;
        int stale = 0;
        for (Future<TransitionOutcome> future : futures) {
            try {
                future.get(5, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(StaleVersionException.class);
                stale++;
            }
        }

        assertThat(succeeded).isEqualTo(1);
        assertThat(stale).isEqualTo(1);
        assertThat(fixture.reload(record.id()).version()).isEqualTo(2);
        assertThat(fixture.transitions.historyOf(record.id()))
            .singleElement()
            .extracting(TransitionHistoryEntry::fromStateId)
            .isEqualTo(wf.newState().id());
    }

    @Test
    @DisplayName("A caller holding an outdated version is rejected after another writer commits")
    void sequentialStaleWriter() {
        CaseRecord record = fixture.newIncident("Late");
        fixture.records.updateFields(record.id(), record.version(), Map.of("priority", "P1"), ADMIN);

        assertThatThrownBy(() -> fixture.move(record, wf.start(), AGENT, TransitionPayload.empty()))
            .isInstanceOf(StaleVersionException.class);
    }
}
