package io.pulse4j.internal;

import io.pulse4j.core.GenerationResult;
import io.pulse4j.core.ScheduledJob;
import io.pulse4j.exception.StoreException;
import io.pulse4j.spi.JobStore;
import io.pulse4j.store.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class ScheduleReconcilerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:05:00Z"));
    private InMemoryJobStore store;
    private ManualTimers timers;
    private CallGuard guard;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(clock);
        timers = new ManualTimers();
        guard = new CallGuard("test-call", 4);
    }

    @AfterEach
    void tearDown() {
        guard.close();
        timers.shutdownNow();
    }

    @Test
    void armedSetShouldConvergeToActiveJobs() {
        TimerArmer armer = newArmer(store);
        ScheduleReconciler reconciler = new ScheduleReconciler(store, armer, new Slf4jActivityMonitor());

        store.saveScheduledJob(job("a"));
        store.saveScheduledJob(job("b"));
        store.saveScheduledJob(job("c").toBuilder().active(false).build());

        ScheduleReconciler.Result first = reconciler.reconcile();
        assertTrue(first.fetched());
        assertEquals(2, first.armed());
        assertEquals(Set.of("a", "b"), armer.armedJobIds());

        store.setActive("a", false);
        store.setActive("c", true);
        store.deleteScheduledJob("b");
        store.saveScheduledJob(job("d"));

        ScheduleReconciler.Result second = reconciler.reconcile();
        assertEquals(2, second.armed());
        assertEquals(2, second.disarmed());
        assertEquals(Set.of("c", "d"), armer.armedJobIds());
        assertEquals(2, timers.pending().size());
    }

    @Test
    void unchangedStoreShouldLeaveTimersAlone() {
        TimerArmer armer = newArmer(store);
        ScheduleReconciler reconciler = new ScheduleReconciler(store, armer, new Slf4jActivityMonitor());
        store.saveScheduledJob(job("a"));

        reconciler.reconcile();
        ScheduleReconciler.Result again = reconciler.reconcile();

        assertEquals(0, again.armed());
        assertEquals(0, again.disarmed());
        assertEquals(1, timers.pending().size());
    }

    @Test
    void unschedulableJobShouldBeCountedAndRetriedNextPass() {
        TimerArmer armer = newArmer(store);
        ScheduleReconciler reconciler = new ScheduleReconciler(store, armer, new Slf4jActivityMonitor());
        store.saveScheduledJob(job("bad").toBuilder().timezone("Mars/Olympus").build());

        assertEquals(1, reconciler.reconcile().unschedulable());
        assertEquals(1, reconciler.reconcile().unschedulable());

        store.saveScheduledJob(store.findScheduledJob("bad").orElseThrow().toBuilder().timezone("UTC").build());
        ScheduleReconciler.Result fixed = reconciler.reconcile();

        assertEquals(1, fixed.armed());
        assertTrue(armer.isArmed("bad"));
    }

    @Test
    void fetchFailureShouldKeepExistingTimers() {
        JobStore flaky = spy(store);
        TimerArmer armer = newArmer(flaky);
        ScheduleReconciler reconciler = new ScheduleReconciler(flaky, armer, new Slf4jActivityMonitor());
        store.saveScheduledJob(job("a"));
        reconciler.reconcile();

        when(flaky.getActiveScheduledJobs()).thenThrow(new StoreException("connection reset"));
        ScheduleReconciler.Result result = reconciler.reconcile();

        assertFalse(result.fetched());
        assertTrue(armer.isArmed("a"));
        assertEquals(1, timers.pending().size());
    }

    @Test
    void storeRecoveryShouldResumeConvergence() {
        JobStore flaky = spy(store);
        TimerArmer armer = newArmer(flaky);
        ScheduleReconciler reconciler = new ScheduleReconciler(flaky, armer, new Slf4jActivityMonitor());

        when(flaky.getActiveScheduledJobs())
                .thenThrow(new StoreException("connection reset"))
                .thenReturn(List.of(job("a")));

        assertFalse(reconciler.reconcile().fetched());
        assertTrue(reconciler.reconcile().fetched());
        assertEquals(Set.of("a"), armer.armedJobIds());
    }

    private TimerArmer newArmer(JobStore jobStore) {
        Slf4jActivityMonitor monitor = new Slf4jActivityMonitor();
        JobExecutor executor = new JobExecutor(jobStore,
                (t, u, v) -> new GenerationResult("ok", Map.of()),
                (content, contentId, userContext, templateRef) -> { },
                monitor, guard, Duration.ofSeconds(5), clock);
        return new TimerArmer(jobStore, executor, timers, monitor, clock);
    }

    private static ScheduledJob job(String id) {
        return ScheduledJob.builder(id)
                .cronExpression("*/10 * * * *")
                .timezone("UTC")
                .templateRef("tpl")
                .build();
    }
}
