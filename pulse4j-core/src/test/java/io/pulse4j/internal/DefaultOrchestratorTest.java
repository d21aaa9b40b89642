package io.pulse4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.GenerationResult;
import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.OrchestratorStatus;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobHandlerRegistry;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.core.RunStatus;
import io.pulse4j.core.ScheduledJob;
import io.pulse4j.internal.handlers.CampaignJobHandler;
import io.pulse4j.internal.handlers.EmailJobHandler;
import io.pulse4j.spi.CampaignSource;
import io.pulse4j.spi.CampaignSource.Campaign;
import io.pulse4j.spi.EmailSender;
import io.pulse4j.spi.EmailSender.EmailResult;
import io.pulse4j.store.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultOrchestratorTest {

    private InMemoryJobStore store;
    private AtomicInteger sent;
    private DefaultOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        sent = new AtomicInteger();
        EmailSender sender = message -> {
            sent.incrementAndGet();
            return EmailResult.sent("m-" + sent.get());
        };
        CampaignSource campaigns = (campaignId, userId) -> Optional.of(
                new Campaign(campaignId, "News", "text", null, List.of("a@x.io", "b@x.io", "c@x.io")));

        orchestrator = new DefaultOrchestrator(
                defaultProps(),
                store,
                (templateRef, userContext, variables) -> new GenerationResult("generated " + templateRef, Map.of()),
                (content, contentId, userContext, templateRef) -> { },
                new Slf4jActivityMonitor(),
                new QueueJobHandlerRegistry(List.of(
                        new EmailJobHandler(sender),
                        new CampaignJobHandler(campaigns, store))),
                new ObjectMapper(),
                Clock.systemUTC()
        );
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    @Test
    void startShouldArmActiveJobsAndTriggerShouldRunThem() throws Exception {
        store.saveScheduledJob(ScheduledJob.builder("digest")
                .cronExpression("0 0 1 1 *")
                .templateRef("tpl-digest")
                .build());
        store.saveScheduledJob(ScheduledJob.builder("dormant")
                .cronExpression("0 0 1 1 *")
                .active(false)
                .build());

        assertFalse(orchestrator.triggerNow("digest"));
        orchestrator.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().activeJobs() == 1));
        OrchestratorStatus status = orchestrator.status();
        assertTrue(status.running());
        assertEquals("digest", status.upcoming().get(0).jobId());

        assertTrue(orchestrator.triggerNow("digest"));
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> stored("digest").lastStatus() == RunStatus.SUCCESS && stored("digest").nextRun() != null));
        assertEquals(1, stored("digest").totalRuns());
        assertEquals("generated tpl-digest", store.getGeneratedContent("digest").get(0).content());
    }

    @Test
    void deactivatedJobShouldBeDisarmedOnNextPoll() throws Exception {
        store.saveScheduledJob(ScheduledJob.builder("digest").cronExpression("0 0 1 1 *").build());
        orchestrator.start();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().activeJobs() == 1));

        store.setActive("digest", false);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().activeJobs() == 0));
    }

    @Test
    void campaignShouldFanOutAndDeliverEveryEmail() throws Exception {
        orchestrator.start();

        QueueJob campaign = orchestrator.enqueueCampaign("c-1", "u-1", 5);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> sent.get() == 3));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().queue().completed() == 4));
        assertEquals(QueueJobStatus.COMPLETED, store.findQueueJob(campaign.id()).orElseThrow().status());
        assertEquals(3, store.getQueueJobs(QueueJobStatus.COMPLETED, 10).stream()
                .filter(j -> "email".equals(j.type()))
                .filter(j -> j.priority() == 5)
                .count());
    }

    @Test
    void pausedOrchestratorShouldHoldQueueUntilResumed() throws Exception {
        orchestrator.start();
        orchestrator.pause();

        QueueJob job = orchestrator.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).put("recipient", "a@x.io").build());
        Thread.sleep(200);

        assertTrue(orchestrator.status().paused());
        assertEquals(QueueJobStatus.PENDING, store.findQueueJob(job.id()).orElseThrow().status());

        orchestrator.resume();
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> store.findQueueJob(job.id()).orElseThrow().status() == QueueJobStatus.COMPLETED));
    }

    @Test
    void retryFailedJobsShouldRequeueFailures() throws Exception {
        orchestrator.start();
        QueueJob broken = orchestrator.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).maxAttempts(1).build());
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> store.findQueueJob(broken.id()).orElseThrow().status() == QueueJobStatus.FAILED));

        orchestrator.pause();
        assertEquals(1, orchestrator.retryFailedJobs());
        assertEquals(0, store.findQueueJob(broken.id()).orElseThrow().attempts());
    }

    @Test
    void stopShouldClearArmedTimersAndAllowRestart() throws Exception {
        store.saveScheduledJob(ScheduledJob.builder("digest").cronExpression("0 0 1 1 *").build());
        orchestrator.start();
        orchestrator.start();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().activeJobs() == 1));

        orchestrator.stop();
        OrchestratorStatus stopped = orchestrator.status();
        assertFalse(stopped.running());
        assertEquals(0, stopped.activeJobs());

        orchestrator.start();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> orchestrator.status().activeJobs() == 1));
    }

    @Test
    void stopShouldReleaseQueueCallThreads() throws Exception {
        orchestrator.start();
        QueueJob job = orchestrator.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).put("recipient", "a@x.io").build());
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> store.findQueueJob(job.id()).orElseThrow().status() == QueueJobStatus.COMPLETED));
        assertTrue(liveThreads("pulse.queue-call-") > 0);

        orchestrator.stop();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> liveThreads("pulse.queue-call-") == 0));

        orchestrator.start();
        QueueJob again = orchestrator.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).put("recipient", "b@x.io").build());
        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> store.findQueueJob(again.id()).orElseThrow().status() == QueueJobStatus.COMPLETED));
    }

    @Test
    void reconcileShouldKeepRunningWhileTimerThreadsAreBusy() throws Exception {
        CountDownLatch generating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PulseProperties props = defaultProps();
        props.setTimerThreads(1);
        DefaultOrchestrator busy = new DefaultOrchestrator(props, store,
                (templateRef, userContext, variables) -> {
                    generating.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new GenerationResult("late", Map.of());
                },
                (content, contentId, userContext, templateRef) -> { },
                new Slf4jActivityMonitor(),
                new QueueJobHandlerRegistry(List.of()),
                new ObjectMapper(),
                Clock.systemUTC());
        try {
            store.saveScheduledJob(ScheduledJob.builder("slow").cronExpression("0 0 1 1 *").build());
            busy.start();
            assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> busy.status().activeJobs() == 1));
            assertTrue(busy.triggerNow("slow"));
            assertTrue(generating.await(5, TimeUnit.SECONDS));

            store.saveScheduledJob(ScheduledJob.builder("other").cronExpression("0 0 1 1 *").build());

            assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> busy.status().activeJobs() == 2));
        } finally {
            release.countDown();
            busy.stop();
        }
    }

    @Test
    void enqueueShouldApplyConfiguredMaxAttemptsUnlessSet() {
        PulseProperties props = defaultProps();
        props.setMaxAttempts(5);
        DefaultOrchestrator configured = new DefaultOrchestrator(props, store,
                (t, u, v) -> new GenerationResult("x", Map.of()),
                (content, contentId, userContext, templateRef) -> { },
                new Slf4jActivityMonitor(),
                new QueueJobHandlerRegistry(List.of()),
                new ObjectMapper(),
                Clock.systemUTC());

        QueueJob defaulted = configured.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).build());
        QueueJob explicit = configured.enqueue(NewQueueJob.builder(QueueJobType.EMAIL).maxAttempts(2).build());
        QueueJob campaign = configured.enqueueCampaign("c-1", "u-1", 0);

        assertEquals(5, store.findQueueJob(defaulted.id()).orElseThrow().maxAttempts());
        assertEquals(2, store.findQueueJob(explicit.id()).orElseThrow().maxAttempts());
        assertEquals(5, store.findQueueJob(campaign.id()).orElseThrow().maxAttempts());
    }

    @Test
    void invalidPropertiesShouldFailStart() {
        PulseProperties props = defaultProps();
        props.setWorkers(0);
        DefaultOrchestrator bad = new DefaultOrchestrator(props, store,
                (t, u, v) -> new GenerationResult("x", Map.of()),
                (content, contentId, userContext, templateRef) -> { },
                new Slf4jActivityMonitor(),
                new QueueJobHandlerRegistry(List.of()),
                new ObjectMapper(),
                Clock.systemUTC());

        assertThrows(IllegalArgumentException.class, bad::start);
        assertFalse(bad.status().running());
    }

    private ScheduledJob stored(String id) {
        return store.findScheduledJob(id).orElseThrow();
    }

    private static long liveThreads(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(t -> t.getName().startsWith(prefix))
                .count();
    }

    private static PulseProperties defaultProps() {
        PulseProperties props = new PulseProperties();
        props.setPollInterval(Duration.ofMillis(100));
        props.setProcessEvery(Duration.ofMillis(20));
        props.setWorkers(2);
        props.setTimerThreads(2);
        props.setMaxAttempts(3);
        props.setCallTimeout(Duration.ofSeconds(5));
        props.setQueueJobTimeout(Duration.ofSeconds(5));
        props.setShutdownTimeout(Duration.ofSeconds(2));
        return props;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
