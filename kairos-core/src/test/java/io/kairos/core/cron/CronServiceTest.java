package io.kairos.core.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronServiceTest {
    private static final long T0 = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAddedJobsAndReloadThem() throws Exception {
        FileCronStore store = new FileCronStore(tempDir.resolve("cron/jobs.json"));
        CronService service = new CronService(store, new MutableClock(T0), TaskExecutor.noop());

        CronJob job = service.add("report", CronSchedule.every(60_000), CronPayload.agentTurn("send report"), false);

        assertThat(job.id()).hasSize(8);
        assertThat(job.enabled()).isTrue();
        assertThat(job.state().nextRunAtMs()).isEqualTo(T0 + 60_000);
        assertThat(Files.exists(store.path())).isTrue();

        CronService reloaded = new CronService(store, new MutableClock(T0), TaskExecutor.noop());
        assertThat(reloaded.load()).isEqualTo(1);
        assertThat(reloaded.job(job.id())).contains(job);
    }

    @Test
    void listShouldBeSortedIdempotentAndHideDisabledJobs() {
        CronService service = new CronService(new InMemoryCronStore(), new MutableClock(T0), TaskExecutor.noop());
        CronJob late = service.add("late", CronSchedule.every(30_000), null, false);
        CronJob early = service.add("early", CronSchedule.every(1_000), null, false);
        CronJob off = service.add("off", CronSchedule.every(5_000), null, false);
        service.enable(off.id(), false);

        List<CronJob> first = service.list(false);
        List<CronJob> second = service.list(false);

        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(CronJob::id).containsExactly(early.id(), late.id());
        assertThat(service.list(true)).extracting(CronJob::id).containsExactly(early.id(), late.id(), off.id());
    }

    @Test
    void shouldGenerateUniqueIds() {
        CronService service = new CronService(new InMemoryCronStore(), new MutableClock(T0), TaskExecutor.noop());
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 1_000; i++) {
            ids.add(service.add("job-" + i, CronSchedule.every(1_000), null, false).id());
        }

        assertThat(ids).hasSize(1_000);
        assertThat(service.status().jobCount()).isEqualTo(1_000);
    }

    @Test
    void addShouldRejectBlankName() {
        CronService service = new CronService(new InMemoryCronStore(), new MutableClock(T0), TaskExecutor.noop());

        assertThatThrownBy(() -> service.add(" ", CronSchedule.every(1_000), null, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.list(true)).isEmpty();
    }

    @Test
    void enableAndDisableShouldToggleNextRun() {
        MutableClock clock = new MutableClock(T0);
        CronService service = new CronService(new InMemoryCronStore(), clock, TaskExecutor.noop());
        CronJob job = service.add("tick", CronSchedule.every(10_000), null, false);

        CronJob disabled = service.enable(job.id(), false).orElseThrow();
        assertThat(disabled.enabled()).isFalse();
        assertThat(disabled.state().nextRunAtMs()).isNull();

        clock.advance(3_000);
        CronJob enabled = service.enable(job.id(), true).orElseThrow();
        assertThat(enabled.enabled()).isTrue();
        assertThat(enabled.state().nextRunAtMs()).isEqualTo(T0 + 13_000);
        assertThat(enabled.updatedAtMs()).isEqualTo(T0 + 3_000);

        assertThat(service.enable("missing", true)).isEmpty();
        assertThat(service.remove("missing")).isFalse();
        assertThat(service.remove(job.id())).isTrue();
        assertThat(service.list(true)).isEmpty();
    }

    @Test
    void oneShotShouldBeDeletedAfterRunWhenRequested() {
        MutableClock clock = new MutableClock(T0);
        AtomicInteger calls = new AtomicInteger();
        CronService service = new CronService(new InMemoryCronStore(), clock, executorCounting(calls));
        CronJob job = service.add("once", CronSchedule.at(T0 + 1_000), CronPayload.agentTurn("hi"), true);

        clock.advance(1_000);
        assertThat(service.run(job.id(), false)).isTrue();

        assertThat(calls).hasValue(1);
        assertThat(service.job(job.id())).isEmpty();
    }

    @Test
    void oneShotShouldBeDisabledAfterRunWhenKept() {
        MutableClock clock = new MutableClock(T0);
        CronService service = new CronService(new InMemoryCronStore(), clock, TaskExecutor.noop());
        CronJob job = service.add("once", CronSchedule.at(T0 + 1_000), null, false);

        clock.advance(1_000);
        service.run(job.id(), false);

        CronJob after = service.job(job.id()).orElseThrow();
        assertThat(after.enabled()).isFalse();
        assertThat(after.state().nextRunAtMs()).isNull();
        assertThat(after.state().lastStatus()).isEqualTo(JobStatus.OK);
        assertThat(after.state().lastRunAtMs()).isEqualTo(T0 + 1_000);
    }

    @Test
    void recurringJobShouldRescheduleFromTimeAfterExecution() {
        MutableClock clock = new MutableClock(T0);
        TaskExecutor slow = job -> {
            clock.advance(5_000);
            return CompletableFuture.completedFuture(null);
        };
        CronService service = new CronService(new InMemoryCronStore(), clock, slow);
        CronJob job = service.add("slow", CronSchedule.every(1_000), null, false);

        clock.advance(1_000);
        service.run(job.id(), false);

        CronJobState state = service.job(job.id()).orElseThrow().state();
        assertThat(state.lastRunAtMs()).isEqualTo(T0 + 1_000);
        assertThat(state.nextRunAtMs()).isEqualTo(T0 + 7_000);
        assertThat(state.lastStatus()).isEqualTo(JobStatus.OK);
    }

    @Test
    void runShouldRespectDisabledFlagUnlessForced() {
        AtomicInteger calls = new AtomicInteger();
        CronService service = new CronService(new InMemoryCronStore(), new MutableClock(T0), executorCounting(calls));
        CronJob job = service.add("manual", CronSchedule.every(60_000), null, false);
        service.enable(job.id(), false);

        assertThat(service.run(job.id(), false)).isFalse();
        assertThat(service.run("missing", true)).isFalse();
        assertThat(service.run(job.id(), true)).isTrue();

        assertThat(calls).hasValue(1);
        CronJob after = service.job(job.id()).orElseThrow();
        assertThat(after.enabled()).isFalse();
        assertThat(after.state().nextRunAtMs()).isNull();
    }

    @Test
    void executorFailureShouldBeRecordedAsError() {
        CronMetrics metrics = new CronMetrics();
        TaskExecutor failing = job -> CompletableFuture.failedFuture(new IllegalStateException("boom"));
        CronService service = new CronService(
            new InMemoryCronStore(),
            new MutableClock(T0),
            failing,
            CronSettings.defaults(),
            metrics
        );
        CronJob job = service.add("fragile", CronSchedule.every(1_000), null, false);

        service.run(job.id(), false);

        CronJob after = service.job(job.id()).orElseThrow();
        assertThat(after.enabled()).isTrue();
        assertThat(after.state().lastStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(after.state().lastError()).isEqualTo("boom");
        assertThat(after.state().nextRunAtMs()).isEqualTo(T0 + 1_000);
        assertThat(metrics.failed()).isEqualTo(1);

        service.setExecutor(TaskExecutor.noop());
        service.run(job.id(), false);
        CronJobState recovered = service.job(job.id()).orElseThrow().state();
        assertThat(recovered.lastStatus()).isEqualTo(JobStatus.OK);
        assertThat(recovered.lastError()).isNull();
    }

    @Test
    void malformedStoreShouldYieldEmptyRegistry() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, """
            {
              "version": 1,
              "jobs": [
                {"id": "aaaa1111", "name": "a", "enabled": true, "schedule": {"kind": "every", "everyMs": 1000}},
                {"id": "bbbb2222", "name": "b", "enabled": true, "schedule": {"kind": "every", "everyMs": 2000}},
                {"id": "cccc3333", "name": "broken", "enabled": true},
                {"id": "dddd4444", "name": "d", "enabled": true, "schedule": {"kind": "at", "atMs": 5}}
              ]
            }
            """);
        CronMetrics metrics = new CronMetrics();
        CronService service = new CronService(
            new FileCronStore(path),
            new MutableClock(T0),
            TaskExecutor.noop(),
            CronSettings.defaults(),
            metrics
        );

        assertThat(service.load()).isZero();
        assertThat(service.list(true)).isEmpty();
        assertThat(metrics.storeLoadFailures()).isEqualTo(1);

        try (service) {
            service.start();
            assertThat(service.status().jobCount()).isZero();
            assertThat(service.status().nextWakeAtMs()).isNull();
        }
        assertThat(metrics.storeLoadFailures()).isEqualTo(2);
    }

    @Test
    void saveFailureShouldNotSurfaceToCallers() {
        CronMetrics metrics = new CronMetrics();
        CronStore broken = new CronStore() {
            @Override
            public CronStoreDocument load() {
                return CronStoreDocument.empty();
            }

            @Override
            public void save(CronStoreDocument document) throws IOException {
                throw new IOException("disk full");
            }
        };
        CronService service = new CronService(
            broken,
            new MutableClock(T0),
            TaskExecutor.noop(),
            CronSettings.defaults(),
            metrics
        );

        CronJob job = service.add("kept", CronSchedule.every(1_000), null, false);

        assertThat(service.job(job.id())).isPresent();
        assertThat(metrics.storeSaveFailures()).isEqualTo(1);
    }

    @Test
    void removalDuringExecutionShouldNotResurrectJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TaskExecutor blocking = TaskExecutor.blocking(job -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        InMemoryCronStore store = new InMemoryCronStore();
        CronService service = new CronService(store, new MutableClock(T0), blocking);
        CronJob job = service.add("inflight", CronSchedule.every(1_000), null, false);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> run = pool.submit(() -> service.run(job.id(), false));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(service.remove(job.id())).isTrue();
            release.countDown();

            assertThat(run.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(service.job(job.id())).isEmpty();
        assertThat(store.document().jobs()).isEmpty();
    }

    @Test
    void startShouldRescheduleEnabledJobsAndRejectSecondStart() {
        InMemoryCronStore store = new InMemoryCronStore();
        MutableClock clock = new MutableClock(T0);
        CronService writer = new CronService(store, clock, TaskExecutor.noop());
        CronJob job = writer.add("stale", CronSchedule.every(60_000), null, false);

        clock.advance(3_600_000);
        try (CronService service = new CronService(store, clock, TaskExecutor.noop())) {
            service.start();

            assertThat(service.isRunning()).isTrue();
            assertThat(service.job(job.id()).orElseThrow().state().nextRunAtMs())
                .isEqualTo(T0 + 3_600_000 + 60_000);
            assertThat(service.status().nextWakeAtMs()).isEqualTo(T0 + 3_660_000);
            assertThatThrownBy(service::start).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(service::load).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void loopShouldExecuteDueJobsRepeatedly() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CronSettings settings = new CronSettings(Duration.ofSeconds(60), Duration.ofSeconds(2));
        FileCronStore store = new FileCronStore(tempDir.resolve("loop/jobs.json"));
        CronService service = new CronService(
            store,
            Clock.systemUTC(),
            executorCounting(calls),
            settings,
            CronEventListener.NOOP
        );

        CronJob job;
        try {
            service.start();
            job = service.add("fast", CronSchedule.every(100), null, false);
            Thread.sleep(350);
            assertThat(service.status().jobCount()).isEqualTo(1);
        } finally {
            service.close();
        }

        assertThat(service.isRunning()).isFalse();
        assertThat(calls.get()).isGreaterThanOrEqualTo(2);
        CronJob after = service.job(job.id()).orElseThrow();
        assertThat(after.state().lastStatus()).isEqualTo(JobStatus.OK);
        assertThat(after.state().lastRunAtMs()).isNotNull();
        assertThat(store.load().jobs()).extracting(CronJob::id).containsExactly(job.id());
    }

    @Test
    void loopShouldRetireOneShotsAndKeepSchedulingFailingJobs() throws Exception {
        CronMetrics metrics = new CronMetrics();
        TaskExecutor executor = job -> "flaky".equals(job.name())
            ? CompletableFuture.failedFuture(new IllegalStateException("downstream unavailable"))
            : CompletableFuture.completedFuture(null);
        CronService service = new CronService(
            new InMemoryCronStore(),
            Clock.systemUTC(),
            executor,
            new CronSettings(Duration.ofSeconds(60), Duration.ofSeconds(2)),
            metrics
        );

        try (service) {
            service.start();
            CronJob once = service.add("once", CronSchedule.at(System.currentTimeMillis() + 50), null, true);
            CronJob flaky = service.add("flaky", CronSchedule.every(100), null, false);
            Thread.sleep(350);

            assertThat(service.job(once.id())).isEmpty();
            assertThat(service.list(true)).extracting(CronJob::id).containsExactly(flaky.id());
            CronJobState failed = service.job(flaky.id()).orElseThrow().state();
            assertThat(failed.lastStatus()).isEqualTo(JobStatus.ERROR);
            assertThat(failed.lastError()).isEqualTo("downstream unavailable");
            assertThat(failed.nextRunAtMs()).isNotNull();
            assertThat(metrics.failed()).isGreaterThanOrEqualTo(2);
            assertThat(metrics.succeeded()).isEqualTo(1);

            long firstSeen = failed.lastRunAtMs();
            CronJob later = awaitJob(service, flaky.id(), job -> job.state().lastRunAtMs() > firstSeen);
            assertThat(later.state().lastStatus()).isEqualTo(JobStatus.ERROR);
            assertThat(later.enabled()).isTrue();
            assertThat(service.isRunning()).isTrue();
        }
    }

    private static CronJob awaitJob(CronService service, String id, Predicate<CronJob> condition)
        throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            Optional<CronJob> job = service.job(id);
            if (job.isPresent() && condition.test(job.get())) {
                return job.get();
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job " + id + " did not reach the expected state");
    }

    private static TaskExecutor executorCounting(AtomicInteger calls) {
        return job -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        };
    }

    private static final class InMemoryCronStore implements CronStore {
        private volatile CronStoreDocument document = CronStoreDocument.empty();

        @Override
        public CronStoreDocument load() {
            return document;
        }

        @Override
        public void save(CronStoreDocument value) {
            this.document = value;
        }

        CronStoreDocument document() {
            return document;
        }
    }
}
