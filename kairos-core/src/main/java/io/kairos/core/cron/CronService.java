package io.kairos.core.cron;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable recurring job scheduler.
 *
 * <p>One registry guarded by a single lock is shared by the scheduler loop and the mutation API. The loop sleeps on a
 * condition of that lock until the earliest next run (or the idle interval), dispatches due jobs one at a time with the
 * lock released around the executor call, and persists once per batch. Every mutation persists before returning.
 *
 * <p>Store and executor failures are logged and reported to the {@link CronEventListener}; they never stop the loop or
 * surface to callers. Unknown ids are reported through the return value.
 */
public final class CronService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronService.class);
    private static final int ID_LENGTH = 8;

    private final CronStore store;
    private final Clock clock;
    private final CronSettings settings;
    private final CronEventListener listener;
    private final NextRunCalculator calculator;
    private final AtomicReference<TaskExecutor> executor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final List<CronJob> jobs = new ArrayList<>();
    private final Object persistMonitor = new Object();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public CronService(CronStore store, Clock clock, TaskExecutor executor) {
        this(store, clock, executor, CronSettings.defaults(), CronEventListener.NOOP);
    }

    public CronService(
        CronStore store,
        Clock clock,
        TaskExecutor executor,
        CronSettings settings,
        CronEventListener listener
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = new AtomicReference<>(Objects.requireNonNull(executor, "executor must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.calculator = new NextRunCalculator();
    }

    /**
     * Replaces the registry with the persisted jobs without starting the loop. A missing or unreadable store yields an
     * empty registry.
     *
     * @return number of jobs loaded
     */
    public int load() {
        if (running.get()) {
            throw new IllegalStateException("cron service is running; registry is already loaded");
        }
        return loadRegistry();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("cron service is already running");
        }
        Thread previous = loopThread;
        if (previous != null && previous.isAlive()) {
            running.set(false);
            throw new IllegalStateException("previous scheduler loop has not finished stopping");
        }

        try {
            int loaded = loadRegistry();
            reconcile();
            persist();

            Thread thread = new Thread(this::runLoop, "kairos-cron");
            thread.setDaemon(true);
            loopThread = thread;
            thread.start();
            LOG.info("Cron service started with {} jobs", loaded);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    /**
     * Requests the loop to stop. Observed at the next wake point; a batch already dispatching is allowed to finish.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        signalChange();
        LOG.info("Cron service stopping");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        Thread thread = loopThread;
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(settings.shutdownTimeout().toMillis());
            if (thread.isAlive()) {
                LOG.warn("Cron loop still busy after {}; leaving in-flight batch to finish", settings.shutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void setExecutor(TaskExecutor replacement) {
        executor.set(Objects.requireNonNull(replacement, "executor must not be null"));
    }

    public List<CronJob> list(boolean includeDisabled) {
        List<CronJob> result;
        lock.lock();
        try {
            result = new ArrayList<>(jobs.size());
            for (CronJob job : jobs) {
                if (includeDisabled || job.enabled()) {
                    result.add(job);
                }
            }
        } finally {
            lock.unlock();
        }
        result.sort(Comparator.comparing(
            (CronJob job) -> job.state().nextRunAtMs(),
            Comparator.nullsLast(Comparator.naturalOrder())
        ));
        return List.copyOf(result);
    }

    public Optional<CronJob> job(String id) {
        lock.lock();
        try {
            int index = indexOf(id);
            return index < 0 ? Optional.empty() : Optional.of(jobs.get(index));
        } finally {
            lock.unlock();
        }
    }

    public CronJob add(String name, CronSchedule schedule, CronPayload payload, boolean deleteAfterRun) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        Objects.requireNonNull(schedule, "schedule must not be null");
        CronPayload effectivePayload = payload == null ? CronPayload.agentTurn("") : payload;

        CronJob job;
        lock.lock();
        try {
            long now = clock.millis();
            job = new CronJob(
                newId(),
                name.trim(),
                true,
                schedule,
                effectivePayload,
                CronJobState.scheduled(calculator.nextRunOrNull(schedule, now)),
                now,
                now,
                deleteAfterRun
            );
            jobs.add(job);
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        persist();
        LOG.info("Added cron job '{}' ({})", job.name(), job.id());
        return job;
    }

    public boolean remove(String id) {
        boolean removed;
        lock.lock();
        try {
            removed = jobs.removeIf(job -> job.id().equals(id));
            if (removed) {
                wakeup.signalAll();
            }
        } finally {
            lock.unlock();
        }

        if (removed) {
            persist();
            LOG.info("Removed cron job {}", id);
        }
        return removed;
    }

    public Optional<CronJob> enable(String id, boolean enabled) {
        CronJob updated;
        lock.lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            long now = clock.millis();
            CronJob current = jobs.get(index);
            Long next = enabled ? calculator.nextRunOrNull(current.schedule(), now) : null;
            updated = current.withEnabled(enabled, next, now);
            jobs.set(index, updated);
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        persist();
        LOG.info("{} cron job '{}' ({})", enabled ? "Enabled" : "Disabled", updated.name(), updated.id());
        return Optional.of(updated);
    }

    /**
     * Dispatches a job immediately, outside the loop.
     *
     * @return {@code false} when the job does not exist, or is disabled and {@code force} is not set
     */
    public boolean run(String id, boolean force) {
        lock.lock();
        try {
            int index = indexOf(id);
            if (index < 0 || !(force || jobs.get(index).enabled())) {
                return false;
            }
        } finally {
            lock.unlock();
        }

        dispatch(id);
        persist();
        return true;
    }

    public CronStatus status() {
        lock.lock();
        try {
            return new CronStatus(running.get(), jobs.size(), nextWakeAtMs());
        } finally {
            lock.unlock();
        }
    }

    private void runLoop() {
        try {
            while (awaitNextWake()) {
                try {
                    runDueJobs();
                } catch (RuntimeException e) {
                    LOG.error("Cron tick failed; continuing", e);
                }
            }
        } finally {
            LOG.info("Cron service stopped");
        }
    }

    /**
     * Sleeps until the earliest next run, recomputing the deadline whenever the registry changes.
     *
     * @return {@code false} if stop was requested while sleeping
     */
    private boolean awaitNextWake() {
        lock.lock();
        try {
            while (running.get()) {
                Long wake = nextWakeAtMs();
                long delayMs = wake == null
                    ? settings.idleInterval().toMillis()
                    : Math.max(0L, wake - clock.millis());
                if (delayMs == 0L) {
                    return true;
                }
                boolean signalled = wakeup.await(delayMs, TimeUnit.MILLISECONDS);
                if (!signalled) {
                    return running.get();
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void runDueJobs() {
        long now = clock.millis();
        List<String> due = new ArrayList<>();
        lock.lock();
        try {
            for (CronJob job : jobs) {
                if (job.dueAt(now)) {
                    due.add(job.id());
                }
            }
        } finally {
            lock.unlock();
        }

        if (due.isEmpty()) {
            LOG.debug("Cron tick at {} found no due jobs", now);
            return;
        }

        LOG.debug("Cron tick at {} dispatching {} jobs", now, due.size());
        for (String id : due) {
            dispatch(id);
        }
        persist();
    }

    private void dispatch(String id) {
        CronJob job = job(id).orElse(null);
        if (job == null) {
            return;
        }

        long startedAtMs = clock.millis();
        LOG.info("Executing cron job '{}' ({})", job.name(), job.id());
        listener.onJobStarted(job);

        String error = execute(job);
        JobStatus status = error == null ? JobStatus.OK : JobStatus.ERROR;

        long finishedAtMs;
        lock.lock();
        try {
            finishedAtMs = clock.millis();
            int index = indexOf(id);
            if (index < 0) {
                LOG.debug("Cron job {} was removed while executing", id);
            } else {
                applyOutcome(index, startedAtMs, finishedAtMs, status, error);
            }
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        listener.onJobFinished(job, status, error, finishedAtMs - startedAtMs);
        if (status == JobStatus.OK) {
            LOG.info("Cron job '{}' completed", job.name());
        } else {
            LOG.warn("Cron job '{}' failed: {}", job.name(), error);
        }
    }

    private void applyOutcome(int index, long startedAtMs, long nowMs, JobStatus status, String error) {
        CronJob current = jobs.get(index);
        CronJobState state = current.state().completed(startedAtMs, status, error);

        if (current.oneShot()) {
            if (current.deleteAfterRun()) {
                jobs.remove(index);
                LOG.info("Deleted one-shot cron job '{}' ({})", current.name(), current.id());
            } else {
                jobs.set(index, current.withState(state, nowMs).withEnabled(false, null, nowMs));
            }
            return;
        }

        Long next = current.enabled() ? calculator.nextRunOrNull(current.schedule(), nowMs) : null;
        jobs.set(index, current.withState(state.withNextRunAtMs(next), nowMs));
    }

    private String execute(CronJob job) {
        TaskExecutor current = executor.get();
        try {
            CompletionStage<Void> stage = current.execute(job);
            if (stage != null) {
                stage.toCompletableFuture().get();
            }
            return null;
        } catch (ExecutionException e) {
            return describe(e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        } catch (RuntimeException e) {
            return describe(e);
        }
    }

    private int loadRegistry() {
        List<CronJob> loaded;
        try {
            loaded = store.load().jobs();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to load cron store; starting with no jobs", e);
            listener.onStoreLoadFailed(e);
            loaded = List.of();
        }

        lock.lock();
        try {
            jobs.clear();
            jobs.addAll(loaded);
            wakeup.signalAll();
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    private void reconcile() {
        lock.lock();
        try {
            long now = clock.millis();
            for (int i = 0; i < jobs.size(); i++) {
                CronJob job = jobs.get(i);
                if (job.enabled()) {
                    Long next = calculator.nextRunOrNull(job.schedule(), now);
                    jobs.set(i, job.withState(job.state().withNextRunAtMs(next), job.updatedAtMs()));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        synchronized (persistMonitor) {
            List<CronJob> snapshot;
            lock.lock();
            try {
                snapshot = List.copyOf(jobs);
            } finally {
                lock.unlock();
            }

            try {
                store.save(CronStoreDocument.of(snapshot));
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to persist cron store", e);
                listener.onStoreSaveFailed(e);
            }
        }
    }

    private void signalChange() {
        lock.lock();
        try {
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private Long nextWakeAtMs() {
        Long earliest = null;
        for (CronJob job : jobs) {
            Long next = job.state().nextRunAtMs();
            if (job.enabled() && next != null && (earliest == null || next < earliest)) {
                earliest = next;
            }
        }
        return earliest;
    }

    // caller holds lock
    private int indexOf(String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    // caller holds lock
    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
        } while (indexOf(id) >= 0);
        return id;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
