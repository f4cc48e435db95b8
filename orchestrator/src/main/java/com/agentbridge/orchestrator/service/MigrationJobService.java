package com.agentbridge.orchestrator.service;

import com.agentbridge.orchestrator.error.AdapterNotFoundException;
import com.agentbridge.orchestrator.error.BridgeException;
import com.agentbridge.orchestrator.error.ErrorCategory;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.store.AgentSummary;
import com.agentbridge.orchestrator.store.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch re-export of stored agents into a target protocol.
 *
 * Each job gets its own fixed pool of workers pulling agent ids from a shared
 * queue. Cancellation is cooperative: workers check the flag before taking
 * the next agent, so a translation already in flight always runs to the end
 * and never leaves cache or store half-updated.
 *
 * Finished jobs stay queryable for the retention window and are purged when
 * the next job starts.
 */
public class MigrationJobService {

    private static final Logger log = LoggerFactory.getLogger(MigrationJobService.class);

    static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final TranslationOrchestrator orchestrator;
    private final CanonicalStore          store;
    private final AdapterRegistry         registry;
    private final Clock                   clock;
    private final int                     defaultWorkers;
    private final Duration                retention;
    private final Map<UUID, Job>          jobs = new ConcurrentHashMap<>();

    public MigrationJobService(TranslationOrchestrator orchestrator,
                               CanonicalStore store,
                               AdapterRegistry registry,
                               Clock clock,
                               int defaultWorkers) {
        this(orchestrator, store, registry, clock, defaultWorkers, DEFAULT_RETENTION);
    }

    public MigrationJobService(TranslationOrchestrator orchestrator,
                               CanonicalStore store,
                               AdapterRegistry registry,
                               Clock clock,
                               int defaultWorkers,
                               Duration retention) {
        if (retention.isNegative()) throw new IllegalArgumentException("retention must not be negative: " + retention);
        this.orchestrator   = orchestrator;
        this.store          = store;
        this.registry       = registry;
        this.clock          = clock;
        this.defaultWorkers = defaultWorkers;
        this.retention      = retention;
    }

    // ------------------------------------------------------------------
    // Job lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a migration job in the background.
     *
     * @throws AdapterNotFoundException if the target format has no enabled adapter
     */
    public UUID start(MigrationRequest request) {
        if (registry.getAdapter(request.targetFormat()).isEmpty()) {
            throw new AdapterNotFoundException(request.targetFormat());
        }
        purgeFinished();
        List<String> agentIds = request.agentIds().isEmpty()
                ? store.listAgents().stream().map(AgentSummary::agentId).toList()
                : request.agentIds();
        int workers = Math.max(1, Math.min(
                request.workers() != null ? request.workers() : defaultWorkers,
                Math.max(1, agentIds.size())));

        Job job = new Job(UUID.randomUUID(), request, agentIds, clock.instant());
        jobs.put(job.id, job);

        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "migration-" + job.id.toString().substring(0, 8));
            t.setDaemon(true);
            return t;
        });
        CompletableFuture<?>[] runs = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            runs[i] = CompletableFuture.runAsync(() -> work(job), pool);
        }
        job.done = CompletableFuture.allOf(runs).whenComplete((ignored, error) -> {
            pool.shutdown();
            job.finish(clock.instant());
            if (error != null) {
                log.error("Migration job {} worker crashed: {}", job.id, error.getMessage(), error);
            }
            log.info("Migration job {} {}: {} succeeded, {} failed, {} skipped",
                    job.id, job.state, job.succeeded.get(), job.failed.get(), job.skipped());
        });

        log.info("Migration job {} started: {} agent(s) → {} with {} worker(s), continueOnError={}",
                job.id, agentIds.size(), request.targetFormat(), workers, request.continueOnError());
        return job.id;
    }

    /** Request cancellation; agents already being translated still complete. */
    public boolean cancel(UUID jobId) {
        Job job = jobs.get(jobId);
        if (job == null || job.done.isDone()) return false;
        job.cancelled.set(true);
        log.info("Migration job {} cancellation requested", jobId);
        return true;
    }

    /**
     * Drop jobs that finished longer ago than the retention window, with
     * their per-agent items.
     *
     * @return number of jobs removed
     */
    public int purgeFinished() {
        Instant cutoff = clock.instant().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.finishedAt != null && !job.finishedAt.isAfter(cutoff));
        int purged = before - jobs.size();
        if (purged > 0) log.debug("Purged {} finished migration job(s)", purged);
        return purged;
    }

    public Optional<MigrationStatus> status(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(Job::status);
    }

    public List<MigrationStatus> list() {
        return jobs.values().stream().map(Job::status).toList();
    }

    /** Block until the job has finished or {@code timeout} elapsed; returns the status either way. */
    public MigrationStatus await(UUID jobId, Duration timeout) throws InterruptedException {
        Job job = jobs.get(jobId);
        if (job == null) throw new IllegalArgumentException("Unknown migration job " + jobId);
        try {
            job.done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Migration job {} not cleanly finished after {}: {}", jobId, timeout, e.toString());
        }
        return job.status();
    }

    // ------------------------------------------------------------------
    // Worker loop
    // ------------------------------------------------------------------

    private void work(Job job) {
        String agentId;
        while (!job.cancelled.get() && (agentId = job.queue.poll()) != null) {
            MigrationItem item = migrateOne(agentId, job.request.targetFormat());
            job.items.add(item);
            if (item.success()) {
                job.succeeded.incrementAndGet();
            } else {
                job.failed.incrementAndGet();
                if (!job.request.continueOnError() && job.cancelled.compareAndSet(false, true)) {
                    log.warn("Migration job {} stopping after failure on {}", job.id, agentId);
                }
            }
        }
    }

    private MigrationItem migrateOne(String agentId, String targetFormat) {
        try {
            TranslationResponse response = orchestrator.translateFromStore(agentId, targetFormat, null);
            return new MigrationItem(agentId, response.success(), response.totalFidelity(),
                    response.targetData(), response.errors());
        } catch (BridgeException e) {
            log.warn("Migration of {} to {} failed: {}", agentId, targetFormat, e.getMessage());
            return new MigrationItem(agentId, false, 0.0, null, List.of(TranslationError.of(e)));
        } catch (RuntimeException e) {
            log.error("Unexpected error migrating {}: {}", agentId, e.getMessage(), e);
            return new MigrationItem(agentId, false, 0.0, null,
                    List.of(new TranslationError(ErrorCategory.TRANSFORM, "Unexpected error: " + e.getMessage())));
        }
    }

    // ------------------------------------------------------------------
    // Job state
    // ------------------------------------------------------------------

    private static final class Job {
        final UUID                     id;
        final MigrationRequest         request;
        final int                      total;
        final Instant                  startedAt;
        final Queue<String>            queue     = new ConcurrentLinkedQueue<>();
        final Queue<MigrationItem>     items     = new ConcurrentLinkedQueue<>();
        final AtomicBoolean            cancelled = new AtomicBoolean();
        final AtomicInteger            succeeded = new AtomicInteger();
        final AtomicInteger            failed    = new AtomicInteger();
        volatile CompletableFuture<?>  done      = new CompletableFuture<>();
        volatile MigrationState        state     = MigrationState.RUNNING;
        volatile Instant               finishedAt;

        Job(UUID id, MigrationRequest request, List<String> agentIds, Instant startedAt) {
            this.id        = id;
            this.request   = request;
            this.total     = agentIds.size();
            this.startedAt = startedAt;
            this.queue.addAll(agentIds);
        }

        int skipped() {
            return total - succeeded.get() - failed.get();
        }

        void finish(Instant at) {
            finishedAt = at;
            state = cancelled.get() && skipped() > 0 ? MigrationState.CANCELLED : MigrationState.COMPLETED;
        }

        MigrationStatus status() {
            return new MigrationStatus(id, state, request.targetFormat(), total, succeeded.get(), failed.get(),
                    skipped(), startedAt, finishedAt, List.copyOf(items));
        }
    }
}
