package com.example.feedsync.ingestion;

import com.example.feedsync.exception.QueueFullException;
import com.example.feedsync.model.ItemStub;
import com.example.feedsync.service.DeadLetterService;
import com.example.feedsync.service.IngestionMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the push endpoint and enrichment.
 *
 * <p>Backpressure policy: a batch is accepted only if all of its stubs fit.
 * Otherwise the whole batch is refused with {@link QueueFullException} and
 * nothing is enqueued, so the hub retries it later instead of this process
 * buffering without limit. A fixed pool of workers drains the queue through
 * {@link MetadataEnricher}. Stubs still queued at shutdown are kept as dead
 * letters.
 */
@Slf4j
@Component
public class IngestionQueue implements SmartLifecycle {

    private final BlockingQueue<ItemStub> queue;
    private final MetadataEnricher enricher;
    private final DeadLetterService deadLetters;
    private final IngestionMetrics metrics;
    private final int workerCount;
    private final Object submitLock = new Object();

    private volatile boolean running = false;
    private ThreadPoolTaskExecutor workers;

    public IngestionQueue(MetadataEnricher enricher,
                          DeadLetterService deadLetters,
                          IngestionMetrics metrics,
                          MeterRegistry meterRegistry,
                          @Value("${app.ingestion.queue-capacity:500}") int capacity,
                          @Value("${app.ingestion.workers:4}") int workerCount) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.enricher = enricher;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.workerCount = workerCount;
        Gauge.builder("feedsync.queue.depth", queue, BlockingQueue::size).register(meterRegistry);
    }

    /**
     * Enqueues every stub of one push, or none of them.
     *
     * @throws QueueFullException when the batch does not fit or the queue is shutting down
     */
    public void submitAll(List<ItemStub> stubs) {
        if (stubs.isEmpty()) {
            return;
        }
        synchronized (submitLock) {
            // consumers only ever shrink the queue, so the capacity checked here is still there below
            int remaining = queue.remainingCapacity();
            if (!running || remaining < stubs.size()) {
                metrics.recordBackpressureRejected();
                throw new QueueFullException(stubs.size(), running ? remaining : 0);
            }
            for (ItemStub stub : stubs) {
                queue.add(stub);
            }
        }
        log.debug("Enqueued {} stubs (depth {})", stubs.size(), queue.size());
    }

    public int depth() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        int poolSize = Math.max(1, workerCount);
        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(poolSize);
        workers.setMaxPoolSize(poolSize);
        workers.setQueueCapacity(0);
        workers.setThreadNamePrefix("ingest-");
        workers.setWaitForTasksToCompleteOnShutdown(true);
        workers.setAwaitTerminationSeconds(30);
        workers.initialize();
        for (int i = 0; i < poolSize; i++) {
            workers.execute(this::drainLoop);
        }
        log.info("Ingestion queue started with {} workers, capacity {}", workerCount, queue.remainingCapacity());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        synchronized (submitLock) {
            running = false;
        }
        // waits for in-flight stubs; workers leave their loop once running is false
        workers.shutdown();

        List<ItemStub> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        if (!leftover.isEmpty()) {
            log.warn("Persisting {} unprocessed stubs as dead letters on shutdown", leftover.size());
            for (ItemStub stub : leftover) {
                try {
                    deadLetters.record(stub, "shutdown before enrichment", 0);
                } catch (RuntimeException ex) {
                    log.error("❌ Lost unprocessed item {} on shutdown: {}", stub.itemId(), ex.getMessage());
                }
            }
        }
        log.info("Ingestion queue stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // start before and stop after the embedded web server
    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 4096;
    }

    private void drainLoop() {
        while (running) {
            ItemStub stub;
            try {
                stub = queue.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            if (stub == null) {
                continue;
            }
            try {
                enricher.enrich(stub);
            } catch (RuntimeException ex) {
                // keep the worker alive
                log.error("Unexpected failure enriching item {}: {}", stub.itemId(), ex.getMessage(), ex);
            }
        }
    }
}
