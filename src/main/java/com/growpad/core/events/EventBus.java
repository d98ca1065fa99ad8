package com.growpad.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory event bus for live run progress.
 * <p>
 * Each run has exactly one FIFO queue, created lazily on first publish or first
 * subscribe. Events published before anyone subscribes stay buffered until consumed.
 * Publishing never blocks. Queues are removed by {@link #dispose} when the run's
 * lifecycle ends.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run queues keyed by runId. */
    private final ConcurrentHashMap<String, BlockingQueue<RunEvent>> runQueues = new ConcurrentHashMap<>();

    private final Duration keepAliveInterval;

    @Autowired
    public EventBus(@Value("${growpad.engine.keep-alive-interval:25s}") Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    /**
     * Queue an event for the run's subscriber.
     *
     * @param runId the run the event belongs to
     * @param event the event to publish
     */
    public void publish(String runId, RunEvent event) {
        log.debug("Publishing event: {}/{} for run {}", event.action(), event.outcome(), runId);
        queueFor(runId).offer(event);
    }

    /**
     * Open a stream over the run's queue.
     *
     * @param runId the run to subscribe to
     * @return a stream yielding events in publish order, or keep-alives when idle
     */
    public EventStream subscribe(String runId) {
        log.debug("Subscribed to run {}", runId);
        return new EventStream(runId, queueFor(runId), keepAliveInterval);
    }

    /**
     * Drop the run's queue and anything still buffered in it.
     */
    public void dispose(String runId) {
        BlockingQueue<RunEvent> removed = runQueues.remove(runId);
        if (removed != null) {
            log.debug("Disposed event queue for run {} ({} undelivered)", runId, removed.size());
        }
    }

    public boolean hasQueue(String runId) {
        return runQueues.containsKey(runId);
    }

    public Duration keepAliveInterval() {
        return keepAliveInterval;
    }

    private BlockingQueue<RunEvent> queueFor(String runId) {
        return runQueues.computeIfAbsent(runId, k -> new LinkedBlockingQueue<>());
    }

    /**
     * Consumer side of a run's queue.
     */
    public static final class EventStream {

        private final String runId;
        private final BlockingQueue<RunEvent> queue;
        private final Duration keepAliveInterval;

        EventStream(String runId, BlockingQueue<RunEvent> queue, Duration keepAliveInterval) {
            this.runId = runId;
            this.queue = queue;
            this.keepAliveInterval = keepAliveInterval;
        }

        /**
         * Waits up to the keep-alive interval for the next event.
         *
         * @return the next event, or empty when the interval elapsed with nothing to deliver
         */
        public Optional<RunEvent> next() throws InterruptedException {
            return Optional.ofNullable(queue.poll(keepAliveInterval.toMillis(), TimeUnit.MILLISECONDS));
        }

        public String runId() {
            return runId;
        }
    }
}
