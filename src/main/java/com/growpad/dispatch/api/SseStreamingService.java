package com.growpad.dispatch.api;

import com.growpad.core.events.EventBus;
import com.growpad.core.events.RunEvent;
import com.growpad.core.model.Run;
import com.growpad.core.store.RunStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bridges a run's {@link EventBus} queue to an {@link SseEmitter}.
 * <p>
 * Each emitter gets a pump thread that drains the queue and forwards every event as an
 * SSE frame named after the event's action. When the queue stays idle for the keep-alive
 * interval a {@code : keep-alive} comment is sent instead. The stream completes after the
 * run's terminal event.
 * <p>
 * A client connecting to a run that has already finished gets the persisted event log
 * replayed, since nothing will ever be published to the live queue again.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes, long enough for the gated waits. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    static final String KEEP_ALIVE = "keep-alive";

    private final EventBus eventBus;
    private final RunStore runStore;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, RunStore runStore) {
        this(eventBus, runStore, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, RunStore runStore, long timeoutMs) {
        this.eventBus = eventBus;
        this.runStore = runStore;
        this.timeoutMs = timeoutMs;
    }

    @PreDestroy
    void stop() {
        pumps.shutdownNow();
        log.info("SSE pumps stopped");
    }

    /**
     * Creates an SSE emitter that streams events for the given run.
     *
     * @throws com.growpad.core.store.RunNotFoundException if the run does not exist
     */
    public SseEmitter createEmitter(String runId) {
        Run run = runStore.load(runId);
        SseEmitter emitter = new SseEmitter(timeoutMs);

        if (run.isTerminal()) {
            replay(emitter, runId, runStore.readEvents(runId));
            return emitter;
        }

        var registration = new EmitterRegistration(runId, emitter, eventBus.subscribe(runId));
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", runId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for run {}: {}", runId, e.getMessage());
        }

        pumps.submit(() -> pump(registration));
        log.info("SSE emitter created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void pump(EmitterRegistration registration) {
        SseEmitter emitter = registration.emitter();
        try {
            while (activeRegistrations.contains(registration)) {
                Optional<RunEvent> next = registration.stream().next();
                if (next.isEmpty()) {
                    emitter.send(SseEmitter.event().comment(KEEP_ALIVE));
                    continue;
                }
                RunEvent event = next.get();
                emitter.send(SseEmitter.event().name(event.action()).data(event));
                if (event.isRunTerminal()) {
                    emitter.complete();
                    cleanup(registration);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            // Client went away; the emitter callbacks clean up.
            log.debug("SSE stream for run {} closed: {}", registration.runId(), e.getMessage());
            cleanup(registration);
        }
    }

    private void replay(SseEmitter emitter, String runId, List<RunEvent> events) {
        try {
            for (RunEvent event : events) {
                emitter.send(SseEmitter.event().name(event.action()).data(event));
            }
            emitter.complete();
            log.debug("Replayed {} events for finished run {}", events.size(), runId);
        } catch (IOException e) {
            log.debug("Replay for run {} aborted: {}", runId, e.getMessage());
            emitter.completeWithError(e);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            log.debug("Cleaned up SSE registration for run {}", registration.runId());
        }
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            EventBus.EventStream stream
    ) {}
}
