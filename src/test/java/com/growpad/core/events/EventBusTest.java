package com.growpad.core.events;

import com.growpad.core.model.StageId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus(Duration.ofMillis(50));

    @Test
    @DisplayName("Events published before subscribe are buffered and delivered in order")
    void buffersUntilSubscribed() throws Exception {
        bus.publish("r1", RunEvent.stageStart(StageId.INTAKE));
        bus.publish("r1", RunEvent.stageEnd(StageId.INTAKE, "done", 5, null));

        EventBus.EventStream stream = bus.subscribe("r1");

        assertEquals(RunEvent.STAGE_START, stream.next().orElseThrow().action());
        assertEquals(RunEvent.STAGE_END, stream.next().orElseThrow().action());
    }

    @Test
    @DisplayName("Idle stream yields empty after the keep-alive interval")
    void idleStreamReturnsEmpty() throws Exception {
        EventBus.EventStream stream = bus.subscribe("idle");

        Optional<RunEvent> next = stream.next();

        assertTrue(next.isEmpty());
        assertEquals("idle", stream.runId());
    }

    @Test
    @DisplayName("Runs get separate queues")
    void queuesAreIsolated() throws Exception {
        bus.publish("a", RunEvent.stageStart(StageId.INTAKE));

        assertTrue(bus.subscribe("b").next().isEmpty());
        assertTrue(bus.subscribe("a").next().isPresent());
    }

    @Test
    @DisplayName("dispose drops the queue and its buffered events")
    void disposeDropsQueue() throws Exception {
        bus.publish("r2", RunEvent.stageStart(StageId.INTAKE));
        assertTrue(bus.hasQueue("r2"));

        bus.dispose("r2");

        assertFalse(bus.hasQueue("r2"));
        assertTrue(bus.subscribe("r2").next().isEmpty());
    }

    @Test
    @DisplayName("Terminal run events are recognized")
    void terminalEvents() {
        assertTrue(RunEvent.of(StageId.EXPORT, "run_completed", "done", null, null).isRunTerminal());
        assertTrue(RunEvent.of(null, "run_cancelled", "cancelled", null, null).isRunTerminal());
        assertFalse(RunEvent.stageEnd(StageId.EXPORT, "done", 1, null).isRunTerminal());
    }
}
