package com.growpad.core.engine;

import com.growpad.core.llm.GenerationTrace;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory companion of a live run: the wake-up signal for gated waits and the
 * generation trace. Lives in the {@link RunRegistry} from start until disposal.
 */
public class RunContext {

    private final String runId;
    private final GenerationTrace trace = new GenerationTrace();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long version;

    RunContext(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public GenerationTrace trace() {
        return trace;
    }

    /** Current change counter; pass it to {@link #awaitChange} after reading state. */
    public long version() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    /** Wakes any waiter; called after an external mutation was saved. */
    public void signal() {
        lock.lock();
        try {
            version++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a signal newer than {@code seenVersion} arrives or {@code maxWait} elapses.
     *
     * @return true if woken by a signal
     */
    public boolean awaitChange(long seenVersion, Duration maxWait) throws InterruptedException {
        long remaining = maxWait.toNanos();
        lock.lock();
        try {
            while (version == seenVersion) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
