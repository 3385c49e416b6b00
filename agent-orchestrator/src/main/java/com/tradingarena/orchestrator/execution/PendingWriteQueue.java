package com.tradingarena.orchestrator.execution;

import com.tradingarena.orchestrator.persistence.ExecutionWrite;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Filled executions whose persistence exhausted its retries. The in-memory books already
 * reflect them; the maintenance loop drains this queue back into the store.
 */
@Component
public class PendingWriteQueue {

    private final ConcurrentLinkedQueue<ExecutionWrite> pending = new ConcurrentLinkedQueue<>();

    public void park(ExecutionWrite write) {
        pending.add(write);
    }

    /** Removes and returns everything currently parked, oldest first. */
    public List<ExecutionWrite> drain() {
        List<ExecutionWrite> drained = new ArrayList<>();
        ExecutionWrite next;
        while ((next = pending.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int size() {
        return pending.size();
    }
}
