package dev.flowsync.session;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * One logical task queue per session on top of a shared pool.
 *
 * <p>Tasks for the same session run one at a time in submission order; tasks for
 * different sessions run in parallel. Nothing here blocks: callers get a
 * {@link CompletableFuture} completed with the task's result or its exception.
 * A task must never wait on another task of its own lane.
 */
@Component
public class SessionLanes {

    static final String MDC_SESSION = "sessionId";

    private final Executor executor;
    private final ConcurrentMap<String, Lane> lanes = new ConcurrentHashMap<>();

    public SessionLanes(@Qualifier("sessionExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(String sessionId, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable wrapped = () -> {
            String previous = MDC.get(MDC_SESSION);
            MDC.put(MDC_SESSION, sessionId);
            try {
                result.complete(task.get());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                if (previous != null) MDC.put(MDC_SESSION, previous);
                else MDC.remove(MDC_SESSION);
            }
        };
        // enqueue under the map's lock so a retiring lane can never drop a task
        Lane lane = lanes.compute(sessionId, (id, existing) -> {
            Lane target = existing != null ? existing : new Lane(id);
            target.enqueue(wrapped);
            return target;
        });
        if (lane.startIfIdle()) lane.drainNext();
        return result;
    }

    public CompletableFuture<Void> run(String sessionId, Runnable task) {
        return submit(sessionId, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Forgets the lane once its queue has drained. Until then, and whenever new work
     * arrives for the same id, the existing lane keeps serving the session.
     */
    public void release(String sessionId) {
        Lane lane = lanes.get(sessionId);
        if (lane != null && lane.markReleased()) retire(lane);
    }

    int laneCount() {
        return lanes.size();
    }

    private void retire(Lane lane) {
        lanes.computeIfPresent(lane.sessionId, (id, current) -> current == lane && lane.retirable() ? null : current);
    }

    /** Serial queue for one session: runs its tasks one after another on the shared pool. */
    private final class Lane {
        private final String sessionId;
        private final Queue<Runnable> tasks = new ArrayDeque<>();
        private boolean running;
        private boolean released;

        Lane(String sessionId) {
            this.sessionId = sessionId;
        }

        synchronized void enqueue(Runnable task) {
            tasks.add(task);
            released = false;
        }

        synchronized boolean startIfIdle() {
            if (running) return false;
            running = true;
            return true;
        }

        synchronized boolean markReleased() {
            released = true;
            return retirable();
        }

        synchronized boolean retirable() {
            return released && !running && tasks.isEmpty();
        }

        void drainNext() {
            Runnable next;
            boolean retire;
            synchronized (this) {
                next = tasks.poll();
                if (next == null) running = false;
                retire = next == null && released;
            }
            if (next == null) {
                if (retire) retire(this);
                return;
            }
            executor.execute(() -> {
                try {
                    next.run();
                } finally {
                    drainNext();
                }
            });
        }
    }
}
