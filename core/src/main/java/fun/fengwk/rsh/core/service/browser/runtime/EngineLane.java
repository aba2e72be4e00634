package fun.fengwk.rsh.core.service.browser.runtime;

import com.microsoft.playwright.TimeoutError;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Single thread owning one Playwright driver and browser.
 *
 * <p>Playwright objects are not thread safe, so every call touching the lane's browser or any context
 * created from it is executed on the lane thread.
 *
 * @author fengwk
 */
@Slf4j
public class EngineLane implements AutoCloseable {

    private static final long CLOSE_TIMEOUT_MS = 10000;

    private static final int TASK_PENDING = 0;
    private static final int TASK_RUNNING = 1;
    private static final int TASK_DONE = 2;
    private static final int TASK_ABANDONED = 3;

    private final int laneId;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger boundContexts = new AtomicInteger(0);
    private volatile boolean connected = false;

    // Confined to the lane thread.
    private BrowserSession browserSession;

    private EngineLane(int laneId) {
        this.laneId = laneId;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("rsh-engine-lane-" + laneId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start a lane and launch its browser, blocking until the browser is ready.
     *
     * @throws IllegalStateException if the browser cannot be launched in time
     */
    public static EngineLane start(int laneId, BrowserSession.Factory factory, long launchTimeoutMs) {
        EngineLane lane = new EngineLane(laneId);
        try {
            lane.launch(factory, launchTimeoutMs);
            return lane;
        } catch (RuntimeException ex) {
            lane.close();
            throw ex;
        }
    }

    public int getLaneId() {
        return laneId;
    }

    public boolean isConnected() {
        return connected && !closed.get();
    }

    /**
     * Load used to pick a lane: contexts bound to this lane plus tasks queued or running on it.
     */
    public int load() {
        return boundContexts.get() + inFlight.get();
    }

    public int boundContexts() {
        return boundContexts.get();
    }

    void bindContext() {
        boundContexts.incrementAndGet();
    }

    void unbindContext() {
        boundContexts.decrementAndGet();
    }

    /**
     * Run the task on the lane thread and wait for its result without a deadline.
     *
     * <p>Runtime exceptions thrown by the task are rethrown as is, checked ones are wrapped.
     */
    public <T> T call(BrowserSessionTask<T> task) {
        return call(task, 0, result -> {
        });
    }

    /**
     * Run the task on the lane thread and wait at most {@code timeoutMs} for its result.
     *
     * @throws TimeoutError if the deadline passes, counting the time spent queued behind other tasks
     */
    public <T> T call(BrowserSessionTask<T> task, long timeoutMs) {
        return call(task, timeoutMs, result -> {
        });
    }

    /**
     * Same as {@link #call(BrowserSessionTask, long)}. A result produced after the caller gave up is handed to
     * {@code discard} on the lane thread, so resources created by an abandoned task are not leaked.
     *
     * @param timeoutMs deadline in milliseconds, zero or negative waits without a deadline
     */
    public <T> T call(BrowserSessionTask<T> task, long timeoutMs, Consumer<? super T> discard) {
        if (closed.get()) {
            throw new IllegalStateException("engine lane " + laneId + " is closed");
        }
        AtomicInteger state = new AtomicInteger(TASK_PENDING);
        inFlight.incrementAndGet();
        Future<T> future;
        try {
            future = executor.submit(() -> runTask(task, state, discard));
        } catch (RuntimeException ex) {
            inFlight.decrementAndGet();
            throw new IllegalStateException("engine lane " + laneId + " is closed", ex);
        }
        try {
            return timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(state, future);
            throw new IllegalStateException("engine lane " + laneId + " call interrupted", ex);
        } catch (TimeoutException ex) {
            if (abandon(state, future)) {
                throw new TimeoutError("Timeout " + timeoutMs + "ms exceeded waiting for engine lane " + laneId);
            }
            // The task completed while the deadline passed, its result is deliverable.
            return awaitDone(future);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    /**
     * Queue the action and wait at most {@code timeoutMs} for it. Unlike {@link #call(BrowserSessionTask, long)}
     * the action is never cancelled, it still runs on the lane when the wait times out.
     *
     * @return true if the action completed within the deadline
     */
    public boolean runDetached(BrowserSessionTask<?> action, long timeoutMs) {
        if (closed.get()) {
            throw new IllegalStateException("engine lane " + laneId + " is closed");
        }
        AtomicBoolean awaited = new AtomicBoolean(true);
        inFlight.incrementAndGet();
        Future<?> future;
        try {
            future = executor.submit(() -> {
                try {
                    return action.execute(browserSession.browser());
                } catch (Exception ex) {
                    if (!awaited.get()) {
                        log.warn("detached lane action failed, lane={}, error={}", laneId, ex.getMessage());
                    }
                    throw ex;
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (RuntimeException ex) {
            inFlight.decrementAndGet();
            throw new IllegalStateException("engine lane " + laneId + " is closed", ex);
        }
        try {
            future.get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            awaited.set(false);
            return false;
        } catch (TimeoutException ex) {
            awaited.set(false);
            return false;
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    private <T> T runTask(BrowserSessionTask<T> task, AtomicInteger state, Consumer<? super T> discard)
        throws Exception {
        if (!state.compareAndSet(TASK_PENDING, TASK_RUNNING)) {
            return null;
        }
        try {
            T result = task.execute(browserSession.browser());
            if (!state.compareAndSet(TASK_RUNNING, TASK_DONE)) {
                discardResult(result, discard);
            }
            return result;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * @return true if the caller gave up the task, false if the task already completed
     */
    private boolean abandon(AtomicInteger state, Future<?> future) {
        if (state.compareAndSet(TASK_PENDING, TASK_ABANDONED)) {
            future.cancel(false);
            inFlight.decrementAndGet();
            return true;
        }
        return state.compareAndSet(TASK_RUNNING, TASK_ABANDONED);
    }

    private <T> void discardResult(T result, Consumer<? super T> discard) {
        if (result == null) {
            return;
        }
        try {
            discard.accept(result);
        } catch (RuntimeException ex) {
            log.warn("failed to discard abandoned result, lane={}, error={}", laneId, ex.getMessage());
        }
    }

    private <T> T awaitDone(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("engine lane " + laneId + " call interrupted", ex);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    private RuntimeException unwrap(ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("engine lane " + laneId + " call failed: " + cause.getMessage(), cause);
    }

    private void launch(BrowserSession.Factory factory, long launchTimeoutMs) {
        Future<?> future = executor.submit(() -> {
            browserSession = factory.create();
            browserSession.browser().onDisconnected(browser -> {
                connected = false;
                log.warn("browser disconnected, lane={}", laneId);
            });
            connected = true;
        });
        try {
            future.get(Math.max(1L, launchTimeoutMs), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("browser launch interrupted, lane=" + laneId, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new IllegalStateException("failed to launch browser, lane=" + laneId + ", error=" + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new IllegalStateException("browser launch timeout, lane=" + laneId, ex);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connected = false;
        Future<?> future = executor.submit(() -> {
            if (browserSession != null) {
                browserSession.close();
            }
        });
        try {
            future.get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("close browser interrupted, lane={}", laneId);
        } catch (ExecutionException ex) {
            log.warn("failed to close browser, lane={}", laneId, ex.getCause());
        } catch (TimeoutException ex) {
            log.warn("close browser timeout, lane={}, timeoutMs={}", laneId, CLOSE_TIMEOUT_MS);
        } finally {
            // Tasks still queued are cancelled, so their callers stop waiting.
            for (Runnable pending : executor.shutdownNow()) {
                if (pending instanceof Future<?> pendingFuture) {
                    pendingFuture.cancel(false);
                }
            }
        }
    }

}
