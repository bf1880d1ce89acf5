package com.acme.pgprecheck.util;

import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.exceptions.ProbeTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Runs a probe call with a hard deadline.
 *
 * <p>The call runs on a shared cached pool of daemon threads. When the deadline passes the
 * future is cancelled (interrupting the thread) and a {@link ProbeTimeoutException} is
 * thrown; a JDBC call that ignores the interrupt is abandoned rather than awaited.
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "precheck-probe-call");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {}

    /** A probe call that may fail with a {@link ProbeException}. */
    @FunctionalInterface
    public interface ProbeCall<T> {
        T call() throws ProbeException;
    }

    /**
     * @param operation name used in log lines and the timeout message
     * @param timeout   deadline; null, zero or negative runs the call directly
     * @throws ProbeTimeoutException if the deadline passes
     * @throws ProbeException        if the call fails, including unexpected runtime failures
     */
    public static <T> T executeWithTimeout(String operation, Duration timeout, ProbeCall<T> call) throws ProbeException {
        if (!isEnabled(timeout)) {
            return direct(operation, call);
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        Callable<T> task = call::call;
        Future<T> future = EXECUTOR.submit(task);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Probe '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new ProbeTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProbeException(null, "Probe '" + operation + "' was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProbeException) {
                throw (ProbeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ProbeException(null, "Probe '" + operation + "' failed: " + cause, cause);
        }
    }

    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    private static <T> T direct(String operation, ProbeCall<T> call) throws ProbeException {
        try {
            return call.call();
        } catch (RuntimeException e) {
            throw new ProbeException(null, "Probe '" + operation + "' failed: " + e, e);
        }
    }
}
