package hierfed.common.net;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Retries transient gRPC failures with exponential backoff, never past the enclosing phase's
 * deadline. Non-transient statuses are rethrown at once.
 */
public final class Backoff {
    private static final Logger log = LoggerFactory.getLogger(Backoff.class);
    private static final long MAX_SLEEP_MS = 1000L;

    private Backoff() {}

    public static boolean isTransient(StatusRuntimeException e) {
        Status.Code c = e.getStatus().getCode();
        return c == Status.Code.UNAVAILABLE || c == Status.Code.DEADLINE_EXCEEDED
                || c == Status.Code.RESOURCE_EXHAUSTED || c == Status.Code.ABORTED;
    }

    /**
     * @param what          label for log lines
     * @param deadlineNanos absolute System.nanoTime deadline
     * @param baseMs        first sleep; doubled after each attempt, capped at one second
     * @throws StatusRuntimeException the last failure once the deadline is exhausted, or any non-transient one
     */
    public static <T> T retryUntil(String what, long deadlineNanos, long baseMs, Callable<T> call) throws Exception {
        long sleep = Math.max(1L, baseMs);
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (StatusRuntimeException e) {
                if (!isTransient(e)) throw e;
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0L) {
                    log.debug("{}: giving up after {} attempts: {}", what, attempt, e.getStatus().getCode());
                    throw e;
                }
                log.debug("{}: attempt {} failed with {}, retrying in {}ms", what, attempt, e.getStatus().getCode(), sleep);
                Thread.sleep(Math.min(sleep, remainingMs));
                sleep = Math.min(sleep * 2, MAX_SLEEP_MS);
            }
        }
    }

    /** Remaining time before {@code deadlineNanos}, floored at 1ms for use as a per-call gRPC deadline. */
    public static long remainingMs(long deadlineNanos, long capMs) {
        long ms = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        return Math.max(1L, Math.min(ms, capMs));
    }
}
