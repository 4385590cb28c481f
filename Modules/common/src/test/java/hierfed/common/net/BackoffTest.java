package hierfed.common.net;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BackoffTest {

    @Test
    @SuppressWarnings("unchecked")
    void retriesTransientFailuresUntilSuccess() throws Exception {
        Callable<String> call = mock(Callable.class);
        when(call.call())
                .thenThrow(new StatusRuntimeException(Status.UNAVAILABLE))
                .thenThrow(new StatusRuntimeException(Status.DEADLINE_EXCEEDED))
                .thenReturn("ok");

        String out = Backoff.retryUntil("test", System.nanoTime() + 5_000_000_000L, 1, call);

        assertEquals("ok", out);
        verify(call, times(3)).call();
    }

    @Test
    void nonTransientStatusIsRethrownAtOnce() {
        AtomicInteger attempts = new AtomicInteger();
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class, () ->
                Backoff.retryUntil("test", System.nanoTime() + 5_000_000_000L, 1, () -> {
                    attempts.incrementAndGet();
                    throw new StatusRuntimeException(Status.PERMISSION_DENIED);
                }));
        assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
        assertEquals(1, attempts.get());
    }

    @Test
    void givesUpAtTheDeadline() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(StatusRuntimeException.class, () ->
                Backoff.retryUntil("test", System.nanoTime() + 100_000_000L, 5, () -> {
                    attempts.incrementAndGet();
                    throw new StatusRuntimeException(Status.UNAVAILABLE);
                }));
        assertTrue(attempts.get() >= 2, "attempts=" + attempts.get());
    }

    @Test
    void remainingIsFlooredAndCapped() {
        assertEquals(1L, Backoff.remainingMs(System.nanoTime() - 1_000_000L, 500));
        assertEquals(500L, Backoff.remainingMs(System.nanoTime() + 10_000_000_000L, 500));
    }
}
