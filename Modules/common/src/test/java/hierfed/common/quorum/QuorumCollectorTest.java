package hierfed.common.quorum;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QuorumCollectorTest {

    @Test
    void firstValueFromASenderWins() {
        QuorumCollector<String> c = new QuorumCollector<>();
        assertEquals(QuorumCollector.Offer.ACCEPTED, c.offer("v1", "accept"));
        assertEquals(QuorumCollector.Offer.DUPLICATE, c.offer("v1", "reject"));
        assertEquals(Map.of("v1", "accept"), c.close());
        assertEquals(QuorumCollector.Offer.CLOSED, c.offer("v2", "accept"));
    }

    @Test
    void awaitReturnsAsSoonAsTheCountIsReached() throws Exception {
        QuorumCollector<Integer> c = new QuorumCollector<>();
        CompletableFuture<Map<String, Integer>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return c.awaitCount(2, QuorumCollector.deadlineAfter(10_000));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        c.offer("a", 1);
        c.offer("b", 2);
        Map<String, Integer> got = waiter.get(5, TimeUnit.SECONDS);
        assertEquals(2, got.size());
    }

    @Test
    void awaitGivesUpAtTheDeadline() throws Exception {
        QuorumCollector<Integer> c = new QuorumCollector<>();
        c.offer("a", 1);
        long start = System.nanoTime();
        Map<String, Integer> got = c.awaitCount(3, QuorumCollector.deadlineAfter(100));
        assertEquals(1, got.size());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
    }

    @Test
    void closeReleasesWaiters() throws Exception {
        QuorumCollector<Integer> c = new QuorumCollector<>();
        CompletableFuture<Map<String, Integer>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return c.awaitCount(5, QuorumCollector.deadlineAfter(30_000));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        c.close();
        assertTrue(waiter.get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void predicateOverCollectedValues() throws Exception {
        QuorumCollector<Boolean> votes = new QuorumCollector<>();
        votes.offer("v1", false);
        votes.offer("v2", false);
        Map<String, Boolean> got = votes.await(m -> m.values().stream().filter(v -> !v).count() >= 2,
                QuorumCollector.deadlineAfter(10_000));
        assertEquals(2, got.size());
    }
}
