package hierfed.common.privacy;

import java.util.function.Supplier;

/**
 * Spends the per-round privacy budget at most once per round. A noised update computed for
 * round r is cached and handed back on re-announcement of r; rounds at or below the last
 * spent round that are not that cached round are refused.
 */
public final class PrivacyAccountant<T> {
    private long spentRound = 0L;
    private T cached;

    /**
     * @return the value for {@code round}, computed at most once; null when the round is older than
     *         the last one spent
     */
    public synchronized T spendOnce(long round, Supplier<T> compute) {
        if (round == spentRound && cached != null) return cached;
        if (round <= spentRound) return null;
        T value = compute.get();
        spentRound = round;
        cached = value;
        return value;
    }

    public synchronized long lastSpentRound() { return spentRound; }
}
