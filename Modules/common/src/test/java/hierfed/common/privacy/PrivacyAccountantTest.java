package hierfed.common.privacy;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyAccountantTest {

    @Test
    void reannouncedRoundReusesTheSameNoisedValue() {
        PrivacyAccountant<String> accountant = new PrivacyAccountant<>();
        AtomicInteger computed = new AtomicInteger();

        String first = accountant.spendOnce(3, () -> "update-" + computed.incrementAndGet());
        String again = accountant.spendOnce(3, () -> "update-" + computed.incrementAndGet());

        assertEquals("update-1", first);
        assertSame(first, again);
        assertEquals(1, computed.get());
        assertEquals(3, accountant.lastSpentRound());
    }

    @Test
    void olderRoundsAreRefused() {
        PrivacyAccountant<String> accountant = new PrivacyAccountant<>();
        accountant.spendOnce(5, () -> "five");
        assertNull(accountant.spendOnce(4, () -> "four"));
        assertEquals("six", accountant.spendOnce(6, () -> "six"));
        assertNull(accountant.spendOnce(5, () -> "five again"), "round 5 budget is gone once round 6 spent");
    }
}
