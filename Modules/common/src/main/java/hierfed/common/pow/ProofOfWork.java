package hierfed.common.pow;

import hierfed.common.crypto.Digests;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Registration puzzle: SHA-256(facilityId || challenge || nonce), read as an unsigned 256-bit
 * integer, must be below 2^(256 - difficultyBits).
 */
public final class ProofOfWork {
    private ProofOfWork() {}

    public static BigInteger target(int difficultyBits) {
        if (difficultyBits < 0 || difficultyBits > 256) {
            throw new IllegalArgumentException("difficultyBits out of range: " + difficultyBits);
        }
        return BigInteger.ONE.shiftLeft(256 - difficultyBits);
    }

    public static byte[] hash(String facilityId, byte[] challenge, long nonce) {
        byte[] id = facilityId.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(id.length + challenge.length + Long.BYTES);
        buf.put(id).put(challenge).putLong(nonce);
        return Digests.sha256(buf.array());
    }

    public static boolean verify(String facilityId, byte[] challenge, long nonce, int difficultyBits) {
        BigInteger h = new BigInteger(1, hash(facilityId, challenge, nonce));
        return h.compareTo(target(difficultyBits)) < 0;
    }

    /**
     * Searches nonces from 0 upward.
     *
     * @throws IllegalStateException if the thread is interrupted while searching
     */
    public static long solve(String facilityId, byte[] challenge, int difficultyBits) {
        BigInteger target = target(difficultyBits);
        for (long nonce = 0; ; nonce++) {
            if (new BigInteger(1, hash(facilityId, challenge, nonce)).compareTo(target) < 0) return nonce;
            if ((nonce & 0xFFFF) == 0 && Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("proof-of-work search interrupted at nonce " + nonce);
            }
        }
    }
}
