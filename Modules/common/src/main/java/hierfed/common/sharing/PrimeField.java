package hierfed.common.sharing;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Arithmetic modulo a fixed prime. All share values, partial sums and interpolation
 * coefficients live in this field.
 */
public final class PrimeField {
    /** The Mersenne prime 2^127 - 1. */
    public static final BigInteger DEFAULT_PRIME = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

    private final BigInteger p;

    public PrimeField(BigInteger p) {
        if (p.signum() <= 0 || !p.isProbablePrime(64)) {
            throw new IllegalArgumentException("modulus must be a positive prime");
        }
        this.p = p;
    }

    public static PrimeField standard() {
        return new PrimeField(DEFAULT_PRIME);
    }

    public BigInteger modulus() { return p; }

    public BigInteger reduce(BigInteger a) { return a.mod(p); }

    public BigInteger add(BigInteger a, BigInteger b) { return a.add(b).mod(p); }

    public BigInteger sub(BigInteger a, BigInteger b) { return a.subtract(b).mod(p); }

    public BigInteger mul(BigInteger a, BigInteger b) { return a.multiply(b).mod(p); }

    /** @throws ArithmeticException if {@code a} is zero mod p */
    public BigInteger inverse(BigInteger a) { return a.mod(p).modInverse(p); }

    /** Uniform element of [0, p). */
    public BigInteger random(SecureRandom rng) {
        BigInteger r;
        do {
            r = new BigInteger(p.bitLength(), rng);
        } while (r.compareTo(p) >= 0);
        return r;
    }

    public boolean contains(BigInteger a) {
        return a.signum() >= 0 && a.compareTo(p) < 0;
    }
}
