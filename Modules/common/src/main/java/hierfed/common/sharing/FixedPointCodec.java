package hierfed.common.sharing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Maps real coordinates into the field and back. A value v becomes round(v * 2^bits);
 * negatives wrap to p - |v|. Decoding treats anything above p/2 as negative.
 * <p>
 * Encoded magnitudes stay below p / 2^{@value #SUM_HEADROOM_BITS}, so sums of up to
 * 2^{@value #SUM_HEADROOM_BITS} encoded values still decode with the right sign.
 */
public final class FixedPointCodec {
    static final int SUM_HEADROOM_BITS = 20;

    private final PrimeField field;
    private final int fractionalBits;
    private final double scale;
    private final BigDecimal exactScale;
    private final BigInteger half;
    private final BigInteger limit;

    public FixedPointCodec(PrimeField field, int fractionalBits) {
        this.field = field;
        this.fractionalBits = fractionalBits;
        this.scale = Math.scalb(1.0, fractionalBits);
        this.exactScale = new BigDecimal(BigInteger.ONE.shiftLeft(fractionalBits));
        this.half = field.modulus().shiftRight(1);
        this.limit = half.shiftRight(SUM_HEADROOM_BITS);
    }

    public int fractionalBits() { return fractionalBits; }

    /** @throws IllegalArgumentException if v is not finite or too large for the field */
    public BigInteger encode(double v) {
        if (!Double.isFinite(v)) throw new IllegalArgumentException("cannot encode non-finite value " + v);
        BigInteger scaled = new BigDecimal(v).multiply(exactScale).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
        if (scaled.abs().compareTo(limit) >= 0) {
            throw new IllegalArgumentException("value " + v + " out of range at " + fractionalBits + " fractional bits");
        }
        return field.reduce(scaled);
    }

    /** Largest magnitude {@link #encode(double)} accepts, exclusive. */
    public double maxMagnitude() {
        return limit.doubleValue() / scale;
    }

    public BigInteger[] encode(double[] v) {
        BigInteger[] out = new BigInteger[v.length];
        for (int i = 0; i < v.length; i++) out[i] = encode(v[i]);
        return out;
    }

    public double decode(BigInteger x) {
        BigInteger r = field.reduce(x);
        if (r.compareTo(half) > 0) r = r.subtract(field.modulus());
        return r.doubleValue() / scale;
    }

    public double[] decode(BigInteger[] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = decode(x[i]);
        return out;
    }
}
