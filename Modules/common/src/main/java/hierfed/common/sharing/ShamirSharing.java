package hierfed.common.sharing;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shamir (t, n) sharing of field vectors. Each coordinate gets an independent random
 * polynomial of degree t-1 whose constant term is the coordinate; share j is the
 * evaluation at the fixed public point x_j.
 */
public final class ShamirSharing {
    private final PrimeField field;
    private final int threshold;
    private final SecureRandom rng;

    public ShamirSharing(PrimeField field, int threshold, SecureRandom rng) {
        if (threshold < 1) throw new IllegalArgumentException("threshold t must be at least 1");
        this.field = field;
        this.threshold = threshold;
        this.rng = rng;
    }

    public int threshold() { return threshold; }

    /**
     * Splits {@code secret} into one share per evaluation point.
     *
     * @param points distinct, non-zero evaluation points; at least t of them
     */
    public List<VectorShare> split(BigInteger[] secret, int[] points) {
        if (points.length < threshold) {
            throw new IllegalArgumentException("need at least t=" + threshold + " points, got " + points.length);
        }
        Set<Integer> seen = new HashSet<>();
        for (int x : points) {
            if (x <= 0) throw new IllegalArgumentException("evaluation point must be positive: " + x);
            if (!seen.add(x)) throw new IllegalArgumentException("duplicate evaluation point: " + x);
        }
        BigInteger[][] values = new BigInteger[points.length][secret.length];
        BigInteger[] coefficients = new BigInteger[threshold];
        for (int c = 0; c < secret.length; c++) {
            coefficients[0] = field.reduce(secret[c]);
            for (int k = 1; k < threshold; k++) coefficients[k] = field.random(rng);
            for (int j = 0; j < points.length; j++) {
                values[j][c] = evaluate(coefficients, BigInteger.valueOf(points[j]));
            }
        }
        List<VectorShare> shares = new ArrayList<>(points.length);
        for (int j = 0; j < points.length; j++) shares.add(new VectorShare(points[j], values[j]));
        return shares;
    }

    // Horner
    private BigInteger evaluate(BigInteger[] coefficients, BigInteger x) {
        BigInteger acc = coefficients[coefficients.length - 1];
        for (int k = coefficients.length - 2; k >= 0; k--) {
            acc = field.add(field.mul(acc, x), coefficients[k]);
        }
        return acc;
    }

    /**
     * Coordinate-wise sum of shares taken at the same point. By linearity the result is a
     * share of the sum of the underlying secrets.
     */
    public VectorShare sum(int x, Collection<VectorShare> shares, int dimension) {
        BigInteger[] acc = new BigInteger[dimension];
        java.util.Arrays.fill(acc, BigInteger.ZERO);
        for (VectorShare s : shares) {
            if (s.x() != x) throw new IllegalArgumentException("share at x=" + s.x() + " cannot join sum at x=" + x);
            if (s.dimension() != dimension) {
                throw new IllegalArgumentException("share dimension " + s.dimension() + " != " + dimension);
            }
            for (int c = 0; c < dimension; c++) acc[c] = field.add(acc[c], s.values()[c]);
        }
        return new VectorShare(x, acc);
    }

    /**
     * Lagrange interpolation at 0 from the first t shares given.
     *
     * @throws IllegalArgumentException with fewer than t shares, mixed dimensions or repeated points
     */
    public BigInteger[] reconstruct(List<VectorShare> shares) {
        if (shares.size() < threshold) {
            throw new IllegalArgumentException("need t=" + threshold + " shares, got " + shares.size());
        }
        List<VectorShare> used = shares.subList(0, threshold);
        int dimension = used.get(0).dimension();
        BigInteger[] basis = lagrangeAtZero(used);
        BigInteger[] out = new BigInteger[dimension];
        for (int c = 0; c < dimension; c++) {
            BigInteger acc = BigInteger.ZERO;
            for (int i = 0; i < used.size(); i++) {
                VectorShare s = used.get(i);
                if (s.dimension() != dimension) throw new IllegalArgumentException("mixed share dimensions");
                acc = field.add(acc, field.mul(s.values()[c], basis[i]));
            }
            out[c] = acc;
        }
        return out;
    }

    // l_i(0) = prod_{j != i} (-x_j) / (x_i - x_j)
    private BigInteger[] lagrangeAtZero(List<VectorShare> shares) {
        BigInteger[] basis = new BigInteger[shares.size()];
        for (int i = 0; i < shares.size(); i++) {
            BigInteger xi = BigInteger.valueOf(shares.get(i).x());
            BigInteger num = BigInteger.ONE;
            BigInteger den = BigInteger.ONE;
            for (int j = 0; j < shares.size(); j++) {
                if (i == j) continue;
                BigInteger xj = BigInteger.valueOf(shares.get(j).x());
                if (xi.equals(xj)) throw new IllegalArgumentException("repeated evaluation point " + xi);
                num = field.mul(num, xj.negate());
                den = field.mul(den, xi.subtract(xj));
            }
            basis[i] = field.mul(num, field.inverse(den));
        }
        return basis;
    }
}
