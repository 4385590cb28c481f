package hierfed.common.privacy;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * (epsilon, delta) Gaussian mechanism over update vectors. The update is first clipped to
 * L2 norm {@code clipNorm}, which bounds the sensitivity, then every coordinate receives
 * independent N(0, sigma^2) noise with sigma = sqrt(2 ln(1.25/delta)) * clipNorm / epsilon.
 */
public final class GaussianMechanism {
    private final double epsilon;
    private final double delta;
    private final double clipNorm;
    private final double sigma;
    private final NormalDistribution noise;

    public GaussianMechanism(double epsilon, double delta, double clipNorm, RandomGenerator rng) {
        if (!(epsilon > 0)) throw new IllegalArgumentException("epsilon must be > 0");
        if (!(delta > 0 && delta < 1)) throw new IllegalArgumentException("delta must be in (0, 1)");
        if (!(clipNorm > 0)) throw new IllegalArgumentException("clipNorm must be > 0");
        this.epsilon = epsilon;
        this.delta = delta;
        this.clipNorm = clipNorm;
        this.sigma = calibrate(epsilon, delta, clipNorm);
        this.noise = new NormalDistribution(rng, 0.0, sigma,
                NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
    }

    public static double calibrate(double epsilon, double delta, double sensitivity) {
        return FastMath.sqrt(2.0 * FastMath.log(1.25 / delta)) * sensitivity / epsilon;
    }

    public double sigma() { return sigma; }
    public double epsilon() { return epsilon; }
    public double delta() { return delta; }

    /** Scales {@code update} down to norm {@code clipNorm} when it exceeds it. Returns a copy. */
    public double[] clip(double[] update) {
        double norm = l2Norm(update);
        double[] out = update.clone();
        if (norm > clipNorm) {
            double factor = clipNorm / norm;
            for (int i = 0; i < out.length; i++) out[i] *= factor;
        }
        return out;
    }

    public double[] privatize(double[] update) {
        double[] out = clip(update);
        for (int i = 0; i < out.length; i++) out[i] += noise.sample();
        return out;
    }

    public static double l2Norm(double[] v) {
        double s = 0.0;
        for (double x : v) s += x * x;
        return FastMath.sqrt(s);
    }
}
