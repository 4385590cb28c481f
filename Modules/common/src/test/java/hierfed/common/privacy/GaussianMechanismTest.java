package hierfed.common.privacy;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GaussianMechanismTest {

    @Test
    void sigmaFollowsTheClassicCalibration() {
        double expected = Math.sqrt(2.0 * Math.log(1.25 / 1e-5)) * 1.0 / 0.5;
        assertEquals(expected, GaussianMechanism.calibrate(0.5, 1e-5, 1.0), 1e-9);
        GaussianMechanism m = new GaussianMechanism(0.5, 1e-5, 1.0, new Well19937c(1L));
        assertEquals(expected, m.sigma(), 1e-9);
    }

    @Test
    void clipScalesLongVectorsDownToTheNorm() {
        GaussianMechanism m = new GaussianMechanism(1.0, 1e-5, 1.0, new Well19937c(1L));
        double[] clipped = m.clip(new double[]{3.0, 4.0});
        assertEquals(1.0, GaussianMechanism.l2Norm(clipped), 1e-12);
        assertEquals(0.6, clipped[0], 1e-12);

        double[] small = {0.1, 0.2};
        assertArrayEquals(small, m.clip(small), "vectors inside the ball are untouched");
    }

    @Test
    void noiseHasTheCalibratedSpread() {
        GaussianMechanism m = new GaussianMechanism(2.0, 1e-3, 1.0, new Well19937c(42L));
        double[] out = m.privatize(new double[20000]);
        double sum = 0, sq = 0;
        for (double v : out) {
            sum += v;
            sq += v * v;
        }
        double mean = sum / out.length;
        double std = Math.sqrt(sq / out.length - mean * mean);
        assertEquals(0.0, mean, 0.05 * m.sigma() + 0.05);
        assertEquals(m.sigma(), std, 0.05 * m.sigma(), "sample std " + std);
    }

    @Test
    void rejectsBadParameters() {
        assertThrows(IllegalArgumentException.class, () -> new GaussianMechanism(0.0, 1e-5, 1.0, new Well19937c()));
        assertThrows(IllegalArgumentException.class, () -> new GaussianMechanism(1.0, 1.0, 1.0, new Well19937c()));
        assertThrows(IllegalArgumentException.class, () -> new GaussianMechanism(1.0, 1e-5, -1.0, new Well19937c()));
    }
}
