package hierfed.common.sharing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShamirSharingTest {
    private PrimeField field;
    private ShamirSharing sharing;
    private FixedPointCodec codec;

    @BeforeEach
    void setUp() {
        field = PrimeField.standard();
        sharing = new ShamirSharing(field, 2, new SecureRandom());
        codec = new FixedPointCodec(field, 24);
    }

    @Test
    void anyThresholdSubsetReconstructsTheSecret() {
        BigInteger[] secret = codec.encode(new double[]{1.5, -2.25, 0.0, 1000.125});
        List<VectorShare> shares = sharing.split(secret, new int[]{1, 2, 3});

        int[][] subsets = {{0, 1}, {0, 2}, {1, 2}, {2, 0}};
        for (int[] subset : subsets) {
            List<VectorShare> picked = List.of(shares.get(subset[0]), shares.get(subset[1]));
            assertArrayEquals(secret, sharing.reconstruct(picked), "subset " + subset[0] + "," + subset[1]);
        }
    }

    @Test
    void sumsOfSharesReconstructTheSumOfSecrets() {
        double[][] updates = {{0.5, -1.0}, {0.25, 2.0}, {-0.125, 0.5}};
        int[] points = {1, 2, 3};
        List<List<VectorShare>> byFacility = new ArrayList<>();
        for (double[] u : updates) byFacility.add(sharing.split(codec.encode(u), points));

        List<VectorShare> partials = new ArrayList<>();
        for (int j = 0; j < points.length; j++) {
            List<VectorShare> atPoint = new ArrayList<>();
            for (List<VectorShare> shares : byFacility) atPoint.add(shares.get(j));
            partials.add(sharing.sum(points[j], atPoint, 2));
        }

        double[] total = codec.decode(sharing.reconstruct(partials.subList(1, 3)));
        assertEquals(0.625, total[0], 1e-6);
        assertEquals(1.5, total[1], 1e-6);
    }

    @Test
    void singleShareBelowThresholdIsRefused() {
        List<VectorShare> shares = sharing.split(codec.encode(new double[]{3.0}), new int[]{1, 2});
        assertThrows(IllegalArgumentException.class, () -> sharing.reconstruct(shares.subList(0, 1)));
    }

    @Test
    void splitRejectsBadPoints() {
        BigInteger[] secret = codec.encode(new double[]{1.0});
        assertThrows(IllegalArgumentException.class, () -> sharing.split(secret, new int[]{1}));
        assertThrows(IllegalArgumentException.class, () -> sharing.split(secret, new int[]{0, 1}));
        assertThrows(IllegalArgumentException.class, () -> sharing.split(secret, new int[]{2, 2}));
    }

    @Test
    void sumRefusesSharesFromAnotherPoint() {
        List<VectorShare> shares = sharing.split(codec.encode(new double[]{1.0}), new int[]{1, 2});
        assertThrows(IllegalArgumentException.class, () -> sharing.sum(1, shares, 1));
    }
}
