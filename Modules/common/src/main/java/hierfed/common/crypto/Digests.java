package hierfed.common.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

public final class Digests {
    private Digests() {}

    public static byte[] sha256(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    /** Hash of a parameter vector: SHA-256 over the big-endian IEEE-754 encoding of each coordinate. */
    public static byte[] vectorHash(double[] values) {
        ByteBuffer buf = ByteBuffer.allocate(4 + values.length * 8);
        buf.putInt(values.length);
        for (double v : values) buf.putDouble(v);
        return sha256(buf.array());
    }

    public static byte[] vectorHash(List<Double> values) {
        double[] arr = new double[values.size()];
        for (int i = 0; i < arr.length; i++) arr[i] = values.get(i);
        return vectorHash(arr);
    }

    /** Order-independent digest of a set of member ids. */
    public static byte[] idSetDigest(Collection<String> ids) {
        StringBuilder sb = new StringBuilder();
        for (String id : new TreeSet<>(ids)) sb.append(id).append('\n');
        return sha256(sb.toString().getBytes(StandardCharsets.UTF_8));
    }
}
