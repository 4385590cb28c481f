package hierfed.common.sharing;

import com.google.protobuf.ByteString;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * The evaluation of one sharing polynomial per coordinate at point {@code x}.
 * Used both for a single facility's share and for a fog node's partial sum.
 */
public record VectorShare(int x, BigInteger[] values) {

    public int dimension() { return values.length; }

    public List<ByteString> toWire() {
        List<ByteString> out = new ArrayList<>(values.length);
        for (BigInteger v : values) out.add(ByteString.copyFrom(v.toByteArray()));
        return out;
    }

    public static VectorShare fromWire(int x, List<ByteString> wire) {
        BigInteger[] values = new BigInteger[wire.size()];
        for (int i = 0; i < values.length; i++) values[i] = new BigInteger(wire.get(i).toByteArray());
        return new VectorShare(x, values);
    }
}
