package hierfed.facility;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/** Local data wire form: consecutive records of {@code dimension} little-endian float64 values. */
public final class RecordCodec {
    private RecordCodec() {}

    /** @throws IllegalArgumentException if the length is not a whole number of records or a value is not finite */
    public static List<double[]> decode(byte[] data, int dimension) {
        int recordBytes = Double.BYTES * dimension;
        if (data.length % recordBytes != 0) {
            throw new IllegalArgumentException("local data of " + data.length + " bytes is not a multiple of "
                    + recordBytes + " (" + dimension + " float64 values)");
        }
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        List<double[]> out = new ArrayList<>(data.length / recordBytes);
        while (buf.hasRemaining()) {
            double[] rec = new double[dimension];
            for (int i = 0; i < dimension; i++) {
                rec[i] = buf.getDouble();
                if (!Double.isFinite(rec[i])) throw new IllegalArgumentException("non-finite value in record " + out.size());
            }
            out.add(rec);
        }
        return out;
    }

    public static byte[] encode(List<double[]> records) {
        int n = records.isEmpty() ? 0 : records.get(0).length;
        ByteBuffer buf = ByteBuffer.allocate(records.size() * n * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double[] rec : records) {
            if (rec.length != n) throw new IllegalArgumentException("records of mixed dimension");
            for (double v : rec) buf.putDouble(v);
        }
        return buf.array();
    }
}
