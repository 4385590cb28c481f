package hierfed.facility;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @Test
    void decodesLittleEndianRecords() {
        byte[] data = RecordCodec.encode(List.of(new double[]{1.0, -2.5}, new double[]{0.25, 4.0}));
        assertEquals(32, data.length);
        assertEquals((byte) 0x3F, data[7], "little-endian: exponent byte of 1.0 comes last");

        List<double[]> records = RecordCodec.decode(data, 2);
        assertEquals(2, records.size());
        assertArrayEquals(new double[]{0.25, 4.0}, records.get(1));
    }

    @Test
    void emptyDataIsNoRecords() {
        assertTrue(RecordCodec.decode(new byte[0], 3).isEmpty());
    }

    @Test
    void partialRecordIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode(new byte[20], 2));
        assertTrue(e.getMessage().contains("multiple of 16"), e.getMessage());
    }

    @Test
    void nonFiniteValuesAreRejected() {
        byte[] data = RecordCodec.encode(List.of(new double[]{1.0, Double.NaN}));
        assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode(data, 2));
    }

    @Test
    void mixedDimensionsCannotBeEncoded() {
        assertThrows(IllegalArgumentException.class,
                () -> RecordCodec.encode(List.of(new double[]{1.0}, new double[]{1.0, 2.0})));
    }
}
