package hierfed.common.abe;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derivation of attribute keys from the authority's master secret. A key is bound to one
 * attribute and one epoch; rotating the epoch invalidates every key issued before it.
 */
public final class AttributeKeys {
    private final byte[] masterSecret;

    public AttributeKeys(byte[] masterSecret) {
        if (masterSecret.length < 16) throw new IllegalArgumentException("master secret too short");
        this.masterSecret = masterSecret.clone();
    }

    public byte[] keyFor(String attribute, long epoch) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(masterSecret, "HmacSHA256"));
        byte[] attr = attribute.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(Long.BYTES + 1 + attr.length);
        buf.putLong(epoch).put((byte) 0).put(attr);
        return mac.doFinal(buf.array());
    }

    public Map<String, byte[]> keysFor(Collection<String> attributes, long epoch) throws GeneralSecurityException {
        Map<String, byte[]> out = new LinkedHashMap<>();
        for (String a : attributes) out.put(a, keyFor(a, epoch));
        return out;
    }
}
