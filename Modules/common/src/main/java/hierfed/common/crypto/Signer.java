package hierfed.common.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.*;

public final class Signer {
    private Signer() {}

    public static byte[] sign(String domain, String typeUrl, byte[] payload, PrivateKey sk)
            throws GeneralSecurityException {
        Signature s = Signature.getInstance("Ed25519");
        s.initSign(sk);
        s.update(signingInput(domain, typeUrl, payload));
        return s.sign();
    }

    public static boolean verify(String domain, String typeUrl, byte[] payload, byte[] signature, PublicKey pk)
            throws GeneralSecurityException {
        Signature s = Signature.getInstance("Ed25519");
        s.initVerify(pk);
        s.update(signingInput(domain, typeUrl, payload));
        return s.verify(signature);
    }

    /** Checks that {@code sk} signs for {@code pk}; used at startup against the configured public key. */
    public static boolean matches(PrivateKey sk, PublicKey pk) throws GeneralSecurityException {
        byte[] probe = new byte[]{1, 2, 3};
        byte[] sig = sign("HIERFED:PROBE", "probe", probe, sk);
        return verify("HIERFED:PROBE", "probe", probe, sig, pk);
    }

    // domain || 0 || typeUrl || 0 || payload
    private static byte[] signingInput(String domain, String typeUrl, byte[] payload) {
        byte[] d = domain.getBytes(StandardCharsets.UTF_8);
        byte[] t = typeUrl.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(d.length + 1 + t.length + 1 + payload.length);
        buf.put(d).put((byte) 0).put(t).put((byte) 0).put(payload);
        return buf.array();
    }
}
