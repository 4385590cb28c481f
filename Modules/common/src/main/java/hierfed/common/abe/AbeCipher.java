package hierfed.common.abe;

import com.google.protobuf.ByteString;
import hierfed.common.crypto.Digests;
import hierfed.common.error.AccessDeniedException;
import hierfed.proto.AbeCiphertext;
import hierfed.proto.WrappedKey;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ciphertext-policy encryption contract. The payload is sealed under a fresh AES-GCM data key;
 * that data key is wrapped once per clause of the policy's disjunctive normal form, under a
 * key-encryption key derived from the attribute keys of every attribute in the clause. A holder
 * can unwrap iff it holds all attribute keys of at least one clause for the ciphertext's epoch.
 * <p>
 * Holders of disjoint attribute sets pooling their keys can satisfy a clause neither satisfies
 * alone; collusion resistance is outside this contract.
 */
public final class AbeCipher {
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecureRandom rng;

    public AbeCipher(SecureRandom rng) {
        this.rng = rng;
    }

    /**
     * @param epochKeys attribute keys for {@code epoch}, covering every attribute in the policy
     */
    public AbeCiphertext encrypt(AccessPolicy policy, long epoch, Map<String, byte[]> epochKeys, byte[] plaintext)
            throws GeneralSecurityException {
        byte[] dataKey = new byte[32];
        rng.nextBytes(dataKey);
        byte[] iv = randomIv();
        byte[] sealed = aesGcm(Cipher.ENCRYPT_MODE, dataKey, iv, header(policy.source(), epoch), plaintext);

        AbeCiphertext.Builder ct = AbeCiphertext.newBuilder()
                .setPolicy(policy.source())
                .setEpoch(epoch)
                .setIv(ByteString.copyFrom(iv))
                .setCiphertext(ByteString.copyFrom(sealed));
        for (Set<String> clause : policy.clauses()) {
            byte[] kek = clauseKey(clause, epochKeys);
            byte[] wrapIv = randomIv();
            byte[] wrapped = aesGcm(Cipher.ENCRYPT_MODE, kek, wrapIv, clauseLabel(clause, epoch), dataKey);
            ct.addWrappedKeys(WrappedKey.newBuilder()
                    .addAllAttributes(clause)
                    .setIv(ByteString.copyFrom(wrapIv))
                    .setWrapped(ByteString.copyFrom(wrapped)));
        }
        return ct.build();
    }

    /**
     * @param heldKeys  the caller's attribute keys
     * @param heldEpoch the epoch those keys were issued for
     * @throws AccessDeniedException when the keys are from another epoch or satisfy no clause
     */
    public byte[] decrypt(AbeCiphertext ct, Map<String, byte[]> heldKeys, long heldEpoch)
            throws AccessDeniedException, GeneralSecurityException {
        if (ct.getEpoch() != heldEpoch) {
            throw new AccessDeniedException("key epoch " + heldEpoch + " does not match ciphertext epoch " + ct.getEpoch(),
                    heldEpoch < ct.getEpoch());
        }
        AccessPolicy policy = AccessPolicy.parse(ct.getPolicy());
        if (!policy.isSatisfiedBy(heldKeys.keySet())) {
            throw new AccessDeniedException("attributes " + new TreeSet<>(heldKeys.keySet())
                    + " do not satisfy policy " + policy, false);
        }
        for (WrappedKey wk : ct.getWrappedKeysList()) {
            Set<String> clause = new TreeSet<>(wk.getAttributesList());
            if (!heldKeys.keySet().containsAll(clause)) continue;
            byte[] dataKey;
            try {
                dataKey = aesGcm(Cipher.DECRYPT_MODE, clauseKey(clause, heldKeys), wk.getIv().toByteArray(),
                        clauseLabel(clause, ct.getEpoch()), wk.getWrapped().toByteArray());
            } catch (javax.crypto.AEADBadTagException e) {
                throw new AccessDeniedException("attribute keys for " + clause + " were not issued for epoch " + ct.getEpoch(), true);
            }
            return aesGcm(Cipher.DECRYPT_MODE, dataKey, ct.getIv().toByteArray(),
                    header(ct.getPolicy(), ct.getEpoch()), ct.getCiphertext().toByteArray());
        }
        throw new AccessDeniedException("no wrapped key for a satisfied clause of " + policy, false);
    }

    private static byte[] clauseKey(Set<String> clause, Map<String, byte[]> keys) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        buf.writeBytes("HIERFED:KEK".getBytes(StandardCharsets.UTF_8));
        for (String attr : new TreeSet<>(clause)) {
            byte[] k = keys.get(attr);
            if (k == null) throw new IllegalArgumentException("no key for attribute " + attr);
            buf.write(0);
            buf.writeBytes(attr.getBytes(StandardCharsets.UTF_8));
            buf.write(0);
            buf.writeBytes(k);
        }
        return Digests.sha256(buf.toByteArray());
    }

    private static byte[] clauseLabel(Set<String> clause, long epoch) {
        return (String.join(",", List.copyOf(new TreeSet<>(clause))) + "#" + epoch).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] header(String policy, long epoch) {
        return (policy + "#" + epoch).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] randomIv() {
        byte[] iv = new byte[IV_BYTES];
        rng.nextBytes(iv);
        return iv;
    }

    private static byte[] aesGcm(int mode, byte[] key, byte[] iv, byte[] aad, byte[] input) throws GeneralSecurityException {
        Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
        c.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
        c.updateAAD(aad);
        return c.doFinal(input);
    }
}
