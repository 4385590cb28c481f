package hierfed.server.authority;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import hierfed.common.abe.AttributeKeys;
import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Domains;
import hierfed.common.crypto.KeyFiles;
import hierfed.common.error.RegistrationRejectedException;
import hierfed.common.error.RegistrationRejectedException.Reason;
import hierfed.common.pow.ProofOfWork;
import hierfed.common.util.Hex;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.proto.AttributeKey;
import hierfed.proto.AttributeKeyBundle;
import hierfed.proto.Challenge;
import hierfed.proto.IdentityCertificate;
import hierfed.proto.IdentityList;
import hierfed.proto.KeyRefreshRequest;
import hierfed.proto.PolicyKeysRequest;
import hierfed.proto.RegistrationReply;
import hierfed.proto.RegistrationRequest;
import hierfed.proto.SignedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The authority's book of identities. Issues proof-of-work challenges, admits facilities,
 * hands out epoch-bound attribute keys and rotates the epoch on revocation.
 */
public final class IdentityRegistry {
    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);
    private static final int CHALLENGE_BYTES = 16;

    record Identity(String facilityId, PublicKey publicKey, List<String> attributes, SignedMessage certificate) {}

    private final String authorityId;
    private final PrivateKey sk;
    private final DeploymentConfig cfg;
    private final KeyRegistry keys;
    private final AttributeKeys attributeKeys;
    private final SecureRandom rng;

    private final Map<String, byte[]> pendingChallenges = new HashMap<>();
    private final Set<String> usedProofs = new HashSet<>();
    private final Map<String, Identity> identities = new LinkedHashMap<>();
    private final Set<String> revoked = new TreeSet<>();
    private long epoch = 1L;

    public IdentityRegistry(String authorityId, PrivateKey sk, DeploymentConfig cfg, KeyRegistry keys,
                            AttributeKeys attributeKeys, SecureRandom rng) {
        this.authorityId = authorityId;
        this.sk = sk;
        this.cfg = cfg;
        this.keys = keys;
        this.attributeKeys = attributeKeys;
        this.rng = rng;
    }

    /** A fresh one-time challenge; replaces any earlier unanswered one for the same facility. */
    public synchronized Challenge issueChallenge(String facilityId) {
        byte[] c = new byte[CHALLENGE_BYTES];
        rng.nextBytes(c);
        pendingChallenges.put(facilityId, c);
        log.debug("Issued challenge {} to {}", Hex.shortHex(c, 12), facilityId);
        return Challenge.newBuilder()
                .setFacilityId(facilityId)
                .setChallenge(ByteString.copyFrom(c))
                .setDifficultyBits(cfg.protocol.powDifficultyBits)
                .build();
    }

    /**
     * Admits a facility. The request must be signed with the key it carries.
     *
     * @throws RegistrationRejectedException on a bad, reused or unsolicited proof, a duplicate id
     *                                       or undeclared attributes
     */
    public synchronized RegistrationReply register(SignedMessage env) throws RegistrationRejectedException, GeneralSecurityException {
        RegistrationRequest req;
        try {
            req = RegistrationRequest.parseFrom(env.getPayload());
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("bad registration payload: " + e.getMessage());
        }
        String id = req.getFacilityId();
        PublicKey pk = KeyFiles.publicKeyFromDer(req.getPublicKey().toByteArray());
        var decoded = MessageDecoder.decode(env, MessageTypes.REGISTRATION_REQUEST, Domains.REGISTRATION, pk, RegistrationRequest.parser());
        if (!decoded.ok() || !env.getSignerId().equals(id)) {
            throw new RegistrationRejectedException(Reason.INVALID_PROOF, "registration not signed by the enclosed key for " + id);
        }

        byte[] challenge = req.getChallenge().toByteArray();
        String proofKey = Hex.toHex(challenge) + ":" + req.getNonce();
        if (usedProofs.contains(proofKey)) {
            throw new RegistrationRejectedException(Reason.REUSED_PROOF, "proof already consumed");
        }
        if (identities.containsKey(id)) {
            throw new RegistrationRejectedException(Reason.DUPLICATE_ID, "facility " + id + " already registered");
        }
        byte[] expected = pendingChallenges.get(id);
        if (expected == null || !java.util.Arrays.equals(expected, challenge)) {
            throw new RegistrationRejectedException(Reason.UNKNOWN_CHALLENGE, "no outstanding challenge matches for " + id);
        }
        List<String> attrs = new ArrayList<>(new TreeSet<>(req.getAttributesList()));
        if (attrs.isEmpty()) {
            throw new RegistrationRejectedException(Reason.INVALID_ATTRIBUTES, "no attributes declared");
        }
        for (String a : attrs) {
            if (!cfg.protocol.attributeUniverse.contains(a)) {
                throw new RegistrationRejectedException(Reason.INVALID_ATTRIBUTES, "attribute '" + a + "' not in universe");
            }
        }
        if (!ProofOfWork.verify(id, challenge, req.getNonce(), cfg.protocol.powDifficultyBits)) {
            throw new RegistrationRejectedException(Reason.INVALID_PROOF, "hash above target for " + id);
        }

        pendingChallenges.remove(id);
        usedProofs.add(proofKey);
        IdentityCertificate cert = IdentityCertificate.newBuilder()
                .setFacilityId(id)
                .setPublicKey(req.getPublicKey())
                .addAllAttributes(attrs)
                .setIssuedAtMs(System.currentTimeMillis())
                .build();
        SignedMessage signedCert = SignedMessagePacker.pack(Domains.CERTIFICATE, MessageTypes.IDENTITY_CERTIFICATE, cert, authorityId, 0L, sk);
        identities.put(id, new Identity(id, pk, attrs, signedCert));
        log.info("Registered facility {} attributes={} epoch={}", id, attrs, epoch);
        return RegistrationReply.newBuilder()
                .setCertificate(signedCert)
                .setKeys(bundle(id, attrs))
                .build();
    }

    /** Current-epoch keys for a registered, non-revoked facility. */
    public synchronized AttributeKeyBundle refreshKeys(SignedMessage env) throws RegistrationRejectedException, GeneralSecurityException {
        Identity ident = identities.get(env.getSignerId());
        if (ident == null) {
            throw new RegistrationRejectedException(Reason.UNKNOWN_CHALLENGE, "unknown facility " + env.getSignerId());
        }
        var decoded = MessageDecoder.decode(env, MessageTypes.KEY_REFRESH_REQUEST, Domains.KEY_REFRESH, ident.publicKey(), KeyRefreshRequest.parser());
        if (!decoded.ok()) {
            throw new RegistrationRejectedException(Reason.INVALID_PROOF, "refresh request: " + decoded.validation().reason());
        }
        if (revoked.contains(ident.facilityId())) {
            throw new RegistrationRejectedException(Reason.REVOKED, "facility " + ident.facilityId() + " is revoked");
        }
        log.info("Refreshed keys for {} from epoch {} to {}", ident.facilityId(), decoded.message().getKnownEpoch(), epoch);
        return bundle(ident.facilityId(), ident.attributes());
    }

    /** Marks the facility revoked and advances the key epoch. Returns false if it was not active. */
    public synchronized boolean revoke(String facilityId, String reason) {
        if (!identities.containsKey(facilityId) || revoked.contains(facilityId)) return false;
        revoked.add(facilityId);
        epoch++;
        log.warn("Revoked facility {} ({}); attribute key epoch now {}", facilityId, reason, epoch);
        return true;
    }

    public synchronized IdentityList listIdentities() {
        IdentityList.Builder b = IdentityList.newBuilder().setEpoch(epoch).addAllRevoked(revoked);
        for (Identity ident : identities.values()) {
            if (!revoked.contains(ident.facilityId())) b.addCertificates(ident.certificate());
        }
        return b.build();
    }

    /** Every attribute key of the current epoch, for the leader to encrypt under the access policy. */
    public synchronized AttributeKeyBundle policyKeys(SignedMessage env) throws GeneralSecurityException {
        var decoded = MessageDecoder.decode(env, MessageTypes.POLICY_KEYS_REQUEST, Domains.POLICY_KEYS,
                keys, KeyRegistry.Role.LEADER, PolicyKeysRequest.parser());
        if (!decoded.ok()) {
            throw new SecurityException(decoded.validation().code() + ": " + decoded.validation().reason());
        }
        return bundle(decoded.signerId(), cfg.protocol.attributeUniverse);
    }

    public synchronized long epoch() { return epoch; }

    public synchronized int registeredCount() { return identities.size() - revoked.size(); }

    private AttributeKeyBundle bundle(String holder, Collection<String> attrs) throws GeneralSecurityException {
        AttributeKeyBundle.Builder b = AttributeKeyBundle.newBuilder().setHolderId(holder).setEpoch(epoch);
        for (var e : attributeKeys.keysFor(attrs, epoch).entrySet()) {
            b.addKeys(AttributeKey.newBuilder().setAttribute(e.getKey()).setKey(ByteString.copyFrom(e.getValue())));
        }
        return b.build();
    }
}
