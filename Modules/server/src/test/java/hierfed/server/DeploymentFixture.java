package hierfed.server;

import com.google.protobuf.ByteString;
import com.google.protobuf.MessageLite;
import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Domains;
import hierfed.common.crypto.KeyFiles;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.IdentityCertificate;
import hierfed.proto.SignedMessage;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** A small in-memory deployment: ta, leader, fog1-3 (t=2), v1-v4 and facilities f1-f4, all with fresh keys. */
public final class DeploymentFixture {
    public final DeploymentConfig cfg = new DeploymentConfig();
    public final KeyRegistry keys = new KeyRegistry();
    private final Map<String, KeyPair> pairs = new HashMap<>();

    public DeploymentFixture() throws GeneralSecurityException {
        cfg.authority = new DeploymentConfig.Member("ta", "127.0.0.1", 7600);
        cfg.leader = new DeploymentConfig.Member("leader", "127.0.0.1", 7650);
        for (int i = 1; i <= 3; i++) cfg.fogNodes.add(new DeploymentConfig.FogMember("fog" + i, "127.0.0.1", 8600 + i, i));
        for (int i = 1; i <= 4; i++) cfg.validators.add(new DeploymentConfig.Member("v" + i, "127.0.0.1", 8700 + i));
        for (int i = 1; i <= 4; i++) {
            String region = i <= 2 ? "region:X" : "region:Y";
            cfg.facilities.add(new DeploymentConfig.FacilityMember("f" + i, "127.0.0.1", 9600 + i, List.of("facility", region)));
        }
        cfg.protocol.modelDimension = 2;
        cfg.protocol.powDifficultyBits = 6;
        cfg.protocol.accessPolicy = "facility AND (region:X OR region:Y)";
        cfg.validate();

        keys.put(KeyRegistry.Role.AUTHORITY, "ta", pair("ta").getPublic());
        keys.put(KeyRegistry.Role.LEADER, "leader", pair("leader").getPublic());
        for (var fog : cfg.fogNodes) keys.put(KeyRegistry.Role.FOG, fog.id, pair(fog.id).getPublic());
        for (var v : cfg.validators) keys.put(KeyRegistry.Role.VALIDATOR, v.id, pair(v.id).getPublic());
        for (var f : cfg.facilities) pair(f.id);
    }

    public KeyPair pair(String id) throws GeneralSecurityException {
        KeyPair kp = pairs.get(id);
        if (kp == null) {
            kp = KeyFiles.generateKeyPair();
            pairs.put(id, kp);
        }
        return kp;
    }

    public RpcSupport.NodeInfo node(String id) throws GeneralSecurityException {
        return new RpcSupport.NodeInfo(id, cfg, pair(id).getPrivate(), keys);
    }

    public SignedMessage sign(String domain, String typeUrl, MessageLite msg, String signer, long round)
            throws GeneralSecurityException {
        return SignedMessagePacker.pack(domain, typeUrl, msg, signer, round, pair(signer).getPrivate());
    }

    /** An authority-signed certificate for a facility, as registration would issue it. */
    public SignedMessage certificate(String facilityId) throws GeneralSecurityException {
        IdentityCertificate cert = IdentityCertificate.newBuilder()
                .setFacilityId(facilityId)
                .setPublicKey(ByteString.copyFrom(pair(facilityId).getPublic().getEncoded()))
                .addAllAttributes(cfg.facility(facilityId).orElseThrow().attributes)
                .build();
        return sign(Domains.CERTIFICATE, MessageTypes.IDENTITY_CERTIFICATE, cert, "ta", 0L);
    }

    public CertifiedMessage certified(String domain, String typeUrl, MessageLite msg, String facilityId, long round)
            throws GeneralSecurityException {
        return CertifiedMessage.newBuilder()
                .setMessage(sign(domain, typeUrl, msg, facilityId, round))
                .setCertificate(certificate(facilityId))
                .build();
    }
}
