package hierfed.common.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import hierfed.common.abe.AccessPolicy;
import hierfed.common.validation.VoteCertificateValidator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of one deployment: every member's address and public key plus the protocol
 * tunables. Loaded once per process and handed to each component's constructor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentConfig {
    public Member authority;
    public Member leader;
    public List<FogMember> fogNodes = new ArrayList<>();
    public List<Member> validators = new ArrayList<>();
    public List<FacilityMember> facilities = new ArrayList<>();
    public Protocol protocol = new Protocol();
    public Timeouts timeouts = new Timeouts();
    /** Directory for persisted global model versions; blank keeps them in memory only. */
    public String modelStoreDir;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Member {
        public String id;
        public String host = "127.0.0.1";
        public int port;
        @JsonAlias({"pubkeyPemPath", "publicKeyPath"})
        public String publicKeyPath;

        public Member() {}

        public Member(String id, String host, int port) {
            this.id = id;
            this.host = host;
            this.port = port;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FogMember extends Member {
        /** Shamir evaluation point assigned to this fog node, fixed for the deployment. */
        public int index;

        public FogMember() {}

        public FogMember(String id, String host, int port, int index) {
            super(id, host, port);
            this.index = index;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FacilityMember extends Member {
        public List<String> attributes = new ArrayList<>();

        public FacilityMember() {}

        public FacilityMember(String id, String host, int port, List<String> attributes) {
            super(id, host, port);
            this.attributes = new ArrayList<>(attributes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Protocol {
        /** Reconstruction threshold t. */
        public int threshold = 2;
        /** f, the number of Byzantine validators tolerated. */
        public int maxByzantine = 1;
        public int minParticipants = 2;
        public int powDifficultyBits = 16;
        public int fixedPointBits = 24;
        public int modelDimension = 8;
        public double maxAbsCoordinate = 1.0e3;
        /** Bound on the L2 distance between the candidate and the previous model. */
        @JsonAlias("maxUpdateDistance")
        public double maxUpdateNorm = 10.0;
        public String accessPolicy = "facility AND region:X";
        public List<String> attributeUniverse = new ArrayList<>(List.of("facility", "region:X", "region:Y"));
        public Privacy privacy = new Privacy();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Privacy {
        public double epsilon = 1.0;
        public double delta = 1e-5;
        public double clipNorm = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeouts {
        public long collectionMs = 5000;
        /** Secondary deadline for fog partial sums once collection closes. */
        public long fogMs = 3000;
        public long votingMs = 3000;
        public long broadcastMs = 3000;
        public long readinessMs = 2000;
        public long rpcDeadlineMs = 2000;
        public long retryBaseMs = 50;
    }

    public static DeploymentConfig load(Path path) throws IOException {
        DeploymentConfig cfg = new ObjectMapper().readValue(path.toFile(), DeploymentConfig.class);
        cfg.validate();
        return cfg;
    }

    /**
     * Rejects deployments the protocol cannot run safely on.
     *
     * @throws IllegalStateException naming the first violated constraint
     */
    public void validate() {
        if (authority == null || authority.id == null) throw new IllegalStateException("Config invalid: authority missing");
        if (leader == null || leader.id == null) throw new IllegalStateException("Config invalid: leader missing");
        if (fogNodes == null || fogNodes.isEmpty()) throw new IllegalStateException("Config invalid: fogNodes list empty");
        if (validators == null || validators.isEmpty()) throw new IllegalStateException("Config invalid: validators list empty");
        int n = fogNodes.size();
        int t = protocol.threshold;
        if (t < 1 || t > n) {
            throw new IllegalStateException("Config invalid: threshold t=" + t + " must satisfy 1 <= t <= " + n);
        }
        int f = protocol.maxByzantine;
        if (f < 0 || validators.size() < 3 * f + 1) {
            throw new IllegalStateException("Config invalid: validators=" + validators.size() + " must be >= 3f+1 where f=" + f);
        }
        Set<Integer> indices = new HashSet<>();
        for (FogMember fog : fogNodes) {
            if (fog.index < 1) throw new IllegalStateException("Config invalid: fog " + fog.id + " index must be >= 1");
            if (!indices.add(fog.index)) throw new IllegalStateException("Config invalid: duplicate fog index " + fog.index);
        }
        Set<String> ids = new HashSet<>();
        for (Member m : allMembers()) {
            if (m.id == null || m.id.isBlank()) throw new IllegalStateException("Config invalid: member without id");
            if (!ids.add(m.id)) throw new IllegalStateException("Config invalid: duplicate member id " + m.id);
        }
        if (protocol.minParticipants < 1) throw new IllegalStateException("Config invalid: minParticipants must be >= 1");
        if (protocol.modelDimension < 1) throw new IllegalStateException("Config invalid: modelDimension must be >= 1");
        if (protocol.powDifficultyBits < 0 || protocol.powDifficultyBits > 64) {
            throw new IllegalStateException("Config invalid: powDifficultyBits must be in [0, 64]");
        }
        if (protocol.fixedPointBits < 1 || protocol.fixedPointBits > 52) {
            throw new IllegalStateException("Config invalid: fixedPointBits must be in [1, 52]");
        }
        Privacy p = protocol.privacy;
        if (!(p.epsilon > 0)) throw new IllegalStateException("Config invalid: epsilon must be > 0");
        if (!(p.delta > 0 && p.delta < 1)) throw new IllegalStateException("Config invalid: delta must be in (0, 1)");
        if (!(p.clipNorm > 0)) throw new IllegalStateException("Config invalid: clipNorm must be > 0");
        if (timeouts.collectionMs <= 0 || timeouts.fogMs <= 0 || timeouts.votingMs <= 0
                || timeouts.rpcDeadlineMs <= 0 || timeouts.readinessMs <= 0 || timeouts.broadcastMs <= 0) {
            throw new IllegalStateException("Config invalid: timeouts must be positive");
        }
        AccessPolicy policy;
        try {
            policy = AccessPolicy.parse(protocol.accessPolicy);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Config invalid: accessPolicy: " + e.getMessage());
        }
        for (String attr : policy.attributes()) {
            if (!protocol.attributeUniverse.contains(attr)) {
                throw new IllegalStateException("Config invalid: policy attribute '" + attr + "' not in attributeUniverse");
            }
        }
        for (FacilityMember fm : facilities) {
            for (String attr : fm.attributes) {
                if (!protocol.attributeUniverse.contains(attr)) {
                    throw new IllegalStateException("Config invalid: facility " + fm.id + " attribute '" + attr + "' not in attributeUniverse");
                }
            }
        }
    }

    /** Accepting votes needed to finalize: ceil((2V+1)/3). */
    @JsonIgnore
    public int voteQuorum() {
        return VoteCertificateValidator.quorum(validators.size());
    }

    @JsonIgnore
    public List<Member> allMembers() {
        List<Member> out = new ArrayList<>();
        if (authority != null) out.add(authority);
        if (leader != null) out.add(leader);
        out.addAll(fogNodes);
        out.addAll(validators);
        out.addAll(facilities);
        return out;
    }

    public Optional<Member> member(String id) {
        return allMembers().stream().filter(m -> m.id.equals(id)).findFirst();
    }

    public Optional<FogMember> fog(String id) {
        return fogNodes.stream().filter(m -> m.id.equals(id)).findFirst();
    }

    public Optional<FacilityMember> facility(String id) {
        return facilities.stream().filter(m -> m.id.equals(id)).findFirst();
    }
}
