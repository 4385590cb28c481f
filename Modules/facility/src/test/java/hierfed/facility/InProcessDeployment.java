package hierfed.facility;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.KeyFiles;
import hierfed.common.net.ChannelFactory;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import hierfed.server.authority.AuthorityNode;
import hierfed.server.fog.FogAggregator;
import hierfed.server.fog.FogNode;
import hierfed.server.leader.LeaderNode;
import hierfed.server.validator.ValidatorNode;
import hierfed.server.validator.VoteCaster;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.apache.commons.math3.random.Well19937c;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Every role of a small deployment wired over in-process gRPC: ta, leader, fog1-3 (t=2),
 * v1-v4 and facilities f1-f4 (f1, f2 in region:X; f3, f4 in region:Y).
 */
final class InProcessDeployment implements AutoCloseable {
    final DeploymentConfig cfg = new DeploymentConfig();
    final KeyRegistry keys = new KeyRegistry();
    final AuthorityNode authority;
    final LeaderNode leader;
    final Map<String, FogNode> fogs = new LinkedHashMap<>();
    final Map<String, ValidatorNode> validators = new LinkedHashMap<>();
    final Map<String, FacilityNode> facilities = new LinkedHashMap<>();

    private final String host = "hierfed-" + System.nanoTime();
    private final Map<String, KeyPair> pairs = new HashMap<>();
    private final Map<String, Server> servers = new LinkedHashMap<>();
    private final Map<String, ServiceNode> nodes = new LinkedHashMap<>();
    private final List<PeerChannels> clients = new ArrayList<>();
    private final ChannelFactory channels = (h, p) -> InProcessChannelBuilder.forName(h + ":" + p).directExecutor().build();

    InProcessDeployment() throws GeneralSecurityException, IOException {
        this(c -> { }, Map.of());
    }

    /**
     * @param tuning   adjusts the configuration before validation
     * @param trainers trainer per facility id; the rest use a {@link MeanRecordTrainer}
     */
    InProcessDeployment(Consumer<DeploymentConfig> tuning, Map<String, LocalTrainer> trainers)
            throws GeneralSecurityException, IOException {
        cfg.authority = new DeploymentConfig.Member("ta", host, 7600);
        cfg.leader = new DeploymentConfig.Member("leader", host, 7650);
        for (int i = 1; i <= 3; i++) cfg.fogNodes.add(new DeploymentConfig.FogMember("fog" + i, host, 8600 + i, i));
        for (int i = 1; i <= 4; i++) cfg.validators.add(new DeploymentConfig.Member("v" + i, host, 8700 + i));
        for (int i = 1; i <= 4; i++) {
            String region = i <= 2 ? "region:X" : "region:Y";
            cfg.facilities.add(new DeploymentConfig.FacilityMember("f" + i, host, 9600 + i, List.of("facility", region)));
        }
        cfg.protocol.modelDimension = 2;
        cfg.protocol.powDifficultyBits = 6;
        cfg.protocol.accessPolicy = "facility AND (region:X OR region:Y)";
        cfg.protocol.privacy.epsilon = 1.0e6;
        cfg.protocol.privacy.clipNorm = 5.0;
        cfg.timeouts.readinessMs = 2000;
        cfg.timeouts.collectionMs = 3000;
        cfg.timeouts.fogMs = 1000;
        cfg.timeouts.votingMs = 2000;
        cfg.timeouts.broadcastMs = 2000;
        cfg.timeouts.rpcDeadlineMs = 1000;
        cfg.timeouts.retryBaseMs = 10;
        tuning.accept(cfg);
        cfg.validate();

        keys.put(KeyRegistry.Role.AUTHORITY, "ta", pair("ta").getPublic());
        keys.put(KeyRegistry.Role.LEADER, "leader", pair("leader").getPublic());
        for (var fog : cfg.fogNodes) keys.put(KeyRegistry.Role.FOG, fog.id, pair(fog.id).getPublic());
        for (var v : cfg.validators) keys.put(KeyRegistry.Role.VALIDATOR, v.id, pair(v.id).getPublic());

        byte[] master = new byte[32];
        new SecureRandom().nextBytes(master);
        authority = start(cfg.authority, new AuthorityNode(node("ta"), master));
        leader = start(cfg.leader, new LeaderNode(node("leader"), channels));
        for (var fog : cfg.fogNodes) fogs.put(fog.id, start(fog, new FogNode(node(fog.id), channels, FogAggregator.Fault.NONE)));
        for (var v : cfg.validators) validators.put(v.id, start(v, new ValidatorNode(node(v.id), VoteCaster.Fault.NONE)));
        long seed = 1L;
        for (var f : cfg.facilities) {
            FacilityNode fn = new FacilityNode(node(f.id), pair(f.id).getPublic(), channels,
                    trainers.getOrDefault(f.id, new MeanRecordTrainer(1.0)), new Well19937c(seed++));
            facilities.put(f.id, start(f, fn));
        }
    }

    private KeyPair pair(String id) throws GeneralSecurityException {
        KeyPair kp = pairs.get(id);
        if (kp == null) {
            kp = KeyFiles.generateKeyPair();
            pairs.put(id, kp);
        }
        return kp;
    }

    private RpcSupport.NodeInfo node(String id) throws GeneralSecurityException {
        return new RpcSupport.NodeInfo(id, cfg, pair(id).getPrivate(), keys);
    }

    private <N extends ServiceNode> N start(DeploymentConfig.Member m, N node) throws IOException {
        InProcessServerBuilder b = InProcessServerBuilder.forName(m.host + ":" + m.port);
        for (BindableService s : node.services()) b.addService(s);
        servers.put(m.id, b.build().start());
        nodes.put(m.id, node);
        return node;
    }

    /** Stops a member abruptly; calls to it fail as unreachable from then on. */
    void crash(String id) throws InterruptedException {
        Server s = servers.remove(id);
        s.shutdownNow();
        s.awaitTermination(2, TimeUnit.SECONDS);
        nodes.remove(id).close();
    }

    /** Client-side channels to every member, as an operator tool would open them. */
    PeerChannels peers() {
        PeerChannels p = new PeerChannels(cfg, channels);
        clients.add(p);
        return p;
    }

    FacilityAgent facility(String id) {
        return facilities.get(id).agent;
    }

    void registerAll() throws GeneralSecurityException {
        for (FacilityNode f : facilities.values()) f.agent.register();
    }

    void arm(String id, double[]... records) {
        facility(id).arm(RecordCodec.encode(List.of(records)));
    }

    @Override
    public void close() throws InterruptedException {
        for (PeerChannels p : clients) p.shutdown();
        for (ServiceNode n : nodes.values()) n.close();
        for (Server s : servers.values()) s.shutdownNow();
        for (Server s : servers.values()) s.awaitTermination(2, TimeUnit.SECONDS);
    }
}
