package hierfed.common.net;

import hierfed.common.config.DeploymentConfig;
import hierfed.proto.AuthorityServiceGrpc;
import hierfed.proto.FacilityServiceGrpc;
import hierfed.proto.FogServiceGrpc;
import hierfed.proto.LeaderServiceGrpc;
import hierfed.proto.ReadinessServiceGrpc;
import hierfed.proto.ValidatorServiceGrpc;
import io.grpc.ManagedChannel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Lazily opened channel per deployment member, addressed by member id through the
 * deployment config.
 */
public final class PeerChannels {
    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final DeploymentConfig cfg;
    private final ChannelFactory factory;

    public PeerChannels(DeploymentConfig cfg, ChannelFactory factory) {
        this.cfg = cfg;
        this.factory = factory;
    }

    private ManagedChannel channelFor(String id) {
        return channels.computeIfAbsent(id, mid -> {
            var m = cfg.member(mid).orElseThrow(() -> new IllegalArgumentException("Unknown member id: " + mid));
            return factory.open(m.host, m.port);
        });
    }

    public AuthorityServiceGrpc.AuthorityServiceBlockingStub authority() {
        return AuthorityServiceGrpc.newBlockingStub(channelFor(cfg.authority.id));
    }

    public LeaderServiceGrpc.LeaderServiceBlockingStub leader() {
        return LeaderServiceGrpc.newBlockingStub(channelFor(cfg.leader.id));
    }

    public FogServiceGrpc.FogServiceBlockingStub fog(String id) {
        return FogServiceGrpc.newBlockingStub(channelFor(id));
    }

    public ValidatorServiceGrpc.ValidatorServiceBlockingStub validator(String id) {
        return ValidatorServiceGrpc.newBlockingStub(channelFor(id));
    }

    public FacilityServiceGrpc.FacilityServiceBlockingStub facility(String id) {
        return FacilityServiceGrpc.newBlockingStub(channelFor(id));
    }

    public ReadinessServiceGrpc.ReadinessServiceBlockingStub readiness(String id) {
        return ReadinessServiceGrpc.newBlockingStub(channelFor(id));
    }

    public void shutdown() {
        for (var ch : channels.values()) {
            ch.shutdown();
        }
        for (var ch : channels.values()) {
            try { ch.awaitTermination(2, TimeUnit.SECONDS); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
        }
        for (var ch : channels.values()) {
            if (!ch.isTerminated()) ch.shutdownNow();
        }
    }
}
