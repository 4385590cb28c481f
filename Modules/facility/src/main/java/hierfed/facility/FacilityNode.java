package hierfed.facility;

import hierfed.common.net.ChannelFactory;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.ReadinessRpcService;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import io.grpc.BindableService;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.List;

public final class FacilityNode implements ServiceNode {
    public final FacilityAgent agent;
    private final PeerChannels peers;
    private final List<BindableService> services;

    public FacilityNode(RpcSupport.NodeInfo node, PublicKey publicKey, ChannelFactory channels, LocalTrainer trainer) {
        this(node, publicKey, channels, trainer, new Well19937c(new SecureRandom().nextLong()));
    }

    public FacilityNode(RpcSupport.NodeInfo node, PublicKey publicKey, ChannelFactory channels, LocalTrainer trainer,
                        RandomGenerator noise) {
        this.peers = new PeerChannels(node.cfg, channels);
        this.agent = new FacilityAgent(node, publicKey, peers, trainer, noise);
        this.services = List.of(
                new FacilityRpcService(agent),
                new ReadinessRpcService(node.nodeId, "facility", agent::ready));
    }

    @Override
    public List<BindableService> services() { return services; }

    @Override
    public void close() {
        agent.close();
        peers.shutdown();
    }
}
