package hierfed.server.leader;

import hierfed.common.net.ChannelFactory;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.ReadinessRpcService;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import io.grpc.BindableService;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class LeaderNode implements ServiceNode {
    public final RoundCoordinator coordinator;
    public final GlobalModelStore store;
    private final PeerChannels peers;
    private final LeaderOutbound outbound;
    private final List<BindableService> services;

    public LeaderNode(RpcSupport.NodeInfo node, ChannelFactory channels) throws IOException {
        String dir = node.cfg.modelStoreDir;
        this.store = new GlobalModelStore(node.cfg.protocol.modelDimension,
                dir == null || dir.isBlank() ? null : Path.of(dir));
        this.peers = new PeerChannels(node.cfg, channels);
        this.outbound = new LeaderOutbound(node, peers);
        this.coordinator = new RoundCoordinator(node, outbound, store);
        this.services = List.of(
                new LeaderRpcService(coordinator, store),
                new ReadinessRpcService(node.nodeId, "leader", () -> true));
    }

    @Override
    public List<BindableService> services() { return services; }

    @Override
    public void close() {
        coordinator.close();
        outbound.close();
        peers.shutdown();
    }
}
