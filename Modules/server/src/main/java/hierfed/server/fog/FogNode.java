package hierfed.server.fog;

import hierfed.common.net.ChannelFactory;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.ReadinessRpcService;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import hierfed.common.sharing.PrimeField;
import io.grpc.BindableService;

import java.security.SecureRandom;
import java.util.List;

public final class FogNode implements ServiceNode {
    public final FogAggregator aggregator;
    private final PeerChannels peers;
    private final PartialSumForwarder forwarder;
    private final List<BindableService> services;

    public FogNode(RpcSupport.NodeInfo node, ChannelFactory channels, FogAggregator.Fault fault) {
        this.peers = new PeerChannels(node.cfg, channels);
        this.aggregator = new FogAggregator(node, PrimeField.standard(), new SecureRandom(), fault);
        this.forwarder = new PartialSumForwarder(node, peers);
        this.services = List.of(
                new FogRpcService(node.nodeId, aggregator, forwarder),
                new ReadinessRpcService(node.nodeId, "fog", () -> true));
    }

    @Override
    public List<BindableService> services() { return services; }

    @Override
    public void close() {
        forwarder.close();
        peers.shutdown();
    }
}
