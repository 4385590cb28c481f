package hierfed.server.authority;

import hierfed.common.abe.AttributeKeys;
import hierfed.common.rpc.ReadinessRpcService;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import io.grpc.BindableService;

import java.security.SecureRandom;
import java.util.List;

public final class AuthorityNode implements ServiceNode {
    public final IdentityRegistry registry;
    private final List<BindableService> services;

    public AuthorityNode(RpcSupport.NodeInfo node, byte[] masterSecret) {
        this.registry = new IdentityRegistry(node.nodeId, node.sk, node.cfg, node.keys,
                new AttributeKeys(masterSecret), new SecureRandom());
        this.services = List.of(
                new AuthorityRpcService(registry),
                new ReadinessRpcService(node.nodeId, "authority", () -> true));
    }

    @Override
    public List<BindableService> services() { return services; }

    @Override
    public void close() {}
}
