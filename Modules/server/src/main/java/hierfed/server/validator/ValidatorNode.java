package hierfed.server.validator;

import hierfed.common.rpc.ReadinessRpcService;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.rpc.ServiceNode;
import io.grpc.BindableService;

import java.util.List;

public final class ValidatorNode implements ServiceNode {
    public final VoteCaster caster;
    private final List<BindableService> services;

    public ValidatorNode(RpcSupport.NodeInfo node, VoteCaster.Fault fault) {
        this.caster = new VoteCaster(node, new CandidateChecker(node.cfg.protocol), fault);
        this.services = List.of(
                new ValidatorRpcService(node, caster),
                new ReadinessRpcService(node.nodeId, "validator", () -> caster.fault() != VoteCaster.Fault.SILENT));
    }

    @Override
    public List<BindableService> services() { return services; }

    @Override
    public void close() {}
}
