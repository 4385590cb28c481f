package hierfed.common.rpc;

import hierfed.proto.ReadinessServiceGrpc;
import hierfed.proto.ReadyReply;
import hierfed.proto.ReadyRequest;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/** Answers the leader's readiness handshake before a round starts collecting. */
public final class ReadinessRpcService extends ReadinessServiceGrpc.ReadinessServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(ReadinessRpcService.class);
    private final String nodeId;
    private final String role;
    private final BooleanSupplier ready;

    public ReadinessRpcService(String nodeId, String role, BooleanSupplier ready) {
        this.nodeId = nodeId;
        this.role = role;
        this.ready = ready;
    }

    @Override
    public void ready(ReadyRequest req, StreamObserver<ReadyReply> resp) {
        boolean ok = ready.getAsBoolean();
        log.debug("Readiness probe from {} for round {} on {}: {}", req.getRequesterId(), req.getRound(), nodeId, ok);
        resp.onNext(ReadyReply.newBuilder().setNodeId(nodeId).setRole(role).setReady(ok).build());
        resp.onCompleted();
    }
}
