package hierfed.server.fog;

import hierfed.common.error.StaleMessageException;
import hierfed.common.rpc.RpcSupport;
import hierfed.proto.Ack;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.Empty;
import hierfed.proto.FogServiceGrpc;
import hierfed.proto.FogStatus;
import hierfed.proto.SignedMessage;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FogRpcService extends FogServiceGrpc.FogServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(FogRpcService.class);
    private final String nodeId;
    private final FogAggregator aggregator;
    private final PartialSumForwarder forwarder;

    public FogRpcService(String nodeId, FogAggregator aggregator, PartialSumForwarder forwarder) {
        this.nodeId = nodeId;
        this.aggregator = aggregator;
        this.forwarder = forwarder;
    }

    @Override
    public void submitShare(CertifiedMessage req, StreamObserver<Ack> resp) {
        Ack ack;
        try {
            String refusal = aggregator.acceptShare(req);
            if (refusal == null) {
                ack = RpcSupport.accepted();
            } else {
                log.warn("REJECT Share from {} r={} on {}: {}", req.getMessage().getSignerId(), req.getMessage().getRound(), nodeId, refusal);
                ack = RpcSupport.refused(refusal);
            }
        } catch (StaleMessageException e) {
            log.debug("Drop stale share from {} on {}: {}", req.getMessage().getSignerId(), nodeId, e.getMessage());
            ack = RpcSupport.refused(e.getMessage());
        }
        resp.onNext(ack);
        resp.onCompleted();
    }

    @Override
    public void closeCollection(SignedMessage req, StreamObserver<Ack> resp) {
        Ack ack;
        try {
            var outcome = aggregator.close(req);
            if (!outcome.ok()) {
                ack = RpcSupport.refused(outcome.refusal());
            } else if (aggregator.fault() == FogAggregator.Fault.SILENT) {
                log.debug("Fog {} silent: withholding partial sum for round {}", nodeId, outcome.partialSum().getRound());
                ack = RpcSupport.accepted();
            } else {
                forwarder.forward(outcome.partialSum());
                ack = RpcSupport.accepted();
            }
        } catch (StaleMessageException e) {
            log.debug("Drop stale close on {}: {}", nodeId, e.getMessage());
            ack = RpcSupport.refused(e.getMessage());
        }
        resp.onNext(ack);
        resp.onCompleted();
    }

    @Override
    public void status(Empty req, StreamObserver<FogStatus> resp) {
        resp.onNext(aggregator.status());
        resp.onCompleted();
    }
}
