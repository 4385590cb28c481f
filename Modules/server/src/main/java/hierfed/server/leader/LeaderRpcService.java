package hierfed.server.leader;

import hierfed.proto.Ack;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.Empty;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.LeaderServiceGrpc;
import hierfed.proto.LeaderStatus;
import hierfed.proto.SignedMessage;
import hierfed.proto.StartRoundReply;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

public final class LeaderRpcService extends LeaderServiceGrpc.LeaderServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(LeaderRpcService.class);
    private final RoundCoordinator coordinator;
    private final GlobalModelStore store;

    public LeaderRpcService(RoundCoordinator coordinator, GlobalModelStore store) {
        this.coordinator = coordinator;
        this.store = store;
    }

    @Override
    public void startRound(Empty req, StreamObserver<StartRoundReply> resp) {
        RoundCoordinator.Started started;
        try {
            started = coordinator.startRound();
        } catch (IllegalStateException e) {
            log.debug("StartRound refused: {}", e.getMessage());
            resp.onError(Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException());
            return;
        } catch (UncheckedIOException e) {
            log.error("StartRound failed: {}", e.getMessage(), e);
            resp.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
            return;
        }
        resp.onNext(StartRoundReply.newBuilder()
                .setRound(started.round())
                .setDeadlineMs(started.collectionDeadlineMs())
                .build());
        resp.onCompleted();
    }

    @Override
    public void submitNotice(CertifiedMessage req, StreamObserver<Ack> resp) {
        Ack ack = coordinator.onNotice(req);
        if (!ack.getAccepted()) log.debug("Notice from {} r={} refused: {}", req.getMessage().getSignerId(), req.getMessage().getRound(), ack.getReason());
        resp.onNext(ack);
        resp.onCompleted();
    }

    @Override
    public void submitPartialSum(SignedMessage req, StreamObserver<Ack> resp) {
        Ack ack = coordinator.onPartialSum(req);
        if (!ack.getAccepted()) log.debug("Partial sum from {} r={} refused: {}", req.getSignerId(), req.getRound(), ack.getReason());
        resp.onNext(ack);
        resp.onCompleted();
    }

    @Override
    public void getGlobalModel(Empty req, StreamObserver<GlobalModelEnvelope> resp) {
        var env = store.latestEnvelope();
        if (env.isEmpty()) {
            resp.onError(Status.NOT_FOUND.withDescription("no model finalized yet").asRuntimeException());
            return;
        }
        resp.onNext(env.get());
        resp.onCompleted();
    }

    @Override
    public void status(Empty req, StreamObserver<LeaderStatus> resp) {
        resp.onNext(coordinator.status());
        resp.onCompleted();
    }
}
