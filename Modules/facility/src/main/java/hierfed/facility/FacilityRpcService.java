package hierfed.facility;

import hierfed.common.rpc.RpcSupport;
import hierfed.proto.Ack;
import hierfed.proto.Empty;
import hierfed.proto.FacilityRegistration;
import hierfed.proto.FacilityServiceGrpc;
import hierfed.proto.FacilityStatus;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.LocalDataDelta;
import hierfed.proto.SignedMessage;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;

public final class FacilityRpcService extends FacilityServiceGrpc.FacilityServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(FacilityRpcService.class);
    private final FacilityAgent agent;

    public FacilityRpcService(FacilityAgent agent) {
        this.agent = agent;
    }

    @Override
    public void register(Empty req, StreamObserver<FacilityRegistration> resp) {
        try {
            resp.onNext(agent.register());
            resp.onCompleted();
        } catch (StatusRuntimeException e) {
            log.warn("Registration failed: {}", e.getStatus());
            resp.onError(e.getStatus().asRuntimeException());
        } catch (GeneralSecurityException e) {
            log.warn("Registration failed: {}", e.getMessage());
            resp.onError(Status.PERMISSION_DENIED.withDescription(e.getMessage()).asRuntimeException());
        }
    }

    @Override
    public void startRound(LocalDataDelta req, StreamObserver<Ack> resp) {
        try {
            agent.arm(req.getData().toByteArray());
        } catch (IllegalArgumentException e) {
            resp.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
            return;
        }
        resp.onNext(RpcSupport.accepted());
        resp.onCompleted();
    }

    @Override
    public void announceRound(SignedMessage req, StreamObserver<Ack> resp) {
        resp.onNext(agent.onAnnouncement(req));
        resp.onCompleted();
    }

    @Override
    public void deliverGlobalModel(GlobalModelEnvelope req, StreamObserver<Ack> resp) {
        resp.onNext(agent.onGlobalModel(req));
        resp.onCompleted();
    }

    @Override
    public void status(Empty req, StreamObserver<FacilityStatus> resp) {
        resp.onNext(agent.status());
        resp.onCompleted();
    }
}
