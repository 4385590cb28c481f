package hierfed.server.validator;

import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Domains;
import hierfed.common.error.StaleMessageException;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.validation.GrpcStatusUtil;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.proto.Ack;
import hierfed.proto.CommitNotice;
import hierfed.proto.SignedMessage;
import hierfed.proto.ValidationRequest;
import hierfed.proto.ValidatorServiceGrpc;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;

public final class ValidatorRpcService extends ValidatorServiceGrpc.ValidatorServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(ValidatorRpcService.class);
    private final RpcSupport.NodeInfo node;
    private final VoteCaster caster;

    public ValidatorRpcService(RpcSupport.NodeInfo node, VoteCaster caster) {
        this.node = node;
        this.caster = caster;
    }

    @Override
    public void validate(SignedMessage req, StreamObserver<SignedMessage> resp) {
        if (caster.fault() == VoteCaster.Fault.SILENT) {
            resp.onError(Status.UNAVAILABLE.withDescription("validator " + node.nodeId + " silent").asRuntimeException());
            return;
        }
        var decoded = MessageDecoder.decode(req, MessageTypes.VALIDATION_REQUEST, Domains.VALIDATION,
                node.keys, KeyRegistry.Role.LEADER, ValidationRequest.parser());
        if (!decoded.ok()) {
            log.warn("REJECT ValidationRequest from {} on {}: {}", req.getSignerId(), node.nodeId, decoded.validation());
            resp.onError(GrpcStatusUtil.mapStatus(decoded.validation()).asRuntimeException());
            return;
        }
        try {
            resp.onNext(caster.vote(decoded.message()));
            resp.onCompleted();
        } catch (StaleMessageException e) {
            resp.onError(Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException());
        } catch (GeneralSecurityException e) {
            log.error("Validator {} failed to sign vote: {}", node.nodeId, e.toString());
            resp.onError(Status.INTERNAL.withDescription("signing failed").asRuntimeException());
        }
    }

    @Override
    public void commit(SignedMessage req, StreamObserver<Ack> resp) {
        var decoded = MessageDecoder.decode(req, MessageTypes.COMMIT_NOTICE, Domains.COMMIT,
                node.keys, KeyRegistry.Role.LEADER, CommitNotice.parser());
        Ack ack;
        if (!decoded.ok()) {
            ack = RpcSupport.refused(decoded.validation().code() + ": " + decoded.validation().reason());
        } else {
            String refusal = caster.commit(decoded.message());
            ack = refusal == null ? RpcSupport.accepted() : RpcSupport.refused(refusal);
            if (refusal != null) log.warn("REJECT Commit r={} on {}: {}", decoded.message().getRound(), node.nodeId, refusal);
        }
        resp.onNext(ack);
        resp.onCompleted();
    }
}
