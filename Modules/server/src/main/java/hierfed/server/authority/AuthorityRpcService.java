package hierfed.server.authority;

import hierfed.common.error.RegistrationRejectedException;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.validation.GrpcStatusUtil;
import hierfed.proto.Ack;
import hierfed.proto.AttributeKeyBundle;
import hierfed.proto.AuthorityServiceGrpc;
import hierfed.proto.Challenge;
import hierfed.proto.ChallengeRequest;
import hierfed.proto.Empty;
import hierfed.proto.IdentityList;
import hierfed.proto.RegistrationReply;
import hierfed.proto.RevokeRequest;
import hierfed.proto.SignedMessage;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;

public final class AuthorityRpcService extends AuthorityServiceGrpc.AuthorityServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(AuthorityRpcService.class);
    private final IdentityRegistry registry;

    public AuthorityRpcService(IdentityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void issueChallenge(ChallengeRequest req, StreamObserver<Challenge> resp) {
        if (req.getFacilityId().isBlank()) {
            resp.onError(Status.INVALID_ARGUMENT.withDescription("facility_id blank").asRuntimeException());
            return;
        }
        resp.onNext(registry.issueChallenge(req.getFacilityId()));
        resp.onCompleted();
    }

    @Override
    public void register(SignedMessage req, StreamObserver<RegistrationReply> resp) {
        try {
            resp.onNext(registry.register(req));
            resp.onCompleted();
        } catch (RegistrationRejectedException e) {
            log.warn("REJECT Register signer={} reason={} detail={}", req.getSignerId(), e.reason(), e.getMessage());
            resp.onError(GrpcStatusUtil.mapStatus(e).asRuntimeException());
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("REJECT Register signer={} malformed: {}", req.getSignerId(), e.getMessage());
            resp.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
        }
    }

    @Override
    public void refreshKeys(SignedMessage req, StreamObserver<AttributeKeyBundle> resp) {
        try {
            resp.onNext(registry.refreshKeys(req));
            resp.onCompleted();
        } catch (RegistrationRejectedException e) {
            log.warn("REJECT RefreshKeys signer={} reason={}", req.getSignerId(), e.reason());
            resp.onError(GrpcStatusUtil.mapStatus(e).asRuntimeException());
        } catch (GeneralSecurityException e) {
            resp.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
        }
    }

    @Override
    public void revoke(RevokeRequest req, StreamObserver<Ack> resp) {
        boolean done = registry.revoke(req.getFacilityId(), req.getReason());
        resp.onNext(done ? RpcSupport.accepted() : RpcSupport.refused("not an active identity: " + req.getFacilityId()));
        resp.onCompleted();
    }

    @Override
    public void listIdentities(Empty req, StreamObserver<IdentityList> resp) {
        resp.onNext(registry.listIdentities());
        resp.onCompleted();
    }

    @Override
    public void getPolicyKeys(SignedMessage req, StreamObserver<AttributeKeyBundle> resp) {
        try {
            resp.onNext(registry.policyKeys(req));
            resp.onCompleted();
        } catch (SecurityException e) {
            log.warn("REJECT GetPolicyKeys signer={} {}", req.getSignerId(), e.getMessage());
            resp.onError(Status.PERMISSION_DENIED.withDescription(e.getMessage()).asRuntimeException());
        } catch (GeneralSecurityException e) {
            resp.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
        }
    }
}
