package hierfed.common.validation;

import hierfed.common.error.RegistrationRejectedException;
import io.grpc.Status;

public final class GrpcStatusUtil {
    private GrpcStatusUtil() {}

    public static Status mapStatus(MessageValidation.Result r) {
        return switch (r.code()) {
            case OK -> Status.OK;
            case UNKNOWN_SIGNER, BAD_SIGNATURE, BAD_CERTIFICATE -> Status.PERMISSION_DENIED.withDescription(r.reason());
            case BAD_TYPEURL, EMPTY_PAYLOAD, BAD_ROUND -> Status.INVALID_ARGUMENT.withDescription(r.reason());
        };
    }

    public static Status mapStatus(RegistrationRejectedException e) {
        String desc = "RegistrationRejected:" + e.reason() + ": " + e.getMessage();
        return switch (e.reason()) {
            case DUPLICATE_ID -> Status.ALREADY_EXISTS.withDescription(desc);
            case INVALID_ATTRIBUTES -> Status.INVALID_ARGUMENT.withDescription(desc);
            case INVALID_PROOF, REUSED_PROOF, UNKNOWN_CHALLENGE, REVOKED -> Status.PERMISSION_DENIED.withDescription(desc);
        };
    }
}
