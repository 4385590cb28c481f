package hierfed.common.validation;

import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Signer;
import hierfed.proto.SignedMessage;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Optional;

public final class MessageValidation {
    public enum Code {
        OK, UNKNOWN_SIGNER, BAD_SIGNATURE, BAD_CERTIFICATE, BAD_ROUND, BAD_TYPEURL, EMPTY_PAYLOAD
    }

    public record Result(Code code, String reason) {
        public static Result ok() { return new Result(Code.OK, ""); }
        public boolean isOk() { return code == Code.OK; }
    }

    private MessageValidation() {}

    public static Result validateSigned(SignedMessage signedMsg, String domain, KeyRegistry reg, KeyRegistry.Role role) {
        Optional<PublicKey> pkOpt = reg.key(role, signedMsg.getSignerId());
        if (pkOpt.isEmpty()) return new Result(Code.UNKNOWN_SIGNER, "no " + role + " pubkey for " + signedMsg.getSignerId());
        return validateSigned(signedMsg, domain, pkOpt.get());
    }

    public static Result validateSigned(SignedMessage signedMsg, String domain, PublicKey pk) {
        if (signedMsg.getPayload().isEmpty()) return new Result(Code.EMPTY_PAYLOAD, "payload empty");
        if (signedMsg.getRound() < 0) return new Result(Code.BAD_ROUND, "round negative");
        if (signedMsg.getTypeUrl().isBlank()) return new Result(Code.BAD_TYPEURL, "type_url blank");
        try {
            boolean ok = Signer.verify(domain, signedMsg.getTypeUrl(), signedMsg.getPayload().toByteArray(),
                    signedMsg.getSignature().toByteArray(), pk);
            return ok ? Result.ok() : new Result(Code.BAD_SIGNATURE, "signature mismatch");
        } catch (GeneralSecurityException e) {
            return new Result(Code.BAD_SIGNATURE, "crypto error: " + e.getMessage());
        }
    }
}
