package hierfed.common.validation;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Parser;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Domains;
import hierfed.common.crypto.KeyFiles;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.IdentityCertificate;
import hierfed.proto.SignedMessage;

import java.security.GeneralSecurityException;
import java.security.PublicKey;

/**
 * Type check, signature check and payload parse of incoming envelopes, in that order.
 */
public final class MessageDecoder {
    private MessageDecoder() {}

    public record TypedResult<T>(MessageValidation.Result validation,
                                 T message,
                                 String signerId,
                                 long envRound,
                                 IdentityCertificate certificate) {
        public boolean ok() { return validation.isOk() && message != null; }

        static <T> TypedResult<T> fail(MessageValidation.Result r, SignedMessage env) {
            return new TypedResult<>(r, null, env.getSignerId(), env.getRound(), null);
        }
    }

    /** Decodes an envelope signed by an infrastructure member of the given role. */
    public static <T> TypedResult<T> decode(SignedMessage env, String typeUrl, String domain,
                                            KeyRegistry reg, KeyRegistry.Role role, Parser<T> parser) {
        var typeOk = checkType(env, typeUrl);
        if (typeOk != null) return TypedResult.fail(typeOk, env);
        var val = MessageValidation.validateSigned(env, domain, reg, role);
        if (!val.isOk()) return TypedResult.fail(val, env);
        return parse(env, parser, null);
    }

    /** Decodes an envelope signed by an explicitly supplied key. */
    public static <T> TypedResult<T> decode(SignedMessage env, String typeUrl, String domain,
                                            PublicKey pk, Parser<T> parser) {
        var typeOk = checkType(env, typeUrl);
        if (typeOk != null) return TypedResult.fail(typeOk, env);
        var val = MessageValidation.validateSigned(env, domain, pk);
        if (!val.isOk()) return TypedResult.fail(val, env);
        return parse(env, parser, null);
    }

    /** Verifies an authority-signed identity certificate. */
    public static TypedResult<IdentityCertificate> decodeCertificate(SignedMessage certEnv, KeyRegistry reg) {
        return decode(certEnv, MessageTypes.IDENTITY_CERTIFICATE, Domains.CERTIFICATE,
                reg, KeyRegistry.Role.AUTHORITY, IdentityCertificate.parser());
    }

    /**
     * Decodes a facility message: the certificate must carry the authority's signature, and the
     * inner message must be signed by the key the certificate binds to the signer id.
     */
    public static <T> TypedResult<T> decodeCertified(CertifiedMessage cm, String typeUrl, String domain,
                                                     KeyRegistry reg, Parser<T> parser) {
        SignedMessage env = cm.getMessage();
        var certResult = decodeCertificate(cm.getCertificate(), reg);
        if (!certResult.ok()) {
            return TypedResult.fail(new MessageValidation.Result(MessageValidation.Code.BAD_CERTIFICATE,
                    "certificate: " + certResult.validation().reason()), env);
        }
        IdentityCertificate cert = certResult.message();
        if (!cert.getFacilityId().equals(env.getSignerId())) {
            return TypedResult.fail(new MessageValidation.Result(MessageValidation.Code.BAD_CERTIFICATE,
                    "certificate is for " + cert.getFacilityId() + " not " + env.getSignerId()), env);
        }
        PublicKey pk;
        try {
            pk = KeyFiles.publicKeyFromDer(cert.getPublicKey().toByteArray());
        } catch (GeneralSecurityException e) {
            return TypedResult.fail(new MessageValidation.Result(MessageValidation.Code.BAD_CERTIFICATE,
                    "certificate key: " + e.getMessage()), env);
        }
        var typeOk = checkType(env, typeUrl);
        if (typeOk != null) return TypedResult.fail(typeOk, env);
        var val = MessageValidation.validateSigned(env, domain, pk);
        if (!val.isOk()) return TypedResult.fail(val, env);
        return parse(env, parser, cert);
    }

    private static <T> TypedResult<T> parse(SignedMessage env, Parser<T> parser, IdentityCertificate cert) {
        try {
            T msg = parser.parseFrom(env.getPayload());
            return new TypedResult<>(MessageValidation.Result.ok(), msg, env.getSignerId(), env.getRound(), cert);
        } catch (InvalidProtocolBufferException e) {
            return TypedResult.fail(new MessageValidation.Result(MessageValidation.Code.EMPTY_PAYLOAD,
                    "bad payload: " + e.getMessage()), env);
        }
    }

    private static MessageValidation.Result checkType(SignedMessage env, String expected) {
        if (!expected.equals(env.getTypeUrl())) {
            return new MessageValidation.Result(MessageValidation.Code.BAD_TYPEURL,
                    "expected " + expected + " got " + env.getTypeUrl());
        }
        return null;
    }
}
