package hierfed.common.validation;

import com.google.protobuf.ByteString;
import com.google.protobuf.MessageLite;
import hierfed.common.crypto.Signer;
import hierfed.proto.SignedMessage;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;

public final class SignedMessagePacker {
    private SignedMessagePacker() {}

    public static SignedMessage pack(String domain,
                                     String typeUrl,
                                     byte[] payload,
                                     String signerId,
                                     long round,
                                     PrivateKey sk) throws GeneralSecurityException {
        byte[] sig = Signer.sign(domain, typeUrl, payload, sk);
        return SignedMessage.newBuilder()
                .setTypeUrl(typeUrl)
                .setPayload(ByteString.copyFrom(payload))
                .setSignerId(signerId)
                .setSignature(ByteString.copyFrom(sig))
                .setRound(round)
                .build();
    }

    public static SignedMessage pack(String domain,
                                     String typeUrl,
                                     MessageLite msg,
                                     String signerId,
                                     long round,
                                     PrivateKey sk) throws GeneralSecurityException {
        return pack(domain, typeUrl, msg.toByteArray(), signerId, round, sk);
    }
}
