package hierfed.common.validation;

import com.google.protobuf.ByteString;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Domains;
import hierfed.proto.SignedMessage;
import hierfed.proto.Vote;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a set of signed votes forms a Byzantine quorum of distinct validators accepting
 * one candidate in one round.
 */
public final class VoteCertificateValidator {
    private VoteCertificateValidator() {}

    public record Result(boolean ok, String reason) {
        public static Result success() { return new Result(true, ""); }
    }

    /** ceil((2V+1)/3); equals 2f+1 when V = 3f+1. */
    public static int quorum(int validators) {
        return (2 * validators + 3) / 3;
    }

    public static Result validate(List<SignedMessage> votes, long round, ByteString candidateHash,
                                  KeyRegistry reg, int validatorCount) {
        int threshold = quorum(validatorCount);
        if (votes.size() < threshold) {
            return new Result(false, "insufficient votes: " + votes.size() + " < " + threshold);
        }
        Set<String> signers = new HashSet<>();
        for (SignedMessage env : votes) {
            var r = MessageDecoder.decode(env, MessageTypes.VOTE, Domains.VOTE, reg, KeyRegistry.Role.VALIDATOR, Vote.parser());
            if (!r.ok()) {
                return new Result(false, "bad vote: " + r.validation());
            }
            Vote v = r.message();
            if (v.getRound() != round) {
                return new Result(false, "vote round mismatch: " + v.getRound() + " != " + round);
            }
            if (!v.getCandidateHash().equals(candidateHash)) {
                return new Result(false, "candidate hash mismatch in vote from " + env.getSignerId());
            }
            if (!env.getSignerId().equals(v.getValidatorId())) {
                return new Result(false, "validatorId/signature mismatch");
            }
            if (!v.getAccept()) {
                return new Result(false, "rejecting vote in certificate from " + v.getValidatorId());
            }
            if (!signers.add(env.getSignerId())) {
                return new Result(false, "duplicate signer: " + env.getSignerId());
            }
        }
        if (signers.size() < threshold) {
            return new Result(false, "distinct signers < threshold");
        }
        return Result.success();
    }
}
