package hierfed.server.validator;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.crypto.Digests;
import hierfed.common.privacy.GaussianMechanism;
import hierfed.proto.ValidationRequest;

import java.util.Arrays;

/**
 * The local check each validator runs on a candidate aggregate: shape, integrity, bounds and
 * consistency with the model version the candidate claims to build on.
 */
public final class CandidateChecker {
    public record Verdict(boolean accept, String reason) {
        static Verdict ok() { return new Verdict(true, "ok"); }
        static Verdict reject(String reason) { return new Verdict(false, reason); }
    }

    private final DeploymentConfig.Protocol protocol;

    public CandidateChecker(DeploymentConfig.Protocol protocol) {
        this.protocol = protocol;
    }

    public Verdict check(ValidationRequest req, CommittedModel base) {
        if (req.getValuesCount() != protocol.modelDimension) {
            return Verdict.reject("dimension " + req.getValuesCount() + " != " + protocol.modelDimension);
        }
        double[] update = new double[req.getValuesCount()];
        for (int i = 0; i < update.length; i++) update[i] = req.getValues(i);
        if (!Arrays.equals(Digests.vectorHash(update), req.getCandidateHash().toByteArray())) {
            return Verdict.reject("candidate hash does not match values");
        }
        if (req.getParticipantCount() < protocol.minParticipants) {
            return Verdict.reject("participants " + req.getParticipantCount() + " < " + protocol.minParticipants);
        }
        for (int i = 0; i < update.length; i++) {
            if (!Double.isFinite(update[i])) return Verdict.reject("non-finite coordinate " + i);
            if (Math.abs(update[i]) > protocol.maxAbsCoordinate) {
                return Verdict.reject("coordinate " + i + " exceeds " + protocol.maxAbsCoordinate);
            }
        }
        double norm = GaussianMechanism.l2Norm(update);
        if (norm > protocol.maxUpdateNorm) {
            return Verdict.reject(String.format("update norm %.4f exceeds %.4f", norm, protocol.maxUpdateNorm));
        }
        if (req.getBaseVersion() != base.version()) {
            return Verdict.reject("base version " + req.getBaseVersion() + " != committed " + base.version());
        }
        if (!Arrays.equals(req.getBaseModelHash().toByteArray(), base.hash())) {
            return Verdict.reject("base model hash differs from committed version " + base.version());
        }
        for (int i = 0; i < update.length; i++) {
            if (Math.abs(base.parameters()[i] + update[i]) > protocol.maxAbsCoordinate) {
                return Verdict.reject("resulting coordinate " + i + " exceeds " + protocol.maxAbsCoordinate);
            }
        }
        return Verdict.ok();
    }
}
