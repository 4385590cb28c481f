package hierfed.server.validator;

import com.google.protobuf.ByteString;
import hierfed.common.crypto.Domains;
import hierfed.common.error.StaleMessageException;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.util.Hex;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.common.validation.VoteCertificateValidator;
import hierfed.proto.CommitNotice;
import hierfed.proto.SignedMessage;
import hierfed.proto.ValidationRequest;
import hierfed.proto.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;

/**
 * Casts at most one vote per round and keeps the committed model used for consistency checks.
 * A repeated request for the round already voted on gets the same signed vote back.
 */
public final class VoteCaster {
    private static final Logger log = LoggerFactory.getLogger(VoteCaster.class);

    public enum Fault {
        NONE, REJECT, ACCEPT_ALL, SILENT, BAD_SIGNATURE;

        public static Fault parse(String s) {
            if (s == null || s.isBlank()) return NONE;
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        }
    }

    private final RpcSupport.NodeInfo node;
    private final CandidateChecker checker;
    private volatile Fault fault;

    private CommittedModel committed;
    private long votedRound = 0L;
    private SignedMessage lastVote;

    public VoteCaster(RpcSupport.NodeInfo node, CandidateChecker checker, Fault fault) {
        this.node = node;
        this.checker = checker;
        this.fault = fault;
        this.committed = CommittedModel.bootstrap(node.cfg.protocol.modelDimension);
    }

    public Fault fault() { return fault; }

    public void setFault(Fault fault) { this.fault = fault; }

    /** @throws StaleMessageException for a round older than the one last voted on */
    public synchronized SignedMessage vote(ValidationRequest req) throws StaleMessageException, GeneralSecurityException {
        if (req.getRound() < votedRound) throw new StaleMessageException(req.getRound(), votedRound);
        if (req.getRound() == votedRound && lastVote != null) return lastVote;

        CandidateChecker.Verdict verdict = switch (fault) {
            case REJECT -> new CandidateChecker.Verdict(false, "rejecting unconditionally");
            case ACCEPT_ALL -> new CandidateChecker.Verdict(true, "accepting unconditionally");
            default -> checker.check(req, committed);
        };
        Vote vote = Vote.newBuilder()
                .setRound(req.getRound())
                .setValidatorId(node.nodeId)
                .setCandidateHash(req.getCandidateHash())
                .setAccept(verdict.accept())
                .setReason(verdict.reason())
                .build();
        SignedMessage env = SignedMessagePacker.pack(Domains.VOTE, MessageTypes.VOTE, vote, node.nodeId, req.getRound(), node.sk);
        if (fault == Fault.BAD_SIGNATURE) {
            env = env.toBuilder().setSignature(ByteString.copyFrom(new byte[]{0})).build();
        }
        votedRound = req.getRound();
        lastVote = env;
        if (verdict.accept()) {
            log.info("Validator {} ACCEPT round {}", node.nodeId, req.getRound());
        } else {
            log.warn("Validator {} REJECT round {}: {}", node.nodeId, req.getRound(), verdict.reason());
        }
        return env;
    }

    /**
     * Installs a finalized model if it is newer than the committed one and carries a valid vote certificate.
     *
     * @return null when installed or already known, otherwise the refusal reason
     */
    public synchronized String commit(CommitNotice notice) {
        if (notice.getVersion() <= committed.version()) return null;
        var cert = VoteCertificateValidator.validate(notice.getVotesList(), notice.getRound(), notice.getCandidateHash(),
                node.keys, node.cfg.validators.size());
        if (!cert.ok()) return "vote certificate: " + cert.reason();
        double[] params = new double[notice.getParametersCount()];
        for (int i = 0; i < params.length; i++) params[i] = notice.getParameters(i);
        if (params.length != node.cfg.protocol.modelDimension) return "dimension mismatch";
        committed = CommittedModel.of(notice.getVersion(), params);
        log.info("Validator {} committed version {} (round {}) hash={}", node.nodeId, notice.getVersion(), notice.getRound(),
                Hex.shortHex(committed.hash(), 12));
        return null;
    }

    public synchronized CommittedModel committed() { return committed; }
}
