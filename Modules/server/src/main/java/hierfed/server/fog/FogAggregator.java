package hierfed.server.fog;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Digests;
import hierfed.common.crypto.Domains;
import hierfed.common.error.StaleMessageException;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.sharing.PrimeField;
import hierfed.common.sharing.ShamirSharing;
import hierfed.common.sharing.VectorShare;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.CollectionClose;
import hierfed.proto.FogPartialSum;
import hierfed.proto.FogStatus;
import hierfed.proto.ShareSubmission;
import hierfed.proto.SignedMessage;
import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the shares addressed to this fog node for the round being collected, and turns them into
 * one partial sum when the leader closes collection. Individual shares never leave this object.
 */
public final class FogAggregator {
    private static final Logger log = LoggerFactory.getLogger(FogAggregator.class);

    public enum Fault {
        NONE, SILENT, CORRUPT;

        public static Fault parse(String s) {
            if (s == null || s.isBlank()) return NONE;
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        }
    }

    /** Result of a close: either a partial sum to forward, or the reason none can be produced. */
    public record CloseOutcome(FogPartialSum partialSum, String refusal) {
        public boolean ok() { return partialSum != null; }
    }

    private final RpcSupport.NodeInfo node;
    private final int index;
    private final int dimension;
    private final PrimeField field;
    private final ShamirSharing sharing;
    private final SecureRandom rng;
    private volatile Fault fault;

    private long collectingRound = 0L;
    private long lastClosedRound = 0L;
    private final Map<String, VectorShare> shares = new LinkedHashMap<>();

    public FogAggregator(RpcSupport.NodeInfo node, PrimeField field, SecureRandom rng, Fault fault) {
        this.node = node;
        DeploymentConfig.FogMember me = node.cfg.fog(node.nodeId)
                .orElseThrow(() -> new IllegalStateException("Config invalid: nodeId " + node.nodeId + " not present in fogNodes"));
        this.index = me.index;
        this.dimension = node.cfg.protocol.modelDimension;
        this.field = field;
        this.sharing = new ShamirSharing(field, node.cfg.protocol.threshold, rng);
        this.rng = rng;
        this.fault = fault;
    }

    public int index() { return index; }

    public Fault fault() { return fault; }

    public void setFault(Fault fault) { this.fault = fault; }

    /**
     * Accepts one facility's share for the round being collected. A share for a newer round
     * starts a new collection and drops whatever an unclosed older round left behind.
     *
     * @return null when accepted, otherwise the refusal reason
     * @throws StaleMessageException for rounds at or below the last closed one
     */
    public synchronized String acceptShare(CertifiedMessage cm) throws StaleMessageException {
        var decoded = MessageDecoder.decodeCertified(cm, MessageTypes.SHARE_SUBMISSION, Domains.SHARE, node.keys, ShareSubmission.parser());
        if (!decoded.ok()) return decoded.validation().code() + ": " + decoded.validation().reason();
        ShareSubmission s = decoded.message();
        if (!s.getFacilityId().equals(decoded.signerId())) return "facility id does not match signer";
        if (s.getFogIndex() != index) return "share for index " + s.getFogIndex() + " sent to index " + index;
        if (s.getValuesCount() != dimension) return "dimension " + s.getValuesCount() + " != " + dimension;
        VectorShare share = VectorShare.fromWire(index, s.getValuesList());
        for (BigInteger v : share.values()) {
            if (!field.contains(v)) return "share value outside field";
        }

        long r = s.getRound();
        if (r <= lastClosedRound || r < collectingRound) {
            throw new StaleMessageException(r, Math.max(collectingRound, lastClosedRound));
        }
        if (r > collectingRound) {
            if (!shares.isEmpty()) {
                log.warn("Fog {} dropping {} unclosed shares of round {} for round {}", node.nodeId, shares.size(), collectingRound, r);
            }
            shares.clear();
            collectingRound = r;
        }
        if (shares.containsKey(s.getFacilityId())) return "duplicate share from " + s.getFacilityId();
        shares.put(s.getFacilityId(), share);
        log.debug("Fog {} holds share of {} for round {} ({} total)", node.nodeId, s.getFacilityId(), r, shares.size());
        return null;
    }

    /**
     * Closes the round over exactly the leader's participant set and computes the partial sum.
     * The round counts as closed either way; shares are discarded.
     *
     * @throws StaleMessageException for rounds at or below the last closed one
     */
    public synchronized CloseOutcome close(SignedMessage env) throws StaleMessageException {
        var decoded = MessageDecoder.decode(env, MessageTypes.COLLECTION_CLOSE, Domains.CLOSE,
                node.keys, KeyRegistry.Role.LEADER, CollectionClose.parser());
        if (!decoded.ok()) return new CloseOutcome(null, decoded.validation().code() + ": " + decoded.validation().reason());
        CollectionClose close = decoded.message();
        long r = close.getRound();
        if (r <= lastClosedRound) throw new StaleMessageException(r, lastClosedRound);

        List<VectorShare> selected = new ArrayList<>();
        String missing = null;
        if (r == collectingRound) {
            for (String p : close.getParticipantsList()) {
                VectorShare s = shares.get(p);
                if (s == null) {
                    missing = p;
                    break;
                }
                selected.add(s);
            }
        } else {
            missing = close.getParticipantsCount() > 0 ? close.getParticipants(0) : null;
        }
        lastClosedRound = r;
        collectingRound = r;
        int held = shares.size();
        shares.clear();

        if (missing != null) {
            log.warn("Fog {} cannot close round {}: no share from {}", node.nodeId, r, missing);
            return new CloseOutcome(null, "missing share for " + missing);
        }
        if (close.getParticipantsCount() == 0) {
            return new CloseOutcome(null, "empty participant set");
        }
        VectorShare sum = sharing.sum(index, selected, dimension);
        if (fault == Fault.CORRUPT) {
            BigInteger[] junk = new BigInteger[dimension];
            for (int i = 0; i < dimension; i++) junk[i] = field.random(rng);
            sum = new VectorShare(index, junk);
        }
        log.info("Fog {} closed round {} over {} participants ({} shares held)", node.nodeId, r, selected.size(), held);
        FogPartialSum partial = FogPartialSum.newBuilder()
                .setRound(r)
                .setFogId(node.nodeId)
                .setFogIndex(index)
                .setParticipantDigest(ByteString.copyFrom(Digests.idSetDigest(close.getParticipantsList())))
                .setParticipantCount(close.getParticipantsCount())
                .addAllValues(sum.toWire())
                .build();
        return new CloseOutcome(partial, null);
    }

    public synchronized FogStatus status() {
        return FogStatus.newBuilder()
                .setFogId(node.nodeId)
                .setIndex(index)
                .setCollectingRound(collectingRound)
                .setLastClosedRound(lastClosedRound)
                .setSharesHeld(shares.size())
                .build();
    }
}
