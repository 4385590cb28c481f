package hierfed.server.leader;

import com.google.protobuf.ByteString;
import hierfed.common.abe.AbeCipher;
import hierfed.common.abe.AccessPolicy;
import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Digests;
import hierfed.common.crypto.Domains;
import hierfed.common.error.RoundAbortedException;
import hierfed.common.error.RoundAbortedException.Reason;
import hierfed.common.error.StaleMessageException;
import hierfed.common.error.ValidationRejectedException;
import hierfed.common.quorum.QuorumCollector;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.sharing.FixedPointCodec;
import hierfed.common.sharing.PrimeField;
import hierfed.common.sharing.ShamirSharing;
import hierfed.common.sharing.VectorShare;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.VoteCertificateValidator;
import hierfed.proto.AbeCiphertext;
import hierfed.proto.Ack;
import hierfed.proto.AttributeKey;
import hierfed.proto.AttributeKeyBundle;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.CollectionClose;
import hierfed.proto.CommitNotice;
import hierfed.proto.FogAssignment;
import hierfed.proto.FogPartialSum;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.IdentityList;
import hierfed.proto.LeaderStatus;
import hierfed.proto.ModelParameters;
import hierfed.proto.PolicyKeysRequest;
import hierfed.proto.RoundAnnouncement;
import hierfed.proto.SignedMessage;
import hierfed.proto.SubmissionNotice;
import hierfed.proto.ValidationRequest;
import hierfed.proto.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Drives the round state machine Idle → Collecting → FogReconstructing → Validating →
 * Finalizing → Broadcasting → Idle. At most one round is active; each phase is bounded by its
 * own deadline and every failure path ends in an aborted round with the model unchanged.
 *
 * <p>Each round runs on the single {@code leader-round} thread. RPC handlers only check and
 * enqueue messages into the active round's collectors.
 */
public final class RoundCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RoundCoordinator.class);
    private static final int HISTORY_LIMIT = 64;

    /** Handle on a started round. */
    public record Started(long round, long collectionDeadlineMs, CompletableFuture<RoundRecord> outcome) {}

    private record CastVote(Vote vote, SignedMessage envelope) {}

    private final RpcSupport.NodeInfo node;
    private final DeploymentConfig cfg;
    private final LeaderOutbound out;
    private final GlobalModelStore store;
    private final PrimeField field = PrimeField.standard();
    private final FixedPointCodec codec;
    private final ShamirSharing sharing;
    private final AbeCipher cipher;
    private final AccessPolicy policy;
    private final ExecutorService roundThread = Executors.newSingleThreadExecutor(RpcSupport.daemonThreads("leader-round"));

    private long lastRound;
    private long totalUploadBytes;
    private long totalDownloadBytes;
    private Round active;
    private final Deque<RoundRecord> history = new ArrayDeque<>();

    public RoundCoordinator(RpcSupport.NodeInfo node, LeaderOutbound out, GlobalModelStore store) {
        this.node = node;
        this.cfg = node.cfg;
        this.out = out;
        this.store = store;
        SecureRandom rng = new SecureRandom();
        this.codec = new FixedPointCodec(field, cfg.protocol.fixedPointBits);
        this.sharing = new ShamirSharing(field, cfg.protocol.threshold, rng);
        this.cipher = new AbeCipher(rng);
        this.policy = AccessPolicy.parse(cfg.protocol.accessPolicy);
        this.lastRound = store.highestRound();
    }

    /**
     * Leaves Idle for a new round numbered one above the last.
     *
     * @throws IllegalStateException if a round is already in progress
     * @throws UncheckedIOException if the new round number cannot be recorded
     */
    public synchronized Started startRound() {
        if (active != null) {
            throw new IllegalStateException("round " + active.number + " in progress (" + active.state + ")");
        }
        long number = lastRound + 1;
        try {
            store.markRoundStarted(number);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot record start of round " + number, e);
        }
        lastRound = number;
        Round r = new Round(number);
        r.collectionDeadlineMs = System.currentTimeMillis() + cfg.timeouts.readinessMs + cfg.timeouts.collectionMs;
        active = r;
        log.info("Round {} starting (model version {})", r.number, store.latestVersion());
        roundThread.execute(() -> drive(r));
        return new Started(r.number, r.collectionDeadlineMs, r.outcome);
    }

    private void drive(Round r) {
        RoundRecord rec;
        try {
            rec = execute(r);
        } catch (RoundAbortedException e) {
            List<String> dissent = e instanceof ValidationRejectedException v ? v.dissent() : List.of();
            log.warn("Round {} ABORTED {}: {}", r.number, e.reason(), e.getMessage());
            for (String d : dissent) log.warn("Round {} dissent {}", r.number, d);
            rec = aborted(r, e.reason() + ": " + e.getMessage(), dissent);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rec = aborted(r, "interrupted", List.of());
        } catch (Exception e) {
            log.error("Round {} failed unexpectedly", r.number, e);
            rec = aborted(r, "unexpected: " + e, List.of());
        }
        finish(r, rec);
    }

    private RoundRecord aborted(Round r, String reason, List<String> dissent) {
        return new RoundRecord(r.number, RoundRecord.Outcome.ABORTED, reason, store.latestVersion(),
                r.participants, r.fogIndices, dissent, r.uploadBytes.get(), r.downloadBytes.get());
    }

    private void finish(Round r, RoundRecord rec) {
        r.notices.close();
        r.partials.close();
        synchronized (this) {
            r.state = RoundState.IDLE;
            history.addLast(rec);
            totalUploadBytes += rec.uploadBytes();
            totalDownloadBytes += rec.downloadBytes();
            while (history.size() > HISTORY_LIMIT) history.removeFirst();
            if (active == r) active = null;
        }
        r.outcome.complete(rec);
    }

    private RoundRecord execute(Round r) throws Exception {
        int t = cfg.protocol.threshold;
        int quorum = cfg.voteQuorum();
        List<String> fogIds = cfg.fogNodes.stream().map(m -> m.id).collect(Collectors.toList());
        List<String> validatorIds = cfg.validators.stream().map(m -> m.id).collect(Collectors.toList());

        // Readiness: roster from the authority, then every tier must answer the handshake.
        long readyDeadline = QuorumCollector.deadlineAfter(cfg.timeouts.readinessMs);
        List<String> roster = roster(r.number, readyDeadline);
        SignedMessage lastCommit = store.latest().commitNotice();
        if (lastCommit != null) out.commit(validatorIds, lastCommit, readyDeadline);
        List<String> probed = new ArrayList<>(fogIds);
        probed.addAll(validatorIds);
        probed.addAll(roster);
        Map<String, Boolean> probes = out.probe(probed, r.number, readyDeadline);
        List<String> readyFogs = ready(probes, fogIds);
        List<String> readyValidators = ready(probes, validatorIds);
        List<String> readyFacilities = ready(probes, roster);
        if (readyFogs.size() < t || readyValidators.size() < quorum || readyFacilities.size() < cfg.protocol.minParticipants) {
            throw new RoundAbortedException(r.number, Reason.NOT_READY, String.format(
                    "fogs %d/%d (need %d), validators %d/%d (need %d), facilities %d/%d (need %d)",
                    readyFogs.size(), fogIds.size(), t, readyValidators.size(), validatorIds.size(), quorum,
                    readyFacilities.size(), roster.size(), cfg.protocol.minParticipants));
        }

        // Collecting.
        GlobalModelStore.Snapshot base = store.latest();
        long collectionDeadline = QuorumCollector.deadlineAfter(cfg.timeouts.collectionMs);
        long collectionDeadlineMs = System.currentTimeMillis() + cfg.timeouts.collectionMs;
        RoundAnnouncement.Builder ann = RoundAnnouncement.newBuilder()
                .setRound(r.number)
                .setDeadlineMs(collectionDeadlineMs)
                .setBaseVersion(base.version());
        for (DeploymentConfig.FogMember fog : cfg.fogNodes) {
            ann.addFogNodes(FogAssignment.newBuilder().setFogId(fog.id).setIndex(fog.index));
        }
        SignedMessage annEnv = out.sign(Domains.ANNOUNCEMENT, MessageTypes.ROUND_ANNOUNCEMENT, ann.build(), r.number);
        synchronized (this) {
            r.expected = Set.copyOf(readyFacilities);
            r.collectionDeadlineMs = collectionDeadlineMs;
            r.state = RoundState.COLLECTING;
        }
        Set<String> announced = accepted(out.announce(readyFacilities, annEnv, collectionDeadline));
        r.downloadBytes.addAndGet((long) annEnv.getSerializedSize() * readyFacilities.size());
        log.info("Round {} COLLECTING from {} of {} ready facilities until +{}ms",
                r.number, announced.size(), readyFacilities.size(), cfg.timeouts.collectionMs);
        r.notices.await(m -> m.keySet().containsAll(announced), collectionDeadline);
        Map<String, SubmissionNotice> notices = r.notices.close();

        List<String> participants = new ArrayList<>(new TreeSet<>(notices.entrySet().stream()
                .filter(e -> e.getValue().getAckedFogIndicesCount() >= t)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList())));
        synchronized (this) {
            r.participants = List.copyOf(participants);
        }
        if (participants.size() < cfg.protocol.minParticipants) {
            throw new RoundAbortedException(r.number, Reason.INSUFFICIENT_PARTICIPANTS,
                    participants.size() + " participants with >= " + t + " delivered shares, need " + cfg.protocol.minParticipants);
        }

        // FogReconstructing.
        long fogDeadline = QuorumCollector.deadlineAfter(cfg.timeouts.fogMs);
        synchronized (this) {
            r.participantDigest = Digests.idSetDigest(participants);
            r.state = RoundState.FOG_RECONSTRUCTING;
        }
        CollectionClose close = CollectionClose.newBuilder().setRound(r.number).addAllParticipants(participants).build();
        SignedMessage closeEnv = out.sign(Domains.CLOSE, MessageTypes.COLLECTION_CLOSE, close, r.number);
        log.info("Round {} FOG_RECONSTRUCTING over {} participants {}", r.number, participants.size(), participants);
        out.closeCollection(fogIds, closeEnv, fogDeadline);
        r.downloadBytes.addAndGet((long) closeEnv.getSerializedSize() * fogIds.size());
        r.partials.awaitCount(t, fogDeadline);
        Map<String, FogPartialSum> partials = r.partials.close();
        if (partials.size() < t) {
            throw new RoundAbortedException(r.number, Reason.INSUFFICIENT_PARTIAL_SUMS,
                    partials.size() + " partial sums before deadline, need " + t);
        }
        double[] update = reconstructAverage(r, partials.values(), participants.size());

        // Validating.
        byte[] candidateHash = Digests.vectorHash(update);
        ByteString candidate = ByteString.copyFrom(candidateHash);
        ValidationRequest.Builder vr = ValidationRequest.newBuilder()
                .setRound(r.number)
                .setCandidateHash(candidate)
                .setBaseVersion(base.version())
                .setBaseModelHash(ByteString.copyFrom(base.hash()))
                .setParticipantCount(participants.size());
        for (double v : update) vr.addValues(v);
        SignedMessage vrEnv = out.sign(Domains.VALIDATION, MessageTypes.VALIDATION_REQUEST, vr.build(), r.number);
        synchronized (this) {
            r.state = RoundState.VALIDATING;
        }
        log.info("Round {} VALIDATING candidate over {} participants from fogs {}", r.number, participants.size(), r.fogIndices);
        int validators = validatorIds.size();
        long votingDeadline = QuorumCollector.deadlineAfter(cfg.timeouts.votingMs);
        QuorumCollector<CastVote> votes = new QuorumCollector<>();
        out.requestVotes(validatorIds, vrEnv, votingDeadline, (id, env) -> {
            r.uploadBytes.addAndGet(env.getSerializedSize());
            CastVote cast = checkVote(id, env, r.number, candidate);
            if (cast != null) votes.offer(id, cast);
        });
        r.downloadBytes.addAndGet((long) vrEnv.getSerializedSize() * validators);
        votes.await(m -> m.size() == validators || accepts(m) >= quorum || m.size() - accepts(m) > validators - quorum,
                votingDeadline);
        Map<String, CastVote> tally = votes.close();
        List<SignedMessage> certificate = new ArrayList<>();
        List<String> dissent = new ArrayList<>();
        for (var e : tally.entrySet()) {
            if (e.getValue().vote().getAccept()) {
                certificate.add(e.getValue().envelope());
            } else {
                dissent.add(e.getKey() + ": " + e.getValue().vote().getReason());
            }
        }
        if (certificate.size() < quorum) {
            if (dissent.size() > validators - quorum) {
                throw new ValidationRejectedException(r.number, dissent,
                        dissent.size() + " of " + validators + " validators rejected the candidate");
            }
            throw new RoundAbortedException(r.number, Reason.INSUFFICIENT_VOTES,
                    certificate.size() + " accepting votes of " + tally.size() + " received, need " + quorum);
        }
        var certCheck = VoteCertificateValidator.validate(certificate, r.number, candidate, node.keys, validators);
        if (!certCheck.ok()) {
            throw new RoundAbortedException(r.number, Reason.INSUFFICIENT_VOTES, "vote certificate: " + certCheck.reason());
        }
        if (!dissent.isEmpty()) log.info("Round {} accepted despite dissent {}", r.number, dissent);

        // Finalizing.
        synchronized (this) {
            r.state = RoundState.FINALIZING;
        }
        long version = base.version() + 1;
        double[] params = new double[update.length];
        for (int i = 0; i < params.length; i++) params[i] = base.parameters()[i] + update[i];
        GlobalModelEnvelope envelope;
        SignedMessage commitEnv;
        try {
            ModelParameters.Builder mp = ModelParameters.newBuilder().setVersion(version);
            for (double v : params) mp.addValues(v);
            for (double v : update) mp.addUpdate(v);
            AttributeKeyBundle bundle = policyKeys(r.number);
            Map<String, byte[]> epochKeys = new HashMap<>();
            for (AttributeKey k : bundle.getKeysList()) epochKeys.put(k.getAttribute(), k.getKey().toByteArray());
            AbeCiphertext ct = cipher.encrypt(policy, bundle.getEpoch(), epochKeys, mp.build().toByteArray());
            envelope = GlobalModelEnvelope.newBuilder()
                    .setVersion(version)
                    .setRound(r.number)
                    .setModelHash(ByteString.copyFrom(Digests.vectorHash(params)))
                    .setCandidateHash(candidate)
                    .setCiphertext(ct)
                    .addAllVotes(certificate)
                    .build();
            CommitNotice.Builder cn = CommitNotice.newBuilder()
                    .setRound(r.number)
                    .setVersion(version)
                    .setCandidateHash(candidate)
                    .addAllVotes(certificate);
            for (double v : params) cn.addParameters(v);
            commitEnv = out.sign(Domains.COMMIT, MessageTypes.COMMIT_NOTICE, cn.build(), r.number);
            store.install(version, r.number, params, envelope, commitEnv);
        } catch (Exception e) {
            throw new RoundAbortedException(r.number, Reason.FINALIZATION_FAILED, e.toString());
        }
        log.info("Round {} FINALIZED version {} (accepts {}/{}, policy '{}')",
                r.number, version, certificate.size(), validators, policy);

        // Broadcasting.
        synchronized (this) {
            r.state = RoundState.BROADCASTING;
        }
        long broadcastDeadline = QuorumCollector.deadlineAfter(cfg.timeouts.broadcastMs);
        Set<String> delivered = accepted(out.deliver(roster, envelope, broadcastDeadline));
        Set<String> committed = accepted(out.commit(validatorIds, commitEnv, broadcastDeadline));
        r.downloadBytes.addAndGet((long) envelope.getSerializedSize() * roster.size()
                + (long) commitEnv.getSerializedSize() * validators);
        log.info("Round {} BROADCAST version {} to {}/{} facilities, {}/{} validators",
                r.number, version, delivered.size(), roster.size(), committed.size(), validators);
        return new RoundRecord(r.number, RoundRecord.Outcome.FINALIZED,
                "accepted by " + certificate.size() + "/" + validators, version, participants, r.fogIndices, dissent,
                r.uploadBytes.get(), r.downloadBytes.get());
    }

    private List<String> roster(long round, long deadlineNanos) throws RoundAbortedException {
        IdentityList ids;
        try {
            ids = out.listIdentities(deadlineNanos);
        } catch (Exception e) {
            throw new RoundAbortedException(round, Reason.NOT_READY, "authority unreachable: " + e.getMessage());
        }
        List<String> roster = new ArrayList<>();
        for (SignedMessage certEnv : ids.getCertificatesList()) {
            var cert = MessageDecoder.decodeCertificate(certEnv, node.keys);
            if (!cert.ok()) {
                log.warn("Round {} ignoring identity with bad certificate: {}", round, cert.validation());
                continue;
            }
            String id = cert.message().getFacilityId();
            if (cfg.facility(id).isPresent() && !ids.getRevokedList().contains(id)) roster.add(id);
        }
        return roster;
    }

    private AttributeKeyBundle policyKeys(long round) throws Exception {
        PolicyKeysRequest req = PolicyKeysRequest.newBuilder().setRequesterId(node.nodeId).build();
        SignedMessage env = out.sign(Domains.POLICY_KEYS, MessageTypes.POLICY_KEYS_REQUEST, req, round);
        return out.policyKeys(env, QuorumCollector.deadlineAfter(cfg.timeouts.rpcDeadlineMs));
    }

    /** Lagrange at zero over the t lowest-indexed partial sums, decoded and divided by k. */
    private double[] reconstructAverage(Round r, Collection<FogPartialSum> partials, int k)
            throws RoundAbortedException {
        List<FogPartialSum> chosen = partials.stream()
                .sorted(Comparator.comparingInt(FogPartialSum::getFogIndex))
                .limit(cfg.protocol.threshold)
                .collect(Collectors.toList());
        List<VectorShare> shares = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (FogPartialSum p : chosen) {
            shares.add(VectorShare.fromWire(p.getFogIndex(), p.getValuesList()));
            indices.add(p.getFogIndex());
        }
        synchronized (this) {
            r.fogIndices = List.copyOf(indices);
        }
        BigInteger[] sum;
        try {
            sum = sharing.reconstruct(shares);
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new RoundAbortedException(r.number, Reason.RECONSTRUCTION_FAILED, "interpolation over " + indices + ": " + e.getMessage());
        }
        double[] total = codec.decode(sum);
        double[] avg = new double[total.length];
        for (int i = 0; i < total.length; i++) {
            avg[i] = total[i] / k;
            if (!Double.isFinite(avg[i])) {
                throw new RoundAbortedException(r.number, Reason.RECONSTRUCTION_FAILED, "non-finite coordinate " + i);
            }
        }
        return avg;
    }

    private CastVote checkVote(String validatorId, SignedMessage env, long round, ByteString candidate) {
        var d = MessageDecoder.decode(env, MessageTypes.VOTE, Domains.VOTE, node.keys, KeyRegistry.Role.VALIDATOR, Vote.parser());
        if (!d.ok()) {
            log.warn("Round {} discarding vote from {}: {}", round, validatorId, d.validation());
            return null;
        }
        Vote v = d.message();
        if (!d.signerId().equals(validatorId) || !v.getValidatorId().equals(validatorId)) {
            log.warn("Round {} discarding vote from {}: signed as {}", round, validatorId, d.signerId());
            return null;
        }
        if (v.getRound() != round || !v.getCandidateHash().equals(candidate)) {
            log.warn("Round {} discarding vote from {}: wrong round or candidate", round, validatorId);
            return null;
        }
        return new CastVote(v, env);
    }

    private static int accepts(Map<String, CastVote> m) {
        int n = 0;
        for (CastVote c : m.values()) if (c.vote().getAccept()) n++;
        return n;
    }

    private static List<String> ready(Map<String, Boolean> probes, List<String> ids) {
        return ids.stream().filter(id -> Boolean.TRUE.equals(probes.get(id))).collect(Collectors.toList());
    }

    private static Set<String> accepted(Map<String, Ack> acks) {
        return acks.entrySet().stream().filter(e -> e.getValue().getAccepted()).map(Map.Entry::getKey).collect(Collectors.toSet());
    }

    /**
     * The round a message belongs to, or null when it names a round the leader never started.
     *
     * @throws StaleMessageException for rounds already closed
     */
    private Round roundFor(long messageRound) throws StaleMessageException {
        if (active == null) {
            if (messageRound <= lastRound) throw new StaleMessageException(messageRound, lastRound);
            return null;
        }
        if (messageRound < active.number) throw new StaleMessageException(messageRound, active.number);
        if (messageRound > active.number) return null;
        return active;
    }

    public synchronized Ack onNotice(CertifiedMessage cm) {
        var d = MessageDecoder.decodeCertified(cm, MessageTypes.SUBMISSION_NOTICE, Domains.NOTICE, node.keys, SubmissionNotice.parser());
        if (!d.ok()) return RpcSupport.refused(d.validation().code() + ": " + d.validation().reason());
        SubmissionNotice n = d.message();
        if (!n.getFacilityId().equals(d.signerId())) return RpcSupport.refused("facility id does not match signer");
        Round r;
        try {
            r = roundFor(n.getRound());
        } catch (StaleMessageException e) {
            log.debug("Drop stale notice from {}: {}", n.getFacilityId(), e.getMessage());
            return RpcSupport.refused(e.getMessage());
        }
        if (r == null) return RpcSupport.refused("unknown round " + n.getRound());
        if (r.state != RoundState.COLLECTING) return RpcSupport.refused("round " + r.number + " not collecting (" + r.state + ")");
        if (!r.expected.contains(n.getFacilityId())) return RpcSupport.refused(n.getFacilityId() + " not on round " + r.number + " roster");
        switch (r.notices.offer(n.getFacilityId(), n)) {
            case CLOSED:
                return RpcSupport.refused(new StaleMessageException(n.getRound(), r.number).getMessage());
            case DUPLICATE:
                return RpcSupport.refused("duplicate notice from " + n.getFacilityId());
            default:
                r.uploadBytes.addAndGet(cm.getSerializedSize());
                log.debug("Round {} notice from {} acked fogs {}", r.number, n.getFacilityId(), n.getAckedFogIndicesList());
                return RpcSupport.accepted();
        }
    }

    public synchronized Ack onPartialSum(SignedMessage env) {
        var d = MessageDecoder.decode(env, MessageTypes.FOG_PARTIAL_SUM, Domains.PARTIAL_SUM, node.keys,
                KeyRegistry.Role.FOG, FogPartialSum.parser());
        if (!d.ok()) return RpcSupport.refused(d.validation().code() + ": " + d.validation().reason());
        FogPartialSum p = d.message();
        if (!p.getFogId().equals(d.signerId())) return RpcSupport.refused("fog id does not match signer");
        Round r;
        try {
            r = roundFor(p.getRound());
        } catch (StaleMessageException e) {
            log.debug("Drop stale partial sum from {}: {}", p.getFogId(), e.getMessage());
            return RpcSupport.refused(e.getMessage());
        }
        if (r == null) return RpcSupport.refused("unknown round " + p.getRound());
        if (r.state != RoundState.FOG_RECONSTRUCTING) return RpcSupport.refused("round " + r.number + " not reconstructing (" + r.state + ")");
        int index = cfg.fog(p.getFogId()).map(f -> f.index).orElse(-1);
        if (index != p.getFogIndex()) return RpcSupport.refused("fog " + p.getFogId() + " claims index " + p.getFogIndex());
        if (p.getParticipantCount() != r.participants.size()
                || !Arrays.equals(p.getParticipantDigest().toByteArray(), r.participantDigest)) {
            return RpcSupport.refused("partial sum over a different participant set");
        }
        if (p.getValuesCount() != cfg.protocol.modelDimension) return RpcSupport.refused("dimension " + p.getValuesCount());
        switch (r.partials.offer(p.getFogId(), p)) {
            case CLOSED:
                return RpcSupport.refused(new StaleMessageException(p.getRound(), r.number).getMessage());
            case DUPLICATE:
                return RpcSupport.refused("duplicate partial sum from " + p.getFogId());
            default:
                r.uploadBytes.addAndGet(env.getSerializedSize());
                log.info("Round {} partial sum from {} (index {}), {} held", r.number, p.getFogId(), p.getFogIndex(), r.partials.size());
                return RpcSupport.accepted();
        }
    }

    public synchronized LeaderStatus status() {
        LeaderStatus.Builder b = LeaderStatus.newBuilder()
                .setActiveRound(active == null ? 0L : active.number)
                .setState(active == null ? RoundState.IDLE.name() : active.state.name())
                .setModelVersion(store.latestVersion())
                .setTotalUploadBytes(totalUploadBytes)
                .setTotalDownloadBytes(totalDownloadBytes);
        for (RoundRecord rec : history) b.addHistory(rec.toProto());
        return b.build();
    }

    public synchronized List<RoundRecord> history() {
        return List.copyOf(history);
    }

    public void close() {
        roundThread.shutdownNow();
    }
}
