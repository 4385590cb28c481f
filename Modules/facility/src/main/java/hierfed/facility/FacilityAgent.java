package hierfed.facility;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import hierfed.common.abe.AbeCipher;
import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Digests;
import hierfed.common.crypto.Domains;
import hierfed.common.error.AccessDeniedException;
import hierfed.common.error.StaleMessageException;
import hierfed.common.net.Backoff;
import hierfed.common.net.PeerChannels;
import hierfed.common.pow.ProofOfWork;
import hierfed.common.privacy.GaussianMechanism;
import hierfed.common.privacy.PrivacyAccountant;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.sharing.FixedPointCodec;
import hierfed.common.sharing.PrimeField;
import hierfed.common.sharing.ShamirSharing;
import hierfed.common.sharing.VectorShare;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.common.validation.VoteCertificateValidator;
import hierfed.proto.AbeCiphertext;
import hierfed.proto.Ack;
import hierfed.proto.AttributeKey;
import hierfed.proto.AttributeKeyBundle;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.Challenge;
import hierfed.proto.ChallengeRequest;
import hierfed.proto.Empty;
import hierfed.proto.FacilityRegistration;
import hierfed.proto.FacilityStatus;
import hierfed.proto.FogAssignment;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.KeyRefreshRequest;
import hierfed.proto.ModelParameters;
import hierfed.proto.RegistrationReply;
import hierfed.proto.RegistrationRequest;
import hierfed.proto.RoundAnnouncement;
import hierfed.proto.ShareSubmission;
import hierfed.proto.SignedMessage;
import hierfed.proto.SubmissionNotice;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A data-holding facility. Its raw records and its clear update never leave this object: what
 * goes out is one Shamir share of the noised update per fog node, plus a receipt to the leader.
 */
public final class FacilityAgent {
    private static final Logger log = LoggerFactory.getLogger(FacilityAgent.class);

    private final RpcSupport.NodeInfo node;
    private final DeploymentConfig cfg;
    private final PublicKey publicKey;
    private final PeerChannels peers;
    private final LocalTrainer trainer;
    private final GaussianMechanism mechanism;
    private final FixedPointCodec codec;
    private final ShamirSharing sharing;
    private final AbeCipher cipher;
    private final PrivacyAccountant<Map<Integer, VectorShare>> accountant = new PrivacyAccountant<>();
    private final ExecutorService submitter = Executors.newSingleThreadExecutor(RpcSupport.daemonThreads("facility-submit"));
    private final ExecutorService sendPool;
    private final Object registrationLock = new Object();

    private SignedMessage certificate;
    private List<String> attributes = List.of();
    private Map<String, byte[]> attributeKeys = Map.of();
    private long keyEpoch;
    private List<double[]> records = List.of();
    private boolean armed;
    private long lastSubmittedRound;
    private long modelVersion = 1L;
    private double[] model;

    public FacilityAgent(RpcSupport.NodeInfo node, PublicKey publicKey, PeerChannels peers,
                         LocalTrainer trainer, RandomGenerator noise) {
        this.node = node;
        this.cfg = node.cfg;
        cfg.facility(node.nodeId)
                .orElseThrow(() -> new IllegalStateException("Config invalid: nodeId " + node.nodeId + " not present in facilities"));
        this.publicKey = publicKey;
        this.peers = peers;
        this.trainer = trainer;
        DeploymentConfig.Privacy p = cfg.protocol.privacy;
        this.mechanism = new GaussianMechanism(p.epsilon, p.delta, p.clipNorm, noise);
        SecureRandom rng = new SecureRandom();
        PrimeField field = PrimeField.standard();
        this.codec = new FixedPointCodec(field, cfg.protocol.fixedPointBits);
        this.sharing = new ShamirSharing(field, cfg.protocol.threshold, rng);
        this.cipher = new AbeCipher(rng);
        this.sendPool = Executors.newFixedThreadPool(Math.max(2, cfg.fogNodes.size()), RpcSupport.daemonThreads("facility-send"));
        this.model = new double[cfg.protocol.modelDimension];
    }

    /**
     * Solves the authority's proof-of-work challenge and registers with the configured attributes.
     * A facility that is already registered returns its registration unchanged.
     *
     * @throws StatusRuntimeException carrying the authority's rejection
     */
    public FacilityRegistration register() throws GeneralSecurityException {
        synchronized (registrationLock) {
            synchronized (this) {
                if (certificate != null) return registration();
            }
            String id = node.nodeId;
            Challenge ch = peers.authority().withDeadlineAfter(cfg.timeouts.rpcDeadlineMs, TimeUnit.MILLISECONDS)
                    .issueChallenge(ChallengeRequest.newBuilder().setFacilityId(id).build());
            long started = System.nanoTime();
            long nonce = ProofOfWork.solve(id, ch.getChallenge().toByteArray(), ch.getDifficultyBits());
            log.info("Facility {} solved {}-bit challenge in {}ms (nonce {})", id, ch.getDifficultyBits(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), nonce);
            RegistrationRequest req = RegistrationRequest.newBuilder()
                    .setFacilityId(id)
                    .setPublicKey(ByteString.copyFrom(publicKey.getEncoded()))
                    .addAllAttributes(cfg.facility(id).orElseThrow().attributes)
                    .setChallenge(ch.getChallenge())
                    .setNonce(nonce)
                    .build();
            SignedMessage env = SignedMessagePacker.pack(Domains.REGISTRATION, MessageTypes.REGISTRATION_REQUEST, req, id, 0L, node.sk);
            RegistrationReply reply = peers.authority().withDeadlineAfter(cfg.timeouts.rpcDeadlineMs, TimeUnit.MILLISECONDS)
                    .register(env);
            var cert = MessageDecoder.decodeCertificate(reply.getCertificate(), node.keys);
            if (!cert.ok() || !cert.message().getFacilityId().equals(id)) {
                throw new GeneralSecurityException("authority returned an invalid certificate: " + cert.validation());
            }
            synchronized (this) {
                certificate = reply.getCertificate();
                attributes = List.copyOf(cert.message().getAttributesList());
                installKeys(reply.getKeys());
                log.info("Facility {} registered attributes={} key epoch {}", id, attributes, keyEpoch);
                return registration();
            }
        }
    }

    /** Fetches current-epoch attribute keys. Returns the new epoch. */
    public long refreshKeys() throws GeneralSecurityException {
        long known;
        synchronized (this) {
            if (certificate == null) throw new IllegalStateException("not registered");
            known = keyEpoch;
        }
        KeyRefreshRequest req = KeyRefreshRequest.newBuilder().setFacilityId(node.nodeId).setKnownEpoch(known).build();
        SignedMessage env = SignedMessagePacker.pack(Domains.KEY_REFRESH, MessageTypes.KEY_REFRESH_REQUEST, req, node.nodeId, 0L, node.sk);
        AttributeKeyBundle bundle = peers.authority().withDeadlineAfter(cfg.timeouts.rpcDeadlineMs, TimeUnit.MILLISECONDS)
                .refreshKeys(env);
        synchronized (this) {
            installKeys(bundle);
            log.info("Facility {} key epoch {} -> {}", node.nodeId, known, keyEpoch);
            return keyEpoch;
        }
    }

    private void installKeys(AttributeKeyBundle bundle) {
        Map<String, byte[]> keys = new HashMap<>();
        for (AttributeKey k : bundle.getKeysList()) keys.put(k.getAttribute(), k.getKey().toByteArray());
        attributeKeys = Map.copyOf(keys);
        keyEpoch = bundle.getEpoch();
    }

    /**
     * Loads the local data for the next round. An empty delta arms the facility with no records,
     * which yields a zero update.
     *
     * @return number of records loaded
     * @throws IllegalArgumentException if the data is not a whole number of records
     */
    public synchronized int arm(byte[] data) {
        List<double[]> parsed = RecordCodec.decode(data, cfg.protocol.modelDimension);
        records = parsed;
        armed = true;
        log.info("Facility {} armed with {} records", node.nodeId, parsed.size());
        return parsed.size();
    }

    public synchronized boolean ready() {
        return certificate != null && armed;
    }

    /**
     * Accepts a leader-signed round announcement and submits asynchronously. A repeated
     * announcement of the round already spent resends the same shares.
     */
    public Ack onAnnouncement(SignedMessage env) {
        var d = MessageDecoder.decode(env, MessageTypes.ROUND_ANNOUNCEMENT, Domains.ANNOUNCEMENT,
                node.keys, KeyRegistry.Role.LEADER, RoundAnnouncement.parser());
        if (!d.ok()) return RpcSupport.refused(d.validation().code() + ": " + d.validation().reason());
        RoundAnnouncement ann = d.message();
        synchronized (this) {
            if (certificate == null) return RpcSupport.refused("not registered");
            long spent = accountant.lastSpentRound();
            if (ann.getRound() < spent) return RpcSupport.refused(new StaleMessageException(ann.getRound(), spent).getMessage());
            if (ann.getRound() > spent && !armed) return RpcSupport.refused("no local data armed");
            if (ann.getFogNodesCount() < cfg.protocol.threshold) return RpcSupport.refused("fewer fog nodes than threshold");
        }
        submitter.execute(() -> submit(ann));
        return RpcSupport.accepted();
    }

    private void submit(RoundAnnouncement ann) {
        long round = ann.getRound();
        try {
            if (ann.getBaseVersion() > modelVersion()) syncModel();
            Map<Integer, VectorShare> shares = accountant.spendOnce(round, () -> prepare(ann));
            if (shares == null) {
                log.warn("Facility {} refuses round {}: privacy budget already spent on round {}",
                        node.nodeId, round, accountant.lastSpentRound());
                return;
            }
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, ann.getDeadlineMs() - System.currentTimeMillis()));
            long deadline = System.nanoTime() + remainingNanos;
            long shareDeadline = System.nanoTime() + remainingNanos * 3 / 4;
            SignedMessage cert;
            synchronized (this) {
                cert = certificate;
            }
            List<Integer> acked = sendShares(ann, shares, cert, shareDeadline);
            SubmissionNotice notice = SubmissionNotice.newBuilder()
                    .setRound(round)
                    .setFacilityId(node.nodeId)
                    .addAllAckedFogIndices(acked)
                    .build();
            CertifiedMessage cm = CertifiedMessage.newBuilder()
                    .setMessage(SignedMessagePacker.pack(Domains.NOTICE, MessageTypes.SUBMISSION_NOTICE, notice, node.nodeId, round, node.sk))
                    .setCertificate(cert)
                    .build();
            Ack ack = Backoff.retryUntil("SubmitNotice", deadline, cfg.timeouts.retryBaseMs, () ->
                    peers.leader().withDeadlineAfter(Backoff.remainingMs(deadline, cfg.timeouts.rpcDeadlineMs), TimeUnit.MILLISECONDS)
                            .submitNotice(cm));
            if (ack.getAccepted()) {
                synchronized (this) {
                    lastSubmittedRound = Math.max(lastSubmittedRound, round);
                }
                log.info("Facility {} submitted round {} to fogs {}", node.nodeId, round, acked);
            } else {
                log.warn("Facility {} notice for round {} refused: {}", node.nodeId, round, ack.getReason());
            }
        } catch (StatusRuntimeException e) {
            log.warn("Facility {} could not complete round {}: {}", node.nodeId, round, e.getStatus());
        } catch (Exception e) {
            log.error("Facility {} submission for round {} failed", node.nodeId, round, e);
        }
    }

    /** Trains, clips, noises and splits. Consumes the armed records. */
    private Map<Integer, VectorShare> prepare(RoundAnnouncement ann) {
        double[] base;
        List<double[]> recs;
        synchronized (this) {
            base = model.clone();
            recs = records;
            records = List.of();
            armed = false;
        }
        double[] update = trainer.computeUpdate(base, recs);
        double[] noised = mechanism.privatize(update);
        BigInteger[] secret = codec.encode(noised);
        int[] points = ann.getFogNodesList().stream().mapToInt(FogAssignment::getIndex).toArray();
        Map<Integer, VectorShare> out = new LinkedHashMap<>();
        for (VectorShare s : sharing.split(secret, points)) out.put(s.x(), s);
        log.info("Facility {} round {}: {} records, update norm {} clipped to {}, sigma {}",
                node.nodeId, ann.getRound(), recs.size(), String.format("%.4f", GaussianMechanism.l2Norm(update)),
                cfg.protocol.privacy.clipNorm, String.format("%.4f", mechanism.sigma()));
        return out;
    }

    private List<Integer> sendShares(RoundAnnouncement ann, Map<Integer, VectorShare> shares, SignedMessage cert, long deadline) {
        long round = ann.getRound();
        Map<Integer, CompletableFuture<Boolean>> futures = new LinkedHashMap<>();
        for (FogAssignment fa : ann.getFogNodesList()) {
            VectorShare share = shares.get(fa.getIndex());
            if (share == null) continue;
            futures.put(fa.getIndex(), CompletableFuture.supplyAsync(() -> {
                try {
                    ShareSubmission sub = ShareSubmission.newBuilder()
                            .setRound(round)
                            .setFacilityId(node.nodeId)
                            .setFogIndex(fa.getIndex())
                            .addAllValues(share.toWire())
                            .build();
                    CertifiedMessage cm = CertifiedMessage.newBuilder()
                            .setMessage(SignedMessagePacker.pack(Domains.SHARE, MessageTypes.SHARE_SUBMISSION, sub, node.nodeId, round, node.sk))
                            .setCertificate(cert)
                            .build();
                    Ack a = Backoff.retryUntil("SubmitShare->" + fa.getFogId(), deadline, cfg.timeouts.retryBaseMs, () ->
                            peers.fog(fa.getFogId()).withDeadlineAfter(Backoff.remainingMs(deadline, cfg.timeouts.rpcDeadlineMs), TimeUnit.MILLISECONDS)
                                    .submitShare(cm));
                    if (!a.getAccepted()) log.warn("Facility {} share to {} refused: {}", node.nodeId, fa.getFogId(), a.getReason());
                    return a.getAccepted();
                } catch (StatusRuntimeException e) {
                    log.warn("Facility {} share to {} failed: {}", node.nodeId, fa.getFogId(), e.getStatus().getCode());
                    return false;
                } catch (Exception e) {
                    log.warn("Facility {} share to {} failed: {}", node.nodeId, fa.getFogId(), e.toString());
                    return false;
                }
            }, sendPool));
        }
        List<Integer> acked = new ArrayList<>();
        for (var e : futures.entrySet()) {
            try {
                if (e.getValue().get(Math.max(1L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) acked.add(e.getKey());
            } catch (TimeoutException | ExecutionException ex) {
                log.debug("Facility {} share for index {} not acknowledged in time", node.nodeId, e.getKey());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return acked;
    }

    /** Pulls the latest finalized model from the leader, used when an announcement names a newer base. */
    private void syncModel() {
        try {
            GlobalModelEnvelope env = peers.leader().withDeadlineAfter(cfg.timeouts.rpcDeadlineMs, TimeUnit.MILLISECONDS)
                    .getGlobalModel(Empty.getDefaultInstance());
            Ack ack = onGlobalModel(env);
            if (!ack.getAccepted()) log.warn("Facility {} could not install pulled model: {}", node.nodeId, ack.getReason());
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() != Status.Code.NOT_FOUND) {
                log.warn("Facility {} model pull failed: {}", node.nodeId, e.getStatus());
            }
        }
    }

    /**
     * Installs a finalized model after checking its vote certificate, decrypting it with this
     * facility's attribute keys and matching both hashes. Keys from an older epoch are refreshed once.
     */
    public Ack onGlobalModel(GlobalModelEnvelope env) {
        synchronized (this) {
            if (certificate == null) return RpcSupport.refused("not registered");
            if (env.getVersion() <= modelVersion) return RpcSupport.refused("already at version " + modelVersion);
        }
        var certCheck = VoteCertificateValidator.validate(env.getVotesList(), env.getRound(), env.getCandidateHash(),
                node.keys, cfg.validators.size());
        if (!certCheck.ok()) {
            log.warn("Facility {} REJECT model v{}: {}", node.nodeId, env.getVersion(), certCheck.reason());
            return RpcSupport.refused("vote certificate: " + certCheck.reason());
        }
        ModelParameters mp;
        try {
            mp = ModelParameters.parseFrom(decrypt(env.getCiphertext()));
        } catch (AccessDeniedException e) {
            log.warn("Facility {} cannot read model v{}: {}", node.nodeId, env.getVersion(), e.getMessage());
            return RpcSupport.refused("access denied: " + e.getMessage());
        } catch (InvalidProtocolBufferException e) {
            return RpcSupport.refused("malformed model parameters");
        } catch (GeneralSecurityException | StatusRuntimeException e) {
            log.warn("Facility {} failed to decrypt model v{}: {}", node.nodeId, env.getVersion(), e.toString());
            return RpcSupport.refused("decryption failed: " + e.getMessage());
        }
        double[] values = mp.getValuesList().stream().mapToDouble(Double::doubleValue).toArray();
        if (mp.getVersion() != env.getVersion() || values.length != cfg.protocol.modelDimension) {
            return RpcSupport.refused("model parameters do not match envelope");
        }
        if (!Arrays.equals(Digests.vectorHash(mp.getUpdateList()), env.getCandidateHash().toByteArray())) {
            return RpcSupport.refused("update does not match the validated candidate");
        }
        if (!Arrays.equals(Digests.vectorHash(values), env.getModelHash().toByteArray())) {
            return RpcSupport.refused("model hash mismatch");
        }
        synchronized (this) {
            if (mp.getVersion() <= modelVersion) return RpcSupport.refused("already at version " + modelVersion);
            model = values;
            modelVersion = mp.getVersion();
        }
        log.info("Facility {} installed global model version {} (round {})", node.nodeId, env.getVersion(), env.getRound());
        return RpcSupport.accepted();
    }

    private byte[] decrypt(AbeCiphertext ct) throws AccessDeniedException, GeneralSecurityException {
        Map<String, byte[]> keys;
        long epoch;
        synchronized (this) {
            keys = attributeKeys;
            epoch = keyEpoch;
        }
        try {
            return cipher.decrypt(ct, keys, epoch);
        } catch (AccessDeniedException e) {
            if (!e.staleEpoch()) throw e;
            log.info("Facility {} holds epoch {} keys, model is at epoch {}; refreshing", node.nodeId, epoch, ct.getEpoch());
            refreshKeys();
            synchronized (this) {
                keys = attributeKeys;
                epoch = keyEpoch;
            }
            return cipher.decrypt(ct, keys, epoch);
        }
    }

    public synchronized FacilityRegistration registration() {
        return FacilityRegistration.newBuilder()
                .setFacilityId(node.nodeId)
                .setRegistered(certificate != null)
                .addAllAttributes(attributes)
                .setKeyEpoch(keyEpoch)
                .build();
    }

    public synchronized FacilityStatus status() {
        return FacilityStatus.newBuilder()
                .setFacilityId(node.nodeId)
                .setRegistered(certificate != null)
                .setArmed(armed)
                .setLastSubmittedRound(lastSubmittedRound)
                .setModelVersion(modelVersion)
                .setRecords(records.size())
                .setKeyEpoch(keyEpoch)
                .build();
    }

    public synchronized long modelVersion() { return modelVersion; }

    public synchronized double[] model() { return model.clone(); }

    public synchronized long lastSubmittedRound() { return lastSubmittedRound; }

    public void close() {
        submitter.shutdownNow();
        sendPool.shutdownNow();
    }
}
