package hierfed.server.leader;

import com.google.protobuf.MessageLite;
import hierfed.common.net.Backoff;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.proto.Ack;
import hierfed.proto.AttributeKeyBundle;
import hierfed.proto.Empty;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.IdentityList;
import hierfed.proto.ReadyRequest;
import hierfed.proto.SignedMessage;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;

/**
 * Everything the leader sends. Calls to several peers run in parallel on a shared pool; each
 * call retries transient failures until the phase deadline passed in by the caller.
 */
public final class LeaderOutbound {
    private static final Logger log = LoggerFactory.getLogger(LeaderOutbound.class);

    /** Per-peer call; a non-null return is the peer's answer. */
    @FunctionalInterface
    interface PeerCall<T> {
        T call(String peerId, long perCallMs) throws Exception;
    }

    private final RpcSupport.NodeInfo node;
    private final PeerChannels peers;
    private final ExecutorService pool;
    private final long rpcDeadlineMs;
    private final long retryBaseMs;

    public LeaderOutbound(RpcSupport.NodeInfo node, PeerChannels peers) {
        this.node = node;
        this.peers = peers;
        int threads = Integer.getInteger("hierfed.outboundThreads", 16);
        this.pool = Executors.newFixedThreadPool(threads, RpcSupport.daemonThreads("leader-out"));
        this.rpcDeadlineMs = node.cfg.timeouts.rpcDeadlineMs;
        this.retryBaseMs = node.cfg.timeouts.retryBaseMs;
    }

    public SignedMessage sign(String domain, String typeUrl, MessageLite msg, long round) throws GeneralSecurityException {
        return SignedMessagePacker.pack(domain, typeUrl, msg, node.nodeId, round, node.sk);
    }

    public IdentityList listIdentities(long deadlineNanos) throws Exception {
        return Backoff.retryUntil("ListIdentities", deadlineNanos, retryBaseMs, () ->
                peers.authority().withDeadlineAfter(Backoff.remainingMs(deadlineNanos, rpcDeadlineMs), TimeUnit.MILLISECONDS)
                        .listIdentities(Empty.getDefaultInstance()));
    }

    public AttributeKeyBundle policyKeys(SignedMessage request, long deadlineNanos) throws Exception {
        return Backoff.retryUntil("GetPolicyKeys", deadlineNanos, retryBaseMs, () ->
                peers.authority().withDeadlineAfter(Backoff.remainingMs(deadlineNanos, rpcDeadlineMs), TimeUnit.MILLISECONDS)
                        .getPolicyKeys(request));
    }

    /** Ids whose readiness probe answered ready before the deadline. */
    public Map<String, Boolean> probe(Collection<String> ids, long round, long deadlineNanos) {
        ReadyRequest req = ReadyRequest.newBuilder().setRequesterId(node.nodeId).setRound(round).build();
        return fanOut("Ready", ids, deadlineNanos, (id, ms) ->
                peers.readiness(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).ready(req).getReady());
    }

    public Map<String, Ack> announce(Collection<String> facilities, SignedMessage announcement, long deadlineNanos) {
        return fanOut("AnnounceRound", facilities, deadlineNanos, (id, ms) ->
                peers.facility(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).announceRound(announcement));
    }

    /** Sends the collection close to every fog without waiting; partial sums come back through SubmitPartialSum. */
    public void closeCollection(Collection<String> fogs, SignedMessage close, long deadlineNanos) {
        for (String id : fogs) {
            CompletableFuture.runAsync(() -> {
                try {
                    Ack ack = retry("CloseCollection->" + id, deadlineNanos, ms ->
                            peers.fog(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).closeCollection(close));
                    if (!ack.getAccepted()) log.warn("Round {} fog {} refused close: {}", close.getRound(), id, ack.getReason());
                } catch (StatusRuntimeException e) {
                    log.warn("Round {} close not delivered to {}: {}", close.getRound(), id, e.getStatus().getCode());
                } catch (Exception e) {
                    log.error("Close to {} failed: {}", id, e.toString());
                }
            }, pool);
        }
    }

    /**
     * Sends the validation request to every validator without waiting; each returned vote is
     * handed to {@code onVote} as it arrives.
     */
    public void requestVotes(Collection<String> validators, SignedMessage request, long deadlineNanos,
                             BiConsumer<String, SignedMessage> onVote) {
        for (String id : validators) {
            CompletableFuture.runAsync(() -> {
                try {
                    SignedMessage vote = retry("Validate->" + id, deadlineNanos, ms ->
                            peers.validator(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).validate(request));
                    onVote.accept(id, vote);
                } catch (StatusRuntimeException e) {
                    log.warn("No vote from {} for round {}: {}", id, request.getRound(), e.getStatus().getCode());
                } catch (Exception e) {
                    log.error("Vote request to {} failed: {}", id, e.toString());
                }
            }, pool);
        }
    }

    public Map<String, Ack> deliver(Collection<String> facilities, GlobalModelEnvelope envelope, long deadlineNanos) {
        return fanOut("DeliverGlobalModel", facilities, deadlineNanos, (id, ms) ->
                peers.facility(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).deliverGlobalModel(envelope));
    }

    public Map<String, Ack> commit(Collection<String> validators, SignedMessage notice, long deadlineNanos) {
        return fanOut("Commit", validators, deadlineNanos, (id, ms) ->
                peers.validator(id).withDeadlineAfter(ms, TimeUnit.MILLISECONDS).commit(notice));
    }

    /** Calls every peer in parallel and returns the answers that arrived before the deadline. */
    <T> Map<String, T> fanOut(String what, Collection<String> ids, long deadlineNanos, PeerCall<T> call) {
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        for (String id : ids) {
            futures.put(id, CompletableFuture.supplyAsync(() -> {
                try {
                    return retry(what + "->" + id, deadlineNanos, ms -> call.call(id, ms));
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, pool));
        }
        Map<String, T> out = new LinkedHashMap<>();
        for (var e : futures.entrySet()) {
            long remaining = deadlineNanos - System.nanoTime();
            try {
                T v = e.getValue().get(Math.max(1L, remaining), TimeUnit.NANOSECONDS);
                if (v != null) out.put(e.getKey(), v);
            } catch (TimeoutException te) {
                e.getValue().cancel(true);
                log.debug("{} to {} timed out", what, e.getKey());
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause() instanceof CompletionException && ee.getCause().getCause() != null
                        ? ee.getCause().getCause() : ee.getCause();
                if (cause instanceof StatusRuntimeException sre) {
                    log.debug("{} to {} failed: {}", what, e.getKey(), sre.getStatus());
                } else {
                    log.warn("{} to {} failed: {}", what, e.getKey(), String.valueOf(cause));
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return out;
    }

    private <T> T retry(String what, long deadlineNanos, CallWithDeadline<T> call) throws Exception {
        return Backoff.retryUntil(what, deadlineNanos, retryBaseMs,
                () -> call.call(Backoff.remainingMs(deadlineNanos, rpcDeadlineMs)));
    }

    @FunctionalInterface
    private interface CallWithDeadline<T> {
        T call(long perCallMs) throws Exception;
    }

    public void close() {
        pool.shutdownNow();
    }
}
