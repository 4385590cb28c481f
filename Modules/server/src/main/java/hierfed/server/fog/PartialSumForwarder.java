package hierfed.server.fog;

import hierfed.common.crypto.Domains;
import hierfed.common.net.Backoff;
import hierfed.common.net.PeerChannels;
import hierfed.common.quorum.QuorumCollector;
import hierfed.common.rpc.RpcSupport;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.SignedMessagePacker;
import hierfed.proto.Ack;
import hierfed.proto.FogPartialSum;
import hierfed.proto.SignedMessage;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/** Pushes partial sums to the leader off the RPC thread, retrying until the fog-phase deadline. */
public final class PartialSumForwarder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PartialSumForwarder.class);

    private final RpcSupport.NodeInfo node;
    private final PeerChannels peers;
    private final ExecutorService exec;

    public PartialSumForwarder(RpcSupport.NodeInfo node, PeerChannels peers) {
        this.node = node;
        this.peers = peers;
        this.exec = Executors.newSingleThreadExecutor(RpcSupport.daemonThreads(node.nodeId + "-forward"));
    }

    public void forward(FogPartialSum partial) {
        long deadline = QuorumCollector.deadlineAfter(node.cfg.timeouts.fogMs);
        long rpcMs = node.cfg.timeouts.rpcDeadlineMs;
        exec.submit(() -> {
            try {
                SignedMessage env = SignedMessagePacker.pack(Domains.PARTIAL_SUM, MessageTypes.FOG_PARTIAL_SUM,
                        partial, node.nodeId, partial.getRound(), node.sk);
                Ack ack = Backoff.retryUntil("partial sum r=" + partial.getRound(), deadline, node.cfg.timeouts.retryBaseMs,
                        () -> peers.leader().withDeadlineAfter(Backoff.remainingMs(deadline, rpcMs), TimeUnit.MILLISECONDS)
                                .submitPartialSum(env));
                if (ack.getAccepted()) {
                    log.info("Fog {} delivered partial sum for round {}", node.nodeId, partial.getRound());
                } else {
                    log.warn("Leader refused partial sum of {} for round {}: {}", node.nodeId, partial.getRound(), ack.getReason());
                }
            } catch (StatusRuntimeException e) {
                log.warn("Fog {} could not deliver partial sum for round {}: {}", node.nodeId, partial.getRound(), e.getStatus());
            } catch (Exception e) {
                log.error("Fog {} partial sum forward failed for round {}", node.nodeId, partial.getRound(), e);
            }
        });
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
