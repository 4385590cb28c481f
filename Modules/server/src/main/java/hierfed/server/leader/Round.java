package hierfed.server.leader;

import hierfed.common.quorum.QuorumCollector;
import hierfed.proto.FogPartialSum;
import hierfed.proto.SubmissionNotice;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable working state of the round the leader is driving. Fields written by the round thread
 * are read by RPC handlers under the coordinator's lock.
 */
final class Round {
    final long number;
    final QuorumCollector<SubmissionNotice> notices = new QuorumCollector<>();
    final QuorumCollector<FogPartialSum> partials = new QuorumCollector<>();
    final CompletableFuture<RoundRecord> outcome = new CompletableFuture<>();
    /** Bytes of accepted facility, fog and validator messages. */
    final AtomicLong uploadBytes = new AtomicLong();
    /** Bytes of everything the leader sent out for this round. */
    final AtomicLong downloadBytes = new AtomicLong();

    RoundState state = RoundState.IDLE;
    long collectionDeadlineMs;
    Set<String> expected = Set.of();
    List<String> participants = List.of();
    List<Integer> fogIndices = List.of();
    byte[] participantDigest;

    Round(long number) {
        this.number = number;
    }
}
