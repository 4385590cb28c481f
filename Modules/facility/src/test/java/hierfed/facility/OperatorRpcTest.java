package hierfed.facility;

import com.google.protobuf.ByteString;
import hierfed.common.net.PeerChannels;
import hierfed.proto.Ack;
import hierfed.proto.Empty;
import hierfed.proto.FacilityRegistration;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.LeaderStatus;
import hierfed.proto.LocalDataDelta;
import hierfed.proto.RevokeRequest;
import hierfed.proto.RoundSummary;
import hierfed.proto.StartRoundReply;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** The operator-facing RPCs, driven the way hierfed-ctl drives them. */
class OperatorRpcTest {
    private InProcessDeployment d;
    private PeerChannels peers;

    @BeforeEach
    void setUp() throws Exception {
        d = new InProcessDeployment();
        peers = d.peers();
    }

    @AfterEach
    void tearDown() throws Exception {
        d.close();
    }

    private Ack feed(String facility, double[]... records) {
        return peers.facility(facility).startRound(LocalDataDelta.newBuilder()
                .setData(ByteString.copyFrom(RecordCodec.encode(List.of(records)))).build());
    }

    private RoundSummary awaitRound(long round) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 30_000;
        while (System.currentTimeMillis() < deadline) {
            LeaderStatus st = peers.leader().status(Empty.getDefaultInstance());
            for (RoundSummary s : st.getHistoryList()) {
                if (s.getRound() == round) return s;
            }
            Thread.sleep(50);
        }
        fail("round " + round + " did not finish");
        return null;
    }

    @Test
    void noModelBeforeTheFirstFinalizedRound() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
                () -> peers.leader().getGlobalModel(Empty.getDefaultInstance()));
        assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
    }

    @Test
    void registrationThroughTheFacilityIsIdempotent() {
        FacilityRegistration first = peers.facility("f1").register(Empty.getDefaultInstance());
        FacilityRegistration again = peers.facility("f1").register(Empty.getDefaultInstance());
        assertTrue(first.getRegistered());
        assertEquals(List.of("facility", "region:X"), first.getAttributesList());
        assertEquals(first, again);
        assertEquals(1, d.authority.registry.registeredCount());
    }

    @Test
    void malformedLocalDataIsInvalidArgument() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class, () -> peers.facility("f1")
                .startRound(LocalDataDelta.newBuilder().setData(ByteString.copyFrom(new byte[20])).build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
    }

    @Test
    void revokingAnUnknownFacilityIsRefused() {
        Ack ack = peers.authority().revoke(RevokeRequest.newBuilder().setFacilityId("f9").setReason("test").build());
        assertFalse(ack.getAccepted());
    }

    @Test
    void fullRoundDrivenOverRpc() throws Exception {
        for (String id : List.of("f1", "f2", "f3")) peers.facility(id).register(Empty.getDefaultInstance());
        assertTrue(feed("f1", new double[]{0.1, 0.1}).getAccepted());
        assertTrue(feed("f2", new double[]{0.3, 0.1}).getAccepted());
        assertTrue(feed("f3", new double[]{0.2, -0.2}).getAccepted());

        StartRoundReply started = peers.leader().startRound(Empty.getDefaultInstance());
        assertEquals(1L, started.getRound());
        StatusRuntimeException busy = assertThrows(StatusRuntimeException.class,
                () -> peers.leader().startRound(Empty.getDefaultInstance()));
        assertEquals(Status.Code.FAILED_PRECONDITION, busy.getStatus().getCode());

        RoundSummary summary = awaitRound(started.getRound());
        assertEquals("FINALIZED", summary.getOutcome(), summary.getReason());
        assertEquals(List.of("f1", "f2", "f3"), summary.getParticipantsList());

        GlobalModelEnvelope env = peers.leader().getGlobalModel(Empty.getDefaultInstance());
        assertEquals(2L, env.getVersion());
        assertEquals("facility AND (region:X OR region:Y)", env.getCiphertext().getPolicy());
        assertTrue(env.getVotesCount() >= 3);
        assertEquals(2L, peers.facility("f2").status(Empty.getDefaultInstance()).getModelVersion());
        assertEquals(2L, peers.leader().status(Empty.getDefaultInstance()).getModelVersion());
    }
}
