package hierfed.server.leader;

import com.google.protobuf.ByteString;
import hierfed.common.crypto.Digests;
import hierfed.common.crypto.Domains;
import hierfed.common.validation.MessageTypes;
import hierfed.proto.AbeCiphertext;
import hierfed.proto.Ack;
import hierfed.proto.FogPartialSum;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.SubmissionNotice;
import hierfed.server.DeploymentFixture;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoundCoordinatorTest {

    private DeploymentFixture fx;
    private LeaderOutbound out;
    private GlobalModelStore store;
    private RoundCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        fx = new DeploymentFixture();
        out = mock(LeaderOutbound.class);
        store = new GlobalModelStore(fx.cfg.protocol.modelDimension, null);
        double[] params = {0.5, -0.5};
        store.install(2L, 3L, params, GlobalModelEnvelope.newBuilder()
                .setVersion(2L)
                .setRound(3L)
                .setModelHash(ByteString.copyFrom(Digests.vectorHash(params)))
                .setCiphertext(AbeCiphertext.newBuilder().setPolicy("facility").setEpoch(1))
                .build(), null);
        coordinator = new RoundCoordinator(fx.node("leader"), out, store);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private Ack notice(String facility, long round) throws Exception {
        SubmissionNotice n = SubmissionNotice.newBuilder().setRound(round).setFacilityId(facility).addAckedFogIndices(1).build();
        return coordinator.onNotice(fx.certified(Domains.NOTICE, MessageTypes.SUBMISSION_NOTICE, n, facility, round));
    }

    @Test
    void idleCoordinatorReportsStoredVersion() {
        var status = coordinator.status();
        assertEquals(0L, status.getActiveRound());
        assertEquals("IDLE", status.getState());
        assertEquals(2L, status.getModelVersion());
        assertTrue(coordinator.history().isEmpty());
    }

    @Test
    void noticeForFinishedRoundIsStale() throws Exception {
        Ack ack = notice("f1", 3L);
        assertFalse(ack.getAccepted());
        assertTrue(ack.getReason().startsWith("stale"), ack.getReason());
    }

    @Test
    void noticeForFutureRoundIsUnknown() throws Exception {
        Ack ack = notice("f1", 4L);
        assertFalse(ack.getAccepted());
        assertEquals("unknown round 4", ack.getReason());
    }

    @Test
    void partialSumFromValidatorKeyRefused() throws Exception {
        FogPartialSum p = FogPartialSum.newBuilder().setRound(4L).setFogId("v1").setFogIndex(1).build();
        Ack ack = coordinator.onPartialSum(fx.sign(Domains.PARTIAL_SUM, MessageTypes.FOG_PARTIAL_SUM, p, "v1", 4L));
        assertFalse(ack.getAccepted());
    }

    @Test
    void stalePartialSumRefused() throws Exception {
        FogPartialSum p = FogPartialSum.newBuilder().setRound(2L).setFogId("fog1").setFogIndex(1).build();
        Ack ack = coordinator.onPartialSum(fx.sign(Domains.PARTIAL_SUM, MessageTypes.FOG_PARTIAL_SUM, p, "fog1", 2L));
        assertFalse(ack.getAccepted());
        assertTrue(ack.getReason().startsWith("stale"), ack.getReason());
    }

    @Test
    void unreachableAuthorityAbortsAndNextRoundGetsFreshNumber() throws Exception {
        when(out.listIdentities(anyLong())).thenThrow(new StatusRuntimeException(Status.UNAVAILABLE));

        RoundCoordinator.Started first = coordinator.startRound();
        assertEquals(4L, first.round());
        RoundRecord rec = first.outcome().get(5, TimeUnit.SECONDS);
        assertFalse(rec.finalized());
        assertTrue(rec.reason().startsWith("NOT_READY"), rec.reason());
        assertEquals(2L, rec.version());
        assertEquals(0L, rec.uploadBytes());
        assertEquals(0L, rec.downloadBytes());
        verify(out, never()).announce(any(), any(), anyLong());

        RoundCoordinator.Started second = coordinator.startRound();
        assertEquals(5L, second.round());
        second.outcome().get(5, TimeUnit.SECONDS);
        assertEquals(2, coordinator.history().size());
        assertEquals(2L, store.latestVersion());
        assertEquals("IDLE", coordinator.status().getState());
    }

    @Test
    void abortedRoundNumbersAreNotReusedAfterRestart(@TempDir Path dir) throws Exception {
        when(out.listIdentities(anyLong())).thenThrow(new StatusRuntimeException(Status.UNAVAILABLE));
        int dim = fx.cfg.protocol.modelDimension;

        RoundCoordinator before = new RoundCoordinator(fx.node("leader"), out, new GlobalModelStore(dim, dir));
        try {
            for (long expected = 1L; expected <= 2L; expected++) {
                RoundCoordinator.Started s = before.startRound();
                assertEquals(expected, s.round());
                assertFalse(s.outcome().get(5, TimeUnit.SECONDS).finalized());
            }
        } finally {
            before.close();
        }

        GlobalModelStore reopened = new GlobalModelStore(dim, dir);
        assertEquals(1L, reopened.latestVersion(), "aborted rounds install nothing");
        assertEquals(2L, reopened.highestRound());
        RoundCoordinator after = new RoundCoordinator(fx.node("leader"), out, reopened);
        try {
            RoundCoordinator.Started s = after.startRound();
            assertEquals(3L, s.round());
            s.outcome().get(5, TimeUnit.SECONDS);
            Ack late = after.onPartialSum(fx.sign(Domains.PARTIAL_SUM, MessageTypes.FOG_PARTIAL_SUM,
                    FogPartialSum.newBuilder().setRound(2L).setFogId("fog1").setFogIndex(1).build(), "fog1", 2L));
            assertTrue(late.getReason().startsWith("stale"), late.getReason());
        } finally {
            after.close();
        }
    }
}
