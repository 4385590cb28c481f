package hierfed.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentConfigTest {
    private DeploymentConfig cfg;

    @BeforeEach
    void setUp() {
        cfg = new DeploymentConfig();
        cfg.authority = new DeploymentConfig.Member("ta", "127.0.0.1", 7600);
        cfg.leader = new DeploymentConfig.Member("leader", "127.0.0.1", 7650);
        for (int i = 1; i <= 3; i++) cfg.fogNodes.add(new DeploymentConfig.FogMember("fog" + i, "127.0.0.1", 8600 + i, i));
        for (int i = 1; i <= 4; i++) cfg.validators.add(new DeploymentConfig.Member("v" + i, "127.0.0.1", 8700 + i));
        cfg.facilities.add(new DeploymentConfig.FacilityMember("f1", "127.0.0.1", 9601, List.of("facility", "region:X")));
    }

    private void assertInvalid(String fragment) {
        IllegalStateException e = assertThrows(IllegalStateException.class, cfg::validate);
        assertTrue(e.getMessage().startsWith("Config invalid:"), e.getMessage());
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    @Test
    void defaultsAreValid() {
        cfg.validate();
        assertEquals(3, cfg.voteQuorum());
    }

    @Test
    void voteQuorumIsTwoThirdsRoundedUp() {
        cfg.protocol.maxByzantine = 2;
        for (int i = 5; i <= 7; i++) cfg.validators.add(new DeploymentConfig.Member("v" + i, "127.0.0.1", 8700 + i));
        cfg.validate();
        assertEquals(5, cfg.voteQuorum());
    }

    @Test
    void thresholdAboveFogCountIsRejected() {
        cfg.protocol.threshold = 4;
        assertInvalid("threshold");
    }

    @Test
    void tooFewValidatorsForByzantineBound() {
        cfg.validators.remove(3);
        assertInvalid("3f+1");
    }

    @Test
    void duplicateFogIndexIsRejected() {
        cfg.fogNodes.get(2).index = 1;
        assertInvalid("duplicate fog index");
    }

    @Test
    void duplicateMemberIdIsRejected() {
        cfg.validators.get(0).id = "fog1";
        assertInvalid("duplicate member id");
    }

    @Test
    void policyMustStayInsideTheAttributeUniverse() {
        cfg.protocol.accessPolicy = "facility AND region:Z";
        assertInvalid("region:Z");
        cfg.protocol.accessPolicy = "facility AND (";
        assertInvalid("accessPolicy");
    }

    @Test
    void facilityAttributesMustBeKnown() {
        cfg.facilities.get(0).attributes.add("clinic");
        assertInvalid("clinic");
    }

    @Test
    void privacyParametersAreChecked() {
        cfg.protocol.privacy.delta = 1.5;
        assertInvalid("delta");
    }

    @Test
    void loadsJsonWithLegacyAliases(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("deployment.json");
        Files.writeString(file, "{"
                + "\"authority\":{\"id\":\"ta\",\"port\":7600,\"pubkeyPemPath\":\"secrets/ta/ed25519.pub\"},"
                + "\"leader\":{\"id\":\"leader\",\"port\":7650},"
                + "\"fogNodes\":[{\"id\":\"fog1\",\"port\":8601,\"index\":1},{\"id\":\"fog2\",\"port\":8602,\"index\":2}],"
                + "\"validators\":[{\"id\":\"v1\",\"port\":8701},{\"id\":\"v2\",\"port\":8702},"
                + "{\"id\":\"v3\",\"port\":8703},{\"id\":\"v4\",\"port\":8704}],"
                + "\"protocol\":{\"threshold\":2,\"maxUpdateDistance\":3.5,\"unknownKnob\":true}"
                + "}");
        DeploymentConfig loaded = DeploymentConfig.load(file);
        assertEquals("secrets/ta/ed25519.pub", loaded.authority.publicKeyPath);
        assertEquals(3.5, loaded.protocol.maxUpdateNorm);
        assertEquals(2, loaded.fog("fog2").orElseThrow().index);
        assertEquals("127.0.0.1", loaded.leader.host);
    }

    @Test
    void shippedDeploymentLoads() throws Exception {
        Path shipped = Path.of("../../configs/deployment.json");
        DeploymentConfig loaded = DeploymentConfig.load(shipped);
        assertEquals(3, loaded.fogNodes.size());
        assertEquals(4, loaded.facilities.size());
        assertEquals(3, loaded.voteQuorum());
    }
}
