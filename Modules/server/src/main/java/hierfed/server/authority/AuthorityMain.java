package hierfed.server.authority;

import hierfed.common.rpc.NodeLauncher;
import hierfed.common.util.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "authority", mixinStandardHelpOptions = true,
        description = "Run the trusted authority: registration, identity certificates, attribute keys.")
public class AuthorityMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(AuthorityMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json") Path configPath;
    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key for this node") Path keysDir;
    @CommandLine.Option(names = "--master-secret", description = "Hex master secret file; created under --keys-dir when absent")
    Path masterSecretPath;

    public static void main(String[] args) {
        System.exit(new CommandLine(new AuthorityMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        NodeLauncher.quietGrpcLogging();
        var info = NodeLauncher.loadNode(nodeId, configPath, keysDir);
        Path secretFile = masterSecretPath != null ? masterSecretPath : keysDir.resolve("abe-master.key");
        byte[] master;
        if (Files.exists(secretFile)) {
            master = Hex.fromHex(Files.readString(secretFile, StandardCharsets.US_ASCII));
        } else {
            master = new byte[32];
            new SecureRandom().nextBytes(master);
            Files.writeString(secretFile, Hex.toHex(master) + "\n", StandardCharsets.US_ASCII);
            log.info("Generated new attribute master secret at {}", secretFile);
        }
        AuthorityNode node = new AuthorityNode(info, master);
        log.info("Authority {} universe={} difficulty={} bits", nodeId,
                info.cfg.protocol.attributeUniverse, info.cfg.protocol.powDifficultyBits);
        NodeLauncher.serve(info, node);
        return 0;
    }
}
