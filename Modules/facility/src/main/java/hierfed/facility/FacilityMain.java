package hierfed.facility;

import hierfed.common.crypto.KeyFiles;
import hierfed.common.net.ChannelFactory;
import hierfed.common.rpc.NodeLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.security.PublicKey;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "facility", mixinStandardHelpOptions = true, description = "Run a data-holding facility.")
public class FacilityMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(FacilityMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json") Path configPath;
    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key and ed25519.pub for this node") Path keysDir;
    @CommandLine.Option(names = "--register", description = "Register with the authority right after startup") boolean register;

    public static void main(String[] args) {
        System.exit(new CommandLine(new FacilityMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        NodeLauncher.quietGrpcLogging();
        var info = NodeLauncher.loadNode(nodeId, configPath, keysDir);
        PublicKey pk = KeyFiles.loadPublicKeyPem(keysDir.resolve(KeyFiles.PUBLIC_KEY_FILE));
        double learningRate = Double.parseDouble(System.getProperty("hierfed.learningRate", "1.0"));
        FacilityNode node = new FacilityNode(info, pk, ChannelFactory.netty(), new MeanRecordTrainer(learningRate));
        log.info("Facility {} attributes={} epsilon={} delta={}", nodeId, info.cfg.facility(nodeId).orElseThrow().attributes,
                info.cfg.protocol.privacy.epsilon, info.cfg.protocol.privacy.delta);
        if (register) {
            Thread t = new Thread(() -> {
                try {
                    node.agent.register();
                } catch (Exception e) {
                    log.error("Facility {} registration at startup failed: {}", nodeId, e.toString());
                }
            }, "facility-register");
            t.setDaemon(true);
            t.start();
        }
        NodeLauncher.serve(info, node);
        return 0;
    }
}
