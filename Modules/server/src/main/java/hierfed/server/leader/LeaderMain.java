package hierfed.server.leader;

import hierfed.common.net.ChannelFactory;
import hierfed.common.rpc.NodeLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "leader", mixinStandardHelpOptions = true, description = "Run the round leader.")
public class LeaderMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(LeaderMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json") Path configPath;
    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key for this node") Path keysDir;

    public static void main(String[] args) {
        System.exit(new CommandLine(new LeaderMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        NodeLauncher.quietGrpcLogging();
        var info = NodeLauncher.loadNode(nodeId, configPath, keysDir);
        LeaderNode node = new LeaderNode(info, ChannelFactory.netty());
        log.info("Leader {} t={}/{} V={} quorum={} model version {}", nodeId, info.cfg.protocol.threshold,
                info.cfg.fogNodes.size(), info.cfg.validators.size(), info.cfg.voteQuorum(), node.store.latestVersion());
        NodeLauncher.serve(info, node);
        return 0;
    }
}
