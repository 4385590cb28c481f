package hierfed.server.fog;

import hierfed.common.net.ChannelFactory;
import hierfed.common.rpc.NodeLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "fog", mixinStandardHelpOptions = true, description = "Run a fog aggregation node.")
public class FogMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(FogMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json") Path configPath;
    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key for this node") Path keysDir;

    public static void main(String[] args) {
        System.exit(new CommandLine(new FogMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        NodeLauncher.quietGrpcLogging();
        var info = NodeLauncher.loadNode(nodeId, configPath, keysDir);
        var fault = FogAggregator.Fault.parse(System.getProperty("hierfed.fault"));
        FogNode node = new FogNode(info, ChannelFactory.netty(), fault);
        log.info("Fog {} index={} t={} fault={}", nodeId, node.aggregator.index(), info.cfg.protocol.threshold, fault);
        NodeLauncher.serve(info, node);
        return 0;
    }
}
