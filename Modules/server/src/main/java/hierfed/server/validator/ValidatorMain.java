package hierfed.server.validator;

import hierfed.common.rpc.NodeLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "validator", mixinStandardHelpOptions = true, description = "Run a validator committee member.")
public class ValidatorMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }
    private static final Logger log = LoggerFactory.getLogger(ValidatorMain.class);

    @CommandLine.Option(names = "--id", required = true) String nodeId;
    @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json") Path configPath;
    @CommandLine.Option(names = "--keys-dir", required = true, description = "Directory containing ed25519.key for this node") Path keysDir;

    public static void main(String[] args) {
        System.exit(new CommandLine(new ValidatorMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        NodeLauncher.quietGrpcLogging();
        var info = NodeLauncher.loadNode(nodeId, configPath, keysDir);
        var fault = VoteCaster.Fault.parse(System.getProperty("hierfed.fault"));
        ValidatorNode node = new ValidatorNode(info, fault);
        log.info("Validator {} V={} quorum={} fault={}", nodeId, info.cfg.validators.size(), info.cfg.voteQuorum(), fault);
        NodeLauncher.serve(info, node);
        return 0;
    }
}
