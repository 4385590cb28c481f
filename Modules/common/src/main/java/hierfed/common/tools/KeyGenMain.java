package hierfed.common.tools;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.crypto.KeyFiles;
import picocli.CommandLine;

import java.nio.file.Path;
import java.security.KeyPair;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "keygen", mixinStandardHelpOptions = true,
        description = "Generate Ed25519 keypairs for deployment members.")
public class KeyGenMain implements Callable<Integer> {

    @CommandLine.Option(names = "--out", description = "Output directory (e.g., secrets/fog1)", required = true)
    Path outDir;

    @CommandLine.Option(names = "--id", description = "Member id, only used for print/log")
    String id;

    @CommandLine.Option(names = "--config", description = "If set, generate one keypair per member of this deployment under <out>/<id>/")
    Path config;

    @Override
    public Integer call() throws Exception {
        if (config != null) {
            DeploymentConfig cfg = DeploymentConfig.load(config);
            for (var m : cfg.allMembers()) {
                Path base = outDir.resolve(m.id);
                KeyPair kp = KeyFiles.generateKeyPair();
                KeyFiles.writeKeyPair(base.resolve(KeyFiles.PRIVATE_KEY_FILE), base.resolve(KeyFiles.PUBLIC_KEY_FILE), kp);
                System.out.println("Wrote " + m.id + " keys to " + base);
            }
            return 0;
        }

        KeyPair kp = KeyFiles.generateKeyPair();
        KeyFiles.writeKeyPair(outDir.resolve(KeyFiles.PRIVATE_KEY_FILE), outDir.resolve(KeyFiles.PUBLIC_KEY_FILE), kp);
        System.out.println("Wrote keys for " + (id != null ? id : "(no-id)") + " to " + outDir);
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new KeyGenMain()).execute(args));
    }
}
