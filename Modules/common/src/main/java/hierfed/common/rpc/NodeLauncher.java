package hierfed.common.rpc;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.KeyFiles;
import hierfed.common.crypto.Signer;
import io.grpc.Server;
import io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;

/** Startup steps shared by every process main. */
public final class NodeLauncher {
    private static final Logger log = LoggerFactory.getLogger(NodeLauncher.class);

    private NodeLauncher() {}

    public static void quietGrpcLogging() {
        java.util.logging.Logger.getLogger("io.grpc").setLevel(java.util.logging.Level.SEVERE);
        java.util.logging.Logger.getLogger("io.grpc.internal").setLevel(java.util.logging.Level.SEVERE);
        java.util.logging.Logger.getLogger("io.netty").setLevel(java.util.logging.Level.SEVERE);
    }

    /** Config path is configs/deployment.json; key paths inside it are relative to the directory above configs/. */
    public static Path baseDir(Path configFile) {
        Path parent = configFile.toAbsolutePath().getParent();
        return parent.getParent() != null ? parent.getParent() : parent;
    }

    public static RpcSupport.NodeInfo loadNode(String nodeId, Path configPath, Path keysDir)
            throws IOException, GeneralSecurityException {
        Path configFile = configPath.toAbsolutePath();
        DeploymentConfig cfg = DeploymentConfig.load(configFile);
        Path baseDir = baseDir(configFile);
        KeyRegistry keys = KeyRegistry.from(cfg, baseDir);
        var me = cfg.member(nodeId)
                .orElseThrow(() -> new IllegalStateException("Config invalid: nodeId " + nodeId + " not present in deployment"));
        PrivateKey sk = KeyFiles.loadPrivateKeyPem(keysDir.resolve(KeyFiles.PRIVATE_KEY_FILE));
        if (me.publicKeyPath != null && !me.publicKeyPath.isBlank()) {
            PublicKey configured = KeyFiles.loadPublicKeyPem(baseDir.resolve(me.publicKeyPath));
            if (!Signer.matches(sk, configured)) {
                throw new IllegalStateException("Private key does not match configured public key for " + nodeId);
            }
        }
        return new RpcSupport.NodeInfo(nodeId, cfg, sk, keys);
    }

    /** Binds the node's services on all interfaces at the member's configured port and blocks until shutdown. */
    public static void serve(RpcSupport.NodeInfo info, ServiceNode node) throws IOException, InterruptedException {
        int port = info.cfg.member(info.nodeId).map(m -> m.port).orElseThrow();
        NettyServerBuilder builder = NettyServerBuilder.forAddress(new InetSocketAddress("0.0.0.0", port));
        for (var s : node.services()) builder.addService(s);
        Server server = builder.build().start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down {}", info.nodeId);
            server.shutdown();
            node.close();
        }));
        log.info("{} listening on port {}", info.nodeId, port);
        server.awaitTermination();
    }
}
