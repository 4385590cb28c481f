package hierfed.common.rpc;

import hierfed.common.config.DeploymentConfig;
import hierfed.common.config.KeyRegistry;
import hierfed.proto.Ack;

import java.security.PrivateKey;
import java.util.concurrent.ThreadFactory;

public final class RpcSupport {
    private RpcSupport() {}

    /** Identity and trust material of the local process. */
    public static final class NodeInfo {
        public final String nodeId;
        public final DeploymentConfig cfg;
        public final PrivateKey sk;
        public final KeyRegistry keys;

        public NodeInfo(String nodeId, DeploymentConfig cfg, PrivateKey sk, KeyRegistry keys) {
            this.nodeId = nodeId;
            this.cfg = cfg;
            this.sk = sk;
            this.keys = keys;
        }
    }

    public static Ack accepted() {
        return Ack.newBuilder().setAccepted(true).build();
    }

    public static Ack refused(String reason) {
        return Ack.newBuilder().setAccepted(false).setReason(reason).build();
    }

    /** Daemon threads named {@code base}, {@code base-2}, ... */
    public static ThreadFactory daemonThreads(String base) {
        return new ThreadFactory() {
            private int n = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                n++;
                Thread t = new Thread(r, n == 1 ? base : base + "-" + n);
                t.setDaemon(true);
                return t;
            }
        };
    }
}
