package hierfed.common.net;

import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;

@FunctionalInterface
public interface ChannelFactory {
    ManagedChannel open(String host, int port);

    static ChannelFactory netty() {
        return (host, port) -> NettyChannelBuilder.forAddress(host, port).usePlaintext().build();
    }
}
