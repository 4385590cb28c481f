package hierfed.common.rpc;

import io.grpc.BindableService;

import java.util.List;

/** A role's wired-up services, ready to be bound to a Netty or in-process server. */
public interface ServiceNode extends AutoCloseable {
    List<BindableService> services();

    @Override
    void close();
}
