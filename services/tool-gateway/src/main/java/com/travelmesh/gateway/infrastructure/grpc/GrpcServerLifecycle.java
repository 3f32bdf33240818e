package com.travelmesh.gateway.infrastructure.grpc;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts and stops the gRPC server with the Spring context.
 *
 * <p>Interceptors are given innermost first, as {@link ServerInterceptors#intercept} expects: the
 * last one sees the call first.
 */
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final int port;
    private final long shutdownGraceSeconds;
    private final BindableService service;
    private final List<ServerInterceptor> interceptors;
    private volatile Server server;

    public GrpcServerLifecycle(
            int port, long shutdownGraceSeconds, BindableService service, List<ServerInterceptor> interceptors) {
        this.port = port;
        this.shutdownGraceSeconds = shutdownGraceSeconds;
        this.service = service;
        this.interceptors = List.copyOf(interceptors);
    }

    @Override
    public void start() {
        try {
            server = ServerBuilder.forPort(port)
                    .addService(ServerInterceptors.intercept(service, interceptors))
                    .build()
                    .start();
        } catch (IOException e) {
            throw new UncheckedIOException("gRPC server could not bind port " + port, e);
        }
        log.info("gRPC server listening on port {}", server.getPort());
    }

    @Override
    public void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        running.shutdown();
        try {
            if (!running.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not drain within {}s; forcing shutdown", shutdownGraceSeconds);
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        }
        server = null;
        log.info("gRPC server stopped");
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        Server running = server;
        return running != null ? running.getPort() : port;
    }
}
