package com.tessera.authzservice.config;

import com.tessera.authorization.interceptor.EndpointAuthorizationInterceptor;
import com.tessera.authzservice.infrastructure.grpc.GrpcAuthorizationInterceptor;
import com.tessera.authzservice.infrastructure.grpc.GrpcExceptionInterceptor;
import com.tessera.authzservice.infrastructure.metrics.AuthorizationMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * gRPC interceptors for services hosted next to the authorization core.
 *
 * <p>The interceptors are plain {@link io.grpc.ServerInterceptor}s exposed as beans; the host
 * registers them on its server with the exception interceptor outermost:
 *
 * <pre>{@code
 * ServerInterceptors.intercept(service, authorizationInterceptor, exceptionInterceptor)
 * }</pre>
 */
@Configuration
public class GrpcConfig {

    @Bean
    public AuthorizationMetrics authorizationMetrics(MeterRegistry meterRegistry) {
        return new AuthorizationMetrics(meterRegistry);
    }

    @Bean
    public GrpcAuthorizationInterceptor grpcAuthorizationInterceptor(
            EndpointAuthorizationInterceptor endpointAuthorizationInterceptor,
            AuthorizationMetrics authorizationMetrics) {
        return new GrpcAuthorizationInterceptor(endpointAuthorizationInterceptor, authorizationMetrics);
    }

    @Bean
    public GrpcExceptionInterceptor grpcExceptionInterceptor() {
        return new GrpcExceptionInterceptor();
    }
}
