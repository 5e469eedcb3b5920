package com.tessera.authzservice.infrastructure.grpc;

import com.tessera.authorization.interceptor.AuthorizationContext;
import com.tessera.authorization.interceptor.AuthorizationContextHolder;
import com.tessera.authorization.interceptor.EndpointAuthorizationInterceptor;
import com.tessera.authorization.interceptor.InterceptionResult;
import com.tessera.authorization.interceptor.RequestIdentity;
import com.tessera.authzservice.infrastructure.metrics.AuthorizationMetrics;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Enforces endpoint permissions on inbound gRPC calls.
 *
 * <p>The endpoint name is {@code "/" + fullMethodName}; user and tenant come from the {@code
 * x-user-id} and {@code x-tenant-id} metadata keys, already verified by whatever authenticated the
 * caller. Public endpoints are checked before the metadata is read.
 *
 * <p>A granted call has its {@link AuthorizationContext} bound to {@link AuthorizationContextHolder}
 * only while one of its callbacks runs. Callbacks may run on any executor thread, so the binding is
 * restored afterwards and never outlives the callback. Public and rejected calls run with nothing
 * bound.
 */
public class GrpcAuthorizationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> USER_ID_KEY =
            Metadata.Key.of("x-user-id", Metadata.ASCII_STRING_MARSHALLER);

    public static final Metadata.Key<String> TENANT_ID_KEY =
            Metadata.Key.of("x-tenant-id", Metadata.ASCII_STRING_MARSHALLER);

    private final EndpointAuthorizationInterceptor delegate;
    private final AuthorizationMetrics metrics;

    public GrpcAuthorizationInterceptor(
            EndpointAuthorizationInterceptor delegate, AuthorizationMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String endpoint = "/" + call.getMethodDescriptor().getFullMethodName();
        InterceptionResult result =
                delegate.intercept(
                        endpoint,
                        () ->
                                Optional.of(
                                        new RequestIdentity(
                                                headers.get(USER_ID_KEY), headers.get(TENANT_ID_KEY))));
        metrics.record(result.outcome());

        // whatever an earlier call left on this thread is not this call's caller
        AuthorizationContextHolder.clear();
        switch (result.outcome()) {
            case PUBLIC:
                return next.startCall(call, headers);
            case GRANTED:
                return startWithContext(result.context(), call, headers, next);
            default:
                call.close(toStatus(result), new Metadata());
                return new ServerCall.Listener<>() {};
        }
    }

    /** Package-private for testing. */
    static Status toStatus(InterceptionResult result) {
        switch (result.outcome()) {
            case UNAUTHENTICATED:
                return Status.UNAUTHENTICATED.withDescription("missing user or tenant");
            case UNMAPPED:
                return Status.PERMISSION_DENIED.withDescription("no authorization mapping for endpoint");
            case DENIED:
                return Status.PERMISSION_DENIED.withDescription("permission denied");
            case ERROR:
                return GrpcExceptionInterceptor.mapException(result.cause());
            default:
                throw new IllegalStateException("not a rejection: " + result.outcome());
        }
    }

    // ── Private Helpers ──

    private static <ReqT, RespT> ServerCall.Listener<ReqT> startWithContext(
            AuthorizationContext context,
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        ServerCall.Listener<ReqT> delegate = withContext(context, () -> next.startCall(call, headers));
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                AuthorizationContextHolder.runWithContext(context, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                AuthorizationContextHolder.runWithContext(context, super::onHalfClose);
            }

            @Override
            public void onReady() {
                AuthorizationContextHolder.runWithContext(context, super::onReady);
            }

            @Override
            public void onComplete() {
                AuthorizationContextHolder.runWithContext(context, super::onComplete);
            }

            @Override
            public void onCancel() {
                AuthorizationContextHolder.runWithContext(context, super::onCancel);
            }
        };
    }

    private static <T> T withContext(AuthorizationContext context, Supplier<T> action) {
        AtomicReference<T> result = new AtomicReference<>();
        AuthorizationContextHolder.runWithContext(context, () -> result.set(action.get()));
        return result.get();
    }
}
