package com.tessera.authzservice.infrastructure.grpc;

import com.tessera.authorization.EnforcementException;
import com.tessera.authorization.InvalidArgumentException;
import com.tessera.authorization.StorageException;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps authorization exceptions escaping a gRPC handler to status codes.
 *
 * <ul>
 *   <li>{@link InvalidArgumentException} → {@code INVALID_ARGUMENT} with the validation errors
 *   <li>{@link StorageException} → {@code UNAVAILABLE}; the storage detail stays in the logs
 *   <li>{@link EnforcementException} → {@code INTERNAL}
 *   <li>{@link StatusRuntimeException} → its own status
 *   <li>anything else → {@code INTERNAL}
 * </ul>
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        // handlers that throw surface as UNKNOWN with the exception as cause
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            status = mapException(status.getCause());
                        }
                        super.close(status, trailers);
                    }
                };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(wrappedCall, headers)) {};
    }

    /** Maps an exception to a gRPC status. Package-private for testing and reuse. */
    static Status mapException(Throwable throwable) {
        if (throwable instanceof InvalidArgumentException invalid) {
            log.warn("gRPC invalid argument: {}", invalid.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(invalid.getMessage()).withCause(invalid);
        }
        if (throwable instanceof StorageException storage) {
            log.error("gRPC storage failure (retryable={})", storage.retryable(), storage);
            return Status.UNAVAILABLE.withDescription("authorization store unavailable").withCause(storage);
        }
        if (throwable instanceof EnforcementException enforcement) {
            log.error("gRPC authorization check failed", enforcement);
            return Status.INTERNAL.withDescription("authorization check failed").withCause(enforcement);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }
}
