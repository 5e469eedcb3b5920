package com.tessera.authzservice.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tessera.authorization.EnforcementException;
import com.tessera.authorization.InvalidArgumentException;
import com.tessera.authorization.StorageException;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("GrpcExceptionInterceptor")
class GrpcExceptionInterceptorTest {

    @Nested
    @DisplayName("mapException()")
    class MapException {

        @Test
        @DisplayName("InvalidArgumentException → INVALID_ARGUMENT with the errors")
        void invalidArgument() {
            Status status =
                    GrpcExceptionInterceptor.mapException(
                            new InvalidArgumentException(List.of("userId must not be null or blank")));

            assertThat(status.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
            assertThat(status.getDescription()).isEqualTo("userId must not be null or blank");
        }

        @Test
        @DisplayName("StorageException → UNAVAILABLE without the storage detail")
        void storage() {
            Status status =
                    GrpcExceptionInterceptor.mapException(
                            new StorageException("FATAL: role \"tessera\" does not exist", null, false));

            assertThat(status.getCode()).isEqualTo(Status.Code.UNAVAILABLE);
            assertThat(status.getDescription()).doesNotContain("tessera");
        }

        @Test
        @DisplayName("EnforcementException → INTERNAL")
        void enforcement() {
            Status status = GrpcExceptionInterceptor.mapException(new EnforcementException("engine broke"));

            assertThat(status.getCode()).isEqualTo(Status.Code.INTERNAL);
            assertThat(status.getDescription()).isEqualTo("authorization check failed");
        }

        @Test
        @DisplayName("StatusRuntimeException keeps its status")
        void statusRuntime() {
            Status status =
                    GrpcExceptionInterceptor.mapException(new StatusRuntimeException(Status.NOT_FOUND));

            assertThat(status.getCode()).isEqualTo(Status.Code.NOT_FOUND);
        }

        @Test
        @DisplayName("anything else → INTERNAL")
        void generic() {
            Status status = GrpcExceptionInterceptor.mapException(new RuntimeException("boom"));

            assertThat(status.getCode()).isEqualTo(Status.Code.INTERNAL);
            assertThat(status.getDescription()).isEqualTo("Internal server error");
        }
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("rewrites UNKNOWN closes caused by an authorization exception")
    void rewritesUnknown() {
        ServerCall<String, String> call = mock(ServerCall.class);
        ServerCallHandler<String, String> handler = mock(ServerCallHandler.class);
        ArgumentCaptor<ServerCall<String, String>> wrapped = ArgumentCaptor.forClass(ServerCall.class);
        when(handler.startCall(wrapped.capture(), any())).thenReturn(new ServerCall.Listener<>() {});

        new GrpcExceptionInterceptor().interceptCall(call, new Metadata(), handler);
        wrapped.getValue()
                .close(Status.UNKNOWN.withCause(new StorageException("timeout", null, true)), new Metadata());

        ArgumentCaptor<Status> status = ArgumentCaptor.forClass(Status.class);
        verify(call).close(status.capture(), any(Metadata.class));
        assertThat(status.getValue().getCode()).isEqualTo(Status.Code.UNAVAILABLE);
    }
}
