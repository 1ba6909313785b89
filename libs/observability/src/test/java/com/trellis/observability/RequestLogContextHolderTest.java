package com.trellis.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RequestLogContextHolder}: ThreadLocal storage, MDC bridge, in-place updates
 * and clearing.
 */
@DisplayName("RequestLogContextHolder")
class RequestLogContextHolderTest {

    @AfterEach
    void cleanup() {
        RequestLogContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(RequestLogContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = RequestLogContext.open("req-1", "sess-1", true);
            RequestLogContextHolder.set(ctx);

            assertThat(RequestLogContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> RequestLogContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank request id")
        void shouldRejectBlankRequestId() {
            assertThatThrownBy(() -> RequestLogContext.open(" ", "sess-1", false))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requestId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            RequestLogContextHolder.set(new RequestLogContext("req-1", "sess-1", "user-1", "42", true));

            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("sessionId")).isEqualTo("sess-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("tenantId")).isEqualTo("42");
            assertThat(MDC.get("fragment")).isEqualTo("true");
        }

        @Test
        @DisplayName("should leave MDC keys unset for null fields")
        void shouldSkipNullFields() {
            RequestLogContextHolder.set(RequestLogContext.open("req-1", null, false));

            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("sessionId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            RequestLogContextHolder.set(new RequestLogContext("req-1", "sess-1", "user-1", "42", true));
            RequestLogContextHolder.clear();

            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("fragment")).isNull();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("should enrich the current context with user and tenant")
        void shouldEnrichCurrentContext() {
            RequestLogContextHolder.set(RequestLogContext.open("req-1", "sess-1", false));

            RequestLogContextHolder.update(ctx -> ctx.withUser("user-7"));
            RequestLogContextHolder.update(ctx -> ctx.withTenant("team-3"));

            var ctx = RequestLogContextHolder.get().orElseThrow();
            assertThat(ctx.userId()).isEqualTo("user-7");
            assertThat(ctx.tenantId()).isEqualTo("team-3");
            assertThat(ctx.requestId()).isEqualTo("req-1");
            assertThat(MDC.get("tenantId")).isEqualTo("team-3");
        }

        @Test
        @DisplayName("should do nothing when no context is open")
        void shouldIgnoreUpdateWithoutContext() {
            RequestLogContextHolder.update(ctx -> ctx.withTenant("team-3"));

            assertThat(RequestLogContextHolder.get()).isEmpty();
            assertThat(MDC.get("tenantId")).isNull();
        }
    }

    @Test
    @DisplayName("should not leak context across threads")
    void shouldNotLeakAcrossThreads() throws InterruptedException {
        RequestLogContextHolder.set(RequestLogContext.open("main-req", null, false));

        AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
        Thread other = new Thread(() -> otherThreadHasContext.set(RequestLogContextHolder.get().isPresent()));
        other.start();
        other.join();

        assertThat(otherThreadHasContext.get()).isFalse();
    }
}
