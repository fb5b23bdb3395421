package com.umitunal.uniqueue.handler;

import com.umitunal.uniqueue.core.UnknownTypeException;
import com.umitunal.uniqueue.serialization.JsonCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class HandlerRegistryTest {

    private final HandlerRegistry registry = new HandlerRegistry();

    @Test
    @DisplayName("Should resolve registered handlers by type")
    void testResolve() throws Exception {
        JobHandler handler = context -> Outcome.success();
        registry.register("email_send", handler);

        assertThat(registry.resolve("email_send")).isSameAs(handler);
        assertThat(registry.isRegistered("email_send")).isTrue();
        assertThat(registry.getRegisteredTypes()).containsExactly("email_send");
    }

    @Test
    @DisplayName("Should reject a second handler for the same type")
    void testDuplicate() {
        registry.register("email_send", context -> Outcome.success());

        assertThatThrownBy(() -> registry.register("email_send", context -> Outcome.success()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("email_send");
    }

    @Test
    @DisplayName("Should fail with UnknownTypeException for unregistered types")
    void testUnknown() {
        assertThatThrownBy(() -> registry.resolve("nope"))
                .isInstanceOf(UnknownTypeException.class)
                .extracting(e -> ((UnknownTypeException) e).getType())
                .isEqualTo("nope");
    }

    @Test
    @DisplayName("Should forget unregistered handlers")
    void testUnregister() {
        registry.register("a", context -> Outcome.success());

        assertThat(registry.unregister("a")).isTrue();
        assertThat(registry.unregister("a")).isFalse();
        assertThat(registry.isRegistered("a")).isFalse();
    }

    @Test
    @DisplayName("Should decode typed payloads and fail malformed ones as unrecoverable")
    void testTypedHandler() throws Exception {
        JobHandler handler = JobHandler.typed(new JsonCodec<>(Resize.class),
                (resize, context) -> Outcome.success(resize.width + "x" + resize.height));

        Outcome ok = handler.execute(new StubContext("{\"width\":64,\"height\":32}"));
        Outcome bad = handler.execute(new StubContext("{not json"));

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.getResult()).isEqualTo("64x32");
        assertThat(bad.getKind()).isEqualTo(Outcome.Kind.UNRECOVERABLE_FAILURE);
        assertThat(bad.getMessage()).startsWith("Malformed payload");
    }

    @Test
    @DisplayName("Should let the first cancellation reason win")
    void testCancellationToken() {
        CancellationToken token = new CancellationToken();
        assertThatCode(token::throwIfCancellationRequested).doesNotThrowAnyException();

        assertThat(token.cancel(CancellationToken.Reason.TIMEOUT)).isTrue();
        assertThat(token.cancel(CancellationToken.Reason.CANCEL_REQUESTED)).isFalse();

        assertThat(token.getReason()).isEqualTo(CancellationToken.Reason.TIMEOUT);
        assertThatThrownBy(token::throwIfCancellationRequested)
                .isInstanceOf(JobCancelledException.class);
    }

    public static class Resize {
        public int width;
        public int height;
    }

    private static class StubContext implements JobContext {
        private final byte[] payload;
        private final CancellationToken token = new CancellationToken();

        StubContext(String payload) {
            this.payload = payload.getBytes(StandardCharsets.UTF_8);
        }

        @Override public String getJobId() { return "job-1"; }
        @Override public String getType() { return "image_resize"; }
        @Override public byte[] getPayload() { return payload; }
        @Override public int getAttempt() { return 1; }
        @Override public int getMaxAttempts() { return 3; }
        @Override public CancellationToken getCancellationToken() { return token; }
        @Override public void reportProgress(int percent, String message) { }
    }
}
