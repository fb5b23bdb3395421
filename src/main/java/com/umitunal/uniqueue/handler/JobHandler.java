package com.umitunal.uniqueue.handler;

import com.umitunal.uniqueue.serialization.PayloadCodec;
import com.umitunal.uniqueue.serialization.PayloadCodecException;

/**
 * Execution logic for one job type, e.g. video conversion or PDF rendering.
 *
 * <pre>{@code
 * registry.register("pdf_render", JobHandler.typed(new JsonCodec<>(RenderRequest.class), (request, ctx) -> {
 *     Path output = renderer.render(request.input(), ctx.getCancellationToken());
 *     return Outcome.success(output.toString());
 * }));
 * }</pre>
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Execute one attempt of a job.
     *
     * @param context payload, attempt number, cancellation token and progress reporting
     * @return the outcome of this attempt
     * @throws UnrecoverableJobException to fail the job without retry
     * @throws Exception any other failure, treated as recoverable
     */
    Outcome execute(JobContext context) throws Exception;

    /**
     * Adapt a handler working on a typed payload. Payloads the codec cannot decode fail
     * the job as unrecoverable.
     */
    static <T> JobHandler typed(PayloadCodec<T> codec, TypedHandler<T> handler) {
        return context -> {
            T payload;
            try {
                payload = codec.decode(context.getPayload());
            } catch (PayloadCodecException e) {
                return Outcome.unrecoverable("Malformed payload: " + e.getMessage());
            }
            return handler.execute(payload, context);
        };
    }

    /**
     * Handler body receiving the decoded payload.
     *
     * @param <T> payload type
     */
    @FunctionalInterface
    interface TypedHandler<T> {
        Outcome execute(T payload, JobContext context) throws Exception;
    }
}
