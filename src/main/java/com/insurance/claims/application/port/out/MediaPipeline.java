package com.insurance.claims.application.port.out;

import java.util.concurrent.CompletableFuture;

/**
 * Secondary (outbound) port: evidence media compression and durable storage.
 * <p>
 * Both operations complete exceptionally on failure. Retries, if any, belong
 * to the implementation; the caller never retries.
 * </p>
 */
public interface MediaPipeline {

    /**
     * Compresses a captured artifact to fit within a size budget.
     *
     * @param localReference handle of the captured, not yet uploaded artifact
     * @param maxBytes       size budget of the compressed artifact
     * @return reference of the compressed artifact
     */
    CompletableFuture<String> compress(String localReference, long maxBytes);

    /**
     * Uploads a compressed artifact to durable object storage.
     *
     * @param compressedReference reference returned by {@link #compress}
     * @param destination         storage destination, e.g. a bucket name
     * @return retrievable remote reference, e.g. {@code s3://bucket/key}
     */
    CompletableFuture<String> upload(String compressedReference, String destination);
}
