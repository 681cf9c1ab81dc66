package com.insurance.claims.adapters.out.s3;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.MediaPipeline;
import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.insurance.claims.domain.exception.MediaPipelineException;
import com.insurance.claims.domain.valueobject.FailureStage;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3 implementation of the MediaPipeline outbound port.
 * <p>
 * Local references are file paths or {@code file:} URIs and must resolve to a
 * regular file inside the staging directory ({@code claims.media.staging-dir});
 * symbolic links are refused. An artifact already within the size budget is
 * uploaded as captured; a larger one is gzip-packed into the staging area's
 * {@code .packed} directory and refused if it still exceeds the budget.
 * Packed files are deleted once their upload has been attempted.
 * Uploads land under {@code evidence/} in the destination bucket and resolve
 * to {@code s3://bucket/key}.
 * </p>
 */
@Component
public class S3MediaPipeline implements MediaPipeline {

    private static final Logger log = LoggerFactory.getLogger(S3MediaPipeline.class);
    private static final String KEY_PREFIX = "evidence/";
    private static final String GZIP_SUFFIX = ".gz";
    private static final String PACKED_DIR = ".packed";

    private final S3Client s3Client;
    private final Executor executor;
    private final Path stagingDir;
    private final Path packedDir;

    public S3MediaPipeline(S3Client s3Client,
            @Qualifier("claimsPipelineExecutor") Executor executor,
            ClaimsProperties claimsProperties) {
        this.s3Client = s3Client;
        this.executor = executor;
        this.stagingDir = Path.of(claimsProperties.getMedia().getStagingDir()).toAbsolutePath().normalize();
        this.packedDir = stagingDir.resolve(PACKED_DIR);
    }

    @Override
    public CompletableFuture<String> compress(String localReference, long maxBytes) {
        return CompletableFuture.supplyAsync(() -> compressWithinBudget(localReference, maxBytes), executor);
    }

    @Override
    public CompletableFuture<String> upload(String compressedReference, String destination) {
        return CompletableFuture.supplyAsync(() -> putObject(compressedReference, destination), executor);
    }

    String compressWithinBudget(String localReference, long maxBytes) {
        Path source = resolveStaged(localReference, FailureStage.MEDIA_COMPRESSION);
        try {
            long size = Files.size(source);
            if (size <= maxBytes) {
                log.info("action=media_within_budget path={} bytes={} maxBytes={}", source, size, maxBytes);
                return source.toString();
            }

            Files.createDirectories(packedDir);
            Path packed = Files.createTempFile(packedDir, "evidence-", source.getFileName() + GZIP_SUFFIX);
            try (InputStream in = Files.newInputStream(source);
                    OutputStream out = new GZIPOutputStream(Files.newOutputStream(packed))) {
                in.transferTo(out);
            }
            long packedSize = Files.size(packed);
            if (packedSize > maxBytes) {
                Files.deleteIfExists(packed);
                throw new MediaPipelineException(FailureStage.MEDIA_COMPRESSION,
                        "Media artifact exceeds size budget after compression: "
                                + packedSize + " > " + maxBytes + " bytes");
            }
            log.info("action=media_compressed path={} bytes={} compressedBytes={}", source, size, packedSize);
            return packed.toString();
        } catch (IOException e) {
            throw new MediaPipelineException(FailureStage.MEDIA_COMPRESSION,
                    "Media compression I/O error: " + e.getMessage(), e);
        }
    }

    String putObject(String compressedReference, String bucket) {
        Path file = resolveStaged(compressedReference, FailureStage.MEDIA_UPLOAD);
        String fileName = file.getFileName().toString();
        String key = KEY_PREFIX + UUID.randomUUID() + "-" + fileName;

        try {
            PutObjectRequest.Builder request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentTypeOf(file));
            if (fileName.endsWith(GZIP_SUFFIX)) {
                request.contentEncoding("gzip");
            }

            log.info("action=media_upload_start bucket={} key={}", bucket, key);
            s3Client.putObject(request.build(), RequestBody.fromFile(file));
            log.info("action=media_upload_complete bucket={} key={}", bucket, key);
            return "s3://" + bucket + "/" + key;
        } catch (SdkException e) {
            throw new MediaPipelineException(FailureStage.MEDIA_UPLOAD,
                    "Upload to s3://" + bucket + " failed: " + e.getMessage(), e);
        } finally {
            if (file.startsWith(packedDir)) {
                deletePacked(file);
            }
        }
    }

    /**
     * Resolves a reference to a regular file inside the staging directory.
     * Missing, outside and linked artifacts are reported alike.
     */
    private Path resolveStaged(String reference, FailureStage stage) {
        if (reference == null || reference.isBlank()) {
            throw unavailable(reference, stage, null);
        }
        Path candidate;
        try {
            candidate = toPath(reference).toAbsolutePath().normalize();
        } catch (IllegalArgumentException e) {
            throw unavailable(reference, stage, e);
        }

        if (!candidate.startsWith(stagingDir)
                || !Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
            throw unavailable(reference, stage, null);
        }
        try {
            // Rejects links anywhere along the path
            if (!candidate.toRealPath().startsWith(stagingDir.toRealPath())) {
                throw unavailable(reference, stage, null);
            }
        } catch (IOException e) {
            throw unavailable(reference, stage, e);
        }
        return candidate;
    }

    private static MediaPipelineException unavailable(String reference, FailureStage stage, Throwable cause) {
        log.warn("action=media_reference_refused stage={} reference={}", stage, reference);
        return new MediaPipelineException(stage, "Media artifact unavailable: " + reference, cause);
    }

    private static Path toPath(String reference) {
        if (reference.startsWith("file:")) {
            return Path.of(URI.create(reference));
        }
        return Path.of(reference);
    }

    private static void deletePacked(Path file) {
        try {
            Files.deleteIfExists(file);
            log.debug("action=packed_media_deleted path={}", file);
        } catch (IOException e) {
            log.warn("action=packed_media_delete_failed path={} error={}", file, e.getMessage(), e);
        }
    }

    private static String contentTypeOf(Path file) {
        try {
            String detected = Files.probeContentType(file);
            return detected != null ? detected : "application/octet-stream";
        } catch (IOException e) {
            log.debug("action=content_type_unknown path={} error={}", file, e.getMessage());
            return "application/octet-stream";
        }
    }
}
