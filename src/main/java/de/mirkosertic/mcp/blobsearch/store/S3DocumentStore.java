package de.mirkosertic.mcp.blobsearch.store;

import de.mirkosertic.mcp.blobsearch.CollaboratorUnavailableException;
import de.mirkosertic.mcp.blobsearch.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * {@link DocumentStore} backed by a single Amazon S3 bucket (or an S3 compatible endpoint).
 */
public class S3DocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(S3DocumentStore.class);

    private final S3Client s3;
    private final S3Presigner presigner;
    private final String bucket;
    private final String region;
    private final String prefix;
    private final Set<String> supportedExtensions;

    public S3DocumentStore(final S3Client s3,
                           final S3Presigner presigner,
                           final String bucket,
                           final String region,
                           final String prefix,
                           final List<String> supportedExtensions) {
        this.s3 = s3;
        this.presigner = presigner;
        this.bucket = bucket;
        this.region = region;
        this.prefix = prefix == null ? "" : prefix;
        this.supportedExtensions = Set.copyOf(supportedExtensions);
    }

    /**
     * Builds the S3 clients from configuration. Credentials are resolved by the AWS default provider chain.
     */
    public static S3DocumentStore create(final ApplicationConfig config) {
        if (config.getBucket() == null || config.getBucket().isBlank()) {
            throw new IllegalStateException("No S3 bucket configured, set blobsearch.store.bucket or BLOBSEARCH_S3_BUCKET");
        }

        final Region region = Region.of(config.getRegion());
        final S3Configuration serviceConfiguration = S3Configuration.builder()
                .pathStyleAccessEnabled(config.isPathStyleAccess())
                .build();

        final S3ClientBuilder clientBuilder = S3Client.builder()
                .region(region)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .forcePathStyle(config.isPathStyleAccess());
        final S3Presigner.Builder presignerBuilder = S3Presigner.builder()
                .region(region)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .serviceConfiguration(serviceConfiguration);

        if (config.getEndpoint() != null && !config.getEndpoint().isBlank()) {
            final URI endpoint = URI.create(config.getEndpoint());
            clientBuilder.endpointOverride(endpoint);
            presignerBuilder.endpointOverride(endpoint);
        }

        logger.info("Using S3 bucket '{}' in region {}", config.getBucket(), region);
        return new S3DocumentStore(clientBuilder.build(), presignerBuilder.build(), config.getBucket(),
                config.getRegion(), config.getPrefix(), config.getSupportedExtensions());
    }

    @Override
    public List<DocumentDescriptor> list() throws IOException {
        final List<DocumentDescriptor> result = new ArrayList<>();
        forEachObject(object -> {
            final String key = object.key();
            if (isSupported(key)) {
                result.add(toDescriptor(key, object.size(), object.lastModified(), object.eTag()));
            }
        });
        logger.info("Found {} supported documents in bucket '{}'", result.size(), bucket);
        return result;
    }

    @Override
    @Nullable
    public DocumentDescriptor describe(final String key) throws IOException {
        try {
            final HeadObjectResponse head = s3.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return toDescriptor(key, head.contentLength(), head.lastModified(), head.eTag());
        } catch (final NoSuchKeyException e) {
            return null;
        } catch (final S3Exception e) {
            if (e.statusCode() == 404) {
                return null;
            }
            throw new IOException("Failed to read metadata of " + key + ": " + e.getMessage(), e);
        } catch (final SdkException e) {
            throw new CollaboratorUnavailableException("S3 not reachable while describing " + key, e);
        }
    }

    @Override
    public byte[] fetch(final String key) throws IOException {
        try {
            final byte[] content = s3.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
            logger.debug("Downloaded {} ({} bytes)", key, content.length);
            return content;
        } catch (final NoSuchKeyException e) {
            throw new DocumentNotFoundException(key);
        } catch (final SdkException e) {
            throw new IOException("Failed to download " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String urlFor(final String key, final Duration ttl) throws IOException {
        try {
            final GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .build();
            return presigner.presignGetObject(request).url().toString();
        } catch (final SdkException e) {
            throw new IOException("Failed to presign URL for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public StoreStatistics statistics() throws IOException {
        final long[] totals = new long[2];
        forEachObject(object -> {
            totals[0]++;
            totals[1] += object.size() == null ? 0 : object.size();
        });
        return new StoreStatistics(bucket, region, totals[0], totals[1]);
    }

    private void forEachObject(final Consumer<S3Object> consumer) throws IOException {
        String continuationToken = null;
        try {
            do {
                final ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix);
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                final ListObjectsV2Response page = s3.listObjectsV2(request.build());
                page.contents().forEach(consumer);
                continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuationToken != null);
        } catch (final SdkException e) {
            throw new CollaboratorUnavailableException("Failed to list bucket '" + bucket + "': " + e.getMessage(), e);
        }
    }

    boolean isSupported(final String key) {
        final String extension = DocumentDescriptor.extensionOf(key);
        return !extension.isEmpty() && supportedExtensions.contains("." + extension);
    }

    private static DocumentDescriptor toDescriptor(final String key, final Long size, final Instant modifiedAt,
                                                   final String eTag) {
        return new DocumentDescriptor(
                key,
                size == null ? 0L : size,
                modifiedAt == null ? Instant.EPOCH : modifiedAt,
                stripQuotes(eTag));
    }

    static String stripQuotes(final String eTag) {
        if (eTag == null) {
            return "";
        }
        String result = eTag;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public void close() {
        presigner.close();
        s3.close();
    }
}
