package com.example.bucketbrowser.store;

import com.example.bucketbrowser.metadata.ObjectMeta;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ObjectStore} backed by an S3 bucket through the AWS SDK v2.
 */
public final class S3ObjectStore implements ObjectStore, AutoCloseable {
    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;
    private final int pageSize;

    public S3ObjectStore(String bucket, Optional<String> region, int pageSize, Duration callTimeout) {
        ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
                .apiCallTimeout(callTimeout)
                .build();
        this.bucket = bucket;
        this.pageSize = pageSize;
        this.s3Client = region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).overrideConfiguration(overrides).build())
                .orElseGet(() -> S3Client.builder().overrideConfiguration(overrides).build());
        this.presigner = region
                .map(Region::of)
                .map(r -> S3Presigner.builder().region(r).build())
                .orElseGet(() -> S3Presigner.builder().build());
    }

    @Override
    public ChildListing listChildren(String prefix, String continuationToken) {
        ListObjectsV2Response response = list(prefix, DELIMITER, continuationToken);
        List<String> prefixes = new ArrayList<>();
        for (CommonPrefix commonPrefix : response.commonPrefixes()) {
            prefixes.add(commonPrefix.prefix());
        }
        return new ChildListing(prefixes, toMetas(response.contents()), nextToken(response));
    }

    @Override
    public ObjectPage listRecursive(String prefix, String continuationToken) {
        ListObjectsV2Response response = list(prefix, null, continuationToken);
        return new ObjectPage(toMetas(response.contents()), nextToken(response));
    }

    @Override
    public Optional<ObjectMeta> probeObject(String key) {
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            long size = head.contentLength() == null ? 0L : head.contentLength();
            return Optional.of(new ObjectMeta(key, size, head.lastModified(), head.contentType()));
        } catch (S3Exception ex) {
            if (ex.statusCode() == 404) {
                return Optional.empty();
            }
            throw wrap("HEAD", key, ex);
        } catch (SdkClientException ex) {
            throw wrap("HEAD", key, ex);
        }
    }

    @Override
    public InputStream openObject(String key) {
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException ex) {
            throw wrap("GET", key, ex);
        }
    }

    @Override
    public URL issueTemporaryUrl(String key, Duration ttl) {
        try {
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .build();
            return presigner.presignGetObject(request).url();
        } catch (SdkException ex) {
            throw wrap("PRESIGN", key, ex);
        }
    }

    @Override
    public void close() {
        try {
            presigner.close();
        } finally {
            s3Client.close();
        }
    }

    private ListObjectsV2Response list(String prefix, String delimiter, String continuationToken) {
        ListObjectsV2Request.Builder builder = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .maxKeys(pageSize);
        if (delimiter != null) {
            builder.delimiter(delimiter);
        }
        if (continuationToken != null) {
            builder.continuationToken(continuationToken);
        }
        try {
            return s3Client.listObjectsV2(builder.build());
        } catch (SdkException ex) {
            throw wrap("LIST", prefix, ex);
        }
    }

    private List<ObjectMeta> toMetas(List<S3Object> contents) {
        List<ObjectMeta> metas = new ArrayList<>(contents.size());
        for (S3Object object : contents) {
            long size = object.size() == null ? 0L : object.size();
            metas.add(new ObjectMeta(object.key(), size, object.lastModified()));
        }
        return metas;
    }

    private String nextToken(ListObjectsV2Response response) {
        return Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
    }

    private ObjectStoreException wrap(String operation, String key, SdkException ex) {
        return new ObjectStoreException(
                String.format("%s s3://%s/%s failed: %s", operation, bucket, key, ex.getMessage()), ex);
    }
}
