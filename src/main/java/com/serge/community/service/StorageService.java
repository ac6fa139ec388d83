package com.serge.community.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Locale;
import java.util.UUID;

/**
 * Avatar images in an S3 compatible bucket.
 */
@Service
@RequiredArgsConstructor
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    static final long MAX_AVATAR_BYTES = 2 * 1024 * 1024;

    private final S3Client s3;

    @Value("${S3_BUCKET:dev-community}")
    private String bucket = "dev-community";

    @Value("${S3_PUBLIC_URL:http://localhost:9000}")
    private String publicUrl = "http://localhost:9000";

    /**
     * Stores an avatar and returns its object key.
     *
     * @throws IllegalArgumentException for empty, oversized or non-image uploads
     */
    public String uploadAvatar(UUID accountId, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Avatar file is empty");
        }
        if (bytes.length > MAX_AVATAR_BYTES) {
            throw new IllegalArgumentException("Avatar must not exceed " + MAX_AVATAR_BYTES + " bytes");
        }
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new IllegalArgumentException("Avatar must be an image");
        }
        ensureBucket();
        String key = "avatars/" + accountId + "/" + UUID.randomUUID();
        s3.putObject(PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentType(contentType)
                        .build(),
                RequestBody.fromBytes(bytes));
        log.info("storage.avatar.uploaded accountId={} key={} size={}", accountId, key, bytes.length);
        return key;
    }

    public String publicUrl(String key) {
        String base = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        return base + "/" + bucket + "/" + key;
    }

    private void ensureBucket() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("storage.bucket.create bucket={}", bucket);
            s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException e) {
            // putObject reports the real problem if the bucket is unusable
            log.warn("storage.bucket.check_failed bucket={} msg={}", bucket, e.getMessage());
        }
    }
}
