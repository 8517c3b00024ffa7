package com.taskforge.resize.infrastructure.storage;

import com.taskforge.resize.config.WorkerProperties;
import com.taskforge.resize.infrastructure.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

/**
 * Upload, existence check and presigning against the configured bucket.
 */
@Component
public class ObjectStorage {
  private static final Logger log = LoggerFactory.getLogger(ObjectStorage.class);

  private final S3Client s3;
  private final S3Presigner presigner;
  private final TaskMetrics metrics;
  private final String bucket;

  public ObjectStorage(S3Client s3, S3Presigner presigner, TaskMetrics metrics, WorkerProperties props) {
    this.s3 = s3;
    this.presigner = presigner;
    this.metrics = metrics;
    this.bucket = props.storage().bucket();
  }

  public boolean exists(String key) {
    try {
      s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) return false;
      throw new StorageException("error checking if object exists: " + key, e);
    } catch (SdkException e) {
      throw new StorageException("error checking if object exists: " + key, e);
    }
  }

  /** Uploads and returns a URL presigned for {@code urlTtl}. */
  public String upload(byte[] body, String key, String contentType, Duration urlTtl) {
    try {
      s3.putObject(PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .build(),
          RequestBody.fromBytes(body));
    } catch (SdkException e) {
      metrics.uploadFailed();
      throw new StorageException("upload failed: " + key, e);
    }
    log.debug("Uploaded {} bytes to s3://{}/{}", body.length, bucket, key);
    try {
      return presign(key, urlTtl);
    } catch (StorageException e) {
      metrics.uploadFailed();
      throw e;
    }
  }

  public String presign(String key, Duration ttl) {
    try {
      GetObjectPresignRequest request = GetObjectPresignRequest.builder()
          .signatureDuration(ttl)
          .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
          .build();
      return presigner.presignGetObject(request).url().toString();
    } catch (SdkException e) {
      throw new StorageException("failed to create presigned URL: " + key, e);
    }
  }
}
