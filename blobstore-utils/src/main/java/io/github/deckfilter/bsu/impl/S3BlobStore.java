package io.github.deckfilter.bsu.impl;

import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.BlobStoreException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Blob store backed by an S3 compatible bucket. Works against R2 with an endpoint override.
 */
public class S3BlobStore implements BlobStore {

  private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

  private final S3Client s3Client;
  private final String bucket;

  /**
   * Instantiates a new S3 blob store.
   *
   * @param s3Client the s3 client
   * @param bucket   the bucket
   */
  public S3BlobStore(final S3Client s3Client, final String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  @Override
  public Optional<byte[]> get(final String key) {
    final GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try {
      final ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
      return Optional.of(response.asByteArray());
    } catch (NoSuchKeyException e) {
      log.trace("No object s3://{}/{}", bucket, key);
      return Optional.empty();
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw new BlobStoreException("Unable to read s3://" + bucket + "/" + key, e);
    } catch (SdkException e) {
      throw new BlobStoreException("Unable to read s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void put(final String key, final byte[] bytes, final String contentType) {
    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(contentType)
        .build();
    try {
      s3Client.putObject(request, RequestBody.fromBytes(bytes));
      log.trace("Put {} bytes to s3://{}/{}", bytes.length, bucket, key);
    } catch (SdkException e) {
      throw new BlobStoreException("Unable to write s3://" + bucket + "/" + key, e);
    }
  }
}
