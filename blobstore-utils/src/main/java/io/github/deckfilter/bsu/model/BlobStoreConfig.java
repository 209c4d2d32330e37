package io.github.deckfilter.bsu.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The blob store connection settings.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBlobStoreConfig.class)
@JsonDeserialize(as = ImmutableBlobStoreConfig.class)
public interface BlobStoreConfig {

  /**
   * Backend type.
   *
   * @return the type
   */
  BlobStoreType type();

  /**
   * Root directory for {@link BlobStoreType#FILESYSTEM}.
   *
   * @return the root directory
   */
  Optional<String> rootDirectory();

  /**
   * Bucket name for {@link BlobStoreType#S3}.
   *
   * @return the bucket
   */
  Optional<String> bucket();

  /**
   * Endpoint override for S3 compatible stores such as R2.
   *
   * @return the endpoint
   */
  Optional<String> endpoint();

  /**
   * Region for {@link BlobStoreType#S3}.
   *
   * @return the region
   */
  @Value.Default
  default String region() {
    return "auto";
  }

  /**
   * Base URL for {@link BlobStoreType#HTTP}.
   *
   * @return the base url
   */
  Optional<String> baseUrl();

  /**
   * Prefix prepended to every key, without trailing slash.
   *
   * @return the key prefix
   */
  @Value.Default
  default String keyPrefix() {
    return "";
  }

  /**
   * Connect and response timeout for remote backends.
   *
   * @return the timeout
   */
  @Value.Default
  default Duration requestTimeout() {
    return Duration.ofSeconds(12);
  }

  /**
   * Validates backend specific settings.
   */
  @Value.Check
  default void check() {
    switch (type()) {
      case FILESYSTEM:
        if (rootDirectory().isEmpty()) {
          throw new IllegalStateException("rootDirectory is required for a FILESYSTEM blob store");
        }
        break;
      case S3:
        if (bucket().isEmpty()) {
          throw new IllegalStateException("bucket is required for an S3 blob store");
        }
        break;
      case HTTP:
        if (baseUrl().isEmpty()) {
          throw new IllegalStateException("baseUrl is required for an HTTP blob store");
        }
        break;
      default:
        break;
    }
  }
}
