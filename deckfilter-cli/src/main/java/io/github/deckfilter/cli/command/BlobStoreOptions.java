package io.github.deckfilter.cli.command;

import io.github.deckfilter.bsu.model.BlobStoreConfig;
import io.github.deckfilter.bsu.model.BlobStoreType;
import io.github.deckfilter.bsu.model.ImmutableBlobStoreConfig;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/**
 * Blob store selection shared by the commands. Exactly one of directory, bucket or base URL.
 */
public class BlobStoreOptions {

  @Option(
      names = {"--store-dir"},
      description = "Local directory used as blob store")
  private Path storeDir;

  @Option(
      names = {"--s3-bucket"},
      description = "S3 compatible bucket (R2) used as blob store")
  private String s3Bucket;

  @Option(
      names = {"--s3-endpoint"},
      description = "S3 endpoint override, e.g. https://<account>.r2.cloudflarestorage.com")
  private String s3Endpoint;

  @Option(
      names = {"--s3-region"},
      description = "S3 region (default: ${DEFAULT-VALUE})",
      defaultValue = "auto")
  private String s3Region;

  @Option(
      names = {"--base-url"},
      description = "Public base URL to read artifacts from (read only)")
  private String baseUrl;

  @Option(
      names = {"--key-prefix"},
      description = "Prefix prepended to every blob key",
      defaultValue = "")
  private String keyPrefix;

  /**
   * Blob store config of the options.
   *
   * @return the blob store config
   * @throws IllegalArgumentException when not exactly one store is selected
   */
  public BlobStoreConfig toConfig() {
    int selected = 0;
    selected += storeDir != null ? 1 : 0;
    selected += s3Bucket != null ? 1 : 0;
    selected += baseUrl != null ? 1 : 0;
    if (selected != 1) {
      throw new IllegalArgumentException("Select exactly one of --store-dir, --s3-bucket or --base-url");
    }
    final ImmutableBlobStoreConfig.Builder builder = ImmutableBlobStoreConfig.builder().keyPrefix(keyPrefix);
    if (storeDir != null) {
      return builder.type(BlobStoreType.FILESYSTEM).rootDirectory(storeDir.toString()).build();
    }
    if (s3Bucket != null) {
      builder.type(BlobStoreType.S3).bucket(s3Bucket).region(s3Region);
      if (s3Endpoint != null) {
        builder.endpoint(s3Endpoint);
      }
      return builder.build();
    }
    return builder.type(BlobStoreType.HTTP).baseUrl(baseUrl).build();
  }
}
