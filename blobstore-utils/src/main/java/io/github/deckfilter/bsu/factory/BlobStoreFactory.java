package io.github.deckfilter.bsu.factory;

import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.impl.FileSystemBlobStore;
import io.github.deckfilter.bsu.impl.HttpBlobStore;
import io.github.deckfilter.bsu.impl.InMemoryBlobStore;
import io.github.deckfilter.bsu.impl.PrefixedBlobStore;
import io.github.deckfilter.bsu.impl.S3BlobStore;
import io.github.deckfilter.bsu.model.BlobStoreConfig;
import java.net.URI;
import java.nio.file.Path;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Creates the blob store described by a {@link BlobStoreConfig}.
 */
@Singleton
public class BlobStoreFactory {

  private static final Logger log = LoggerFactory.getLogger(BlobStoreFactory.class);

  private final BlobStoreConfig config;

  /**
   * Instantiates a new Blob store factory.
   *
   * @param config the config
   */
  @Inject
  public BlobStoreFactory(final BlobStoreConfig config) {
    this.config = config;
  }

  /**
   * Create the blob store.
   *
   * @return the blob store
   */
  public BlobStore createBlobStore() {
    log.info("Creating {} blob store", config.type());
    final BlobStore store;
    switch (config.type()) {
      case FILESYSTEM:
        store = new FileSystemBlobStore(Path.of(config.rootDirectory().orElseThrow()));
        break;
      case S3:
        store = new S3BlobStore(s3Client(), config.bucket().orElseThrow());
        break;
      case HTTP:
        store = new HttpBlobStore(httpClient(), config.baseUrl().orElseThrow());
        break;
      case MEMORY:
        store = new InMemoryBlobStore();
        break;
      default:
        throw new IllegalArgumentException("Unsupported blob store type: " + config.type());
    }
    if (config.keyPrefix().isBlank()) {
      return store;
    }
    return new PrefixedBlobStore(store, config.keyPrefix());
  }

  private S3Client s3Client() {
    final S3ClientBuilder builder = S3Client.builder().region(Region.of(config.region()));
    config.endpoint().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));
    return builder.build();
  }

  private CloseableHttpClient httpClient() {
    final Timeout timeout = Timeout.ofMilliseconds(config.requestTimeout().toMillis());
    final ConnectionConfig connectionConfig = ConnectionConfig.custom()
        .setConnectTimeout(timeout)
        .build();
    final RequestConfig requestConfig = RequestConfig.custom()
        .setConnectionRequestTimeout(timeout)
        .setResponseTimeout(timeout)
        .build();
    return HttpClients.custom()
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .setMaxConnTotal(50)
            .setMaxConnPerRoute(20)
            .build())
        .setDefaultRequestConfig(requestConfig)
        .evictExpiredConnections()
        .build();
  }
}
