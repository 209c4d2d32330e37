package io.github.deckfilter.bsu.impl;

import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.BlobStoreException;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read only blob store over plain HTTP GET against a public base URL.
 */
public class HttpBlobStore implements BlobStore {

  private static final Logger log = LoggerFactory.getLogger(HttpBlobStore.class);

  private final CloseableHttpClient httpClient;
  private final String baseUrl;

  /**
   * Instantiates a new Http blob store.
   *
   * @param httpClient the http client
   * @param baseUrl    the base url
   */
  public HttpBlobStore(final CloseableHttpClient httpClient, final String baseUrl) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl.replaceAll("/+$", "");
  }

  /**
   * The URL a key is fetched from. Each path segment is percent encoded.
   *
   * @param key the key
   * @return the url
   */
  public String urlFor(final String key) {
    final String path = Arrays.stream(key.split("/"))
        .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
        .collect(Collectors.joining("/"));
    return baseUrl + "/" + path;
  }

  @Override
  public Optional<byte[]> get(final String key) {
    final String url = urlFor(key);
    log.debug("GET {}", url);
    try {
      return httpClient.execute(new HttpGet(url), response -> {
        final int status = response.getCode();
        if (status == 404) {
          EntityUtils.consume(response.getEntity());
          return Optional.empty();
        }
        if (status < 200 || status >= 300) {
          EntityUtils.consume(response.getEntity());
          throw new BlobStoreException("HTTP " + status + " for " + url);
        }
        return Optional.of(EntityUtils.toByteArray(response.getEntity()));
      });
    } catch (IOException e) {
      throw new BlobStoreException("Unable to fetch " + url, e);
    }
  }

  @Override
  public void put(final String key, final byte[] bytes, final String contentType) {
    throw new BlobStoreException("HTTP blob store is read only: " + key);
  }
}
