package io.github.deckfilter.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.deckfilter.bsu.model.BlobStoreConfig;
import io.github.deckfilter.model.Configuration;
import io.github.deckfilter.model.GeneratorPolicy;
import javax.inject.Singleton;

/**
 * Exposes the configuration and its parts.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Blob store config.
   *
   * @return the blob store config
   */
  @Provides
  @Singleton
  public BlobStoreConfig blobStoreConfig() {
    return configuration.blobStore();
  }

  /**
   * Generator policy.
   *
   * @return the generator policy
   */
  @Provides
  @Singleton
  public GeneratorPolicy generatorPolicy() {
    return configuration.generatorPolicy();
  }
}
