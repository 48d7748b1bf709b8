package com.scholary.montage.config;

import com.scholary.montage.objectstore.ObjectStoreClient;
import com.scholary.montage.objectstore.ObjectStoreProperties;
import com.scholary.montage.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient bean from the "objectstore.*" properties.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
