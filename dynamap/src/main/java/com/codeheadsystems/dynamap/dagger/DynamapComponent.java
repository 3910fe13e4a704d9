package com.codeheadsystems.dynamap.dagger;

import com.codeheadsystems.dynamap.StorageFactory;
import com.codeheadsystems.dynamap.converter.ConnectionUrlConverter;
import com.codeheadsystems.dynamap.converter.CursorCodec;
import com.codeheadsystems.dynamap.model.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Component;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The interface Dynamap component.
 */
@Singleton
@Component(modules = {DynamapModule.class, ConfigurationModule.class})
public interface DynamapComponent {

  /**
   * Instance dynamap component.
   *
   * @param configuration  the configuration
   * @param dynamoDbClient the client
   * @return the dynamap component
   */
  static DynamapComponent instance(final Configuration configuration, final DynamoDbClient dynamoDbClient) {
    return DaggerDynamapComponent.builder()
        .configurationModule(new ConfigurationModule(configuration, dynamoDbClient))
        .build();
  }

  /**
   * Storage factory.
   *
   * @return the storage factory
   */
  StorageFactory storageFactory();

  /**
   * Cursor codec.
   *
   * @return the cursor codec
   */
  CursorCodec cursorCodec();

  /**
   * Connection url converter.
   *
   * @return the connection url converter
   */
  ConnectionUrlConverter connectionUrlConverter();

  /**
   * Object mapper.
   *
   * @return the object mapper
   */
  ObjectMapper objectMapper();
}
