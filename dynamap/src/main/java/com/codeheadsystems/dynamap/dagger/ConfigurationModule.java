package com.codeheadsystems.dynamap.dagger;

import com.codeheadsystems.dynamap.model.Configuration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;
  private final DynamoDbClient dynamoDbClient;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration  the configuration
   * @param dynamoDbClient the client, owned by the caller
   */
  public ConfigurationModule(final Configuration configuration,
                             final DynamoDbClient dynamoDbClient) {
    this.configuration = configuration;
    this.dynamoDbClient = dynamoDbClient;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Dynamo db client.
   *
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient() {
    return dynamoDbClient;
  }
}
