package com.codeheadsystems.dynamap;

import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.converter.EntityCodec;
import com.codeheadsystems.dynamap.manager.MatchManager;
import com.codeheadsystems.dynamap.model.Configuration;
import com.codeheadsystems.dynamap.schema.EntitySchema;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Creates typed storage for entity schemas, sharing one client.
 */
@Singleton
public class StorageFactory {

  private static final Logger log = LoggerFactory.getLogger(StorageFactory.class);

  private final DynamoDbClient client;
  private final Configuration configuration;

  /**
   * Instantiates a new Storage factory.
   *
   * @param client        the client
   * @param configuration the default configuration
   */
  @Inject
  public StorageFactory(final DynamoDbClient client,
                        final Configuration configuration) {
    log.info("StorageFactory({},{})", client, configuration);
    this.client = client;
    this.configuration = configuration;
  }

  /**
   * Storage for a schema in the configured table.
   *
   * @param schema the schema
   * @param <T>    the entity type
   * @return the key val
   */
  public <T extends Thing> KeyVal<T> create(final EntitySchema<T> schema) {
    return create(schema, configuration);
  }

  /**
   * Storage for a schema in another table.
   *
   * @param schema        the schema
   * @param configuration the configuration
   * @param <T>           the entity type
   * @return the key val
   */
  public <T extends Thing> KeyVal<T> create(final EntitySchema<T> schema, final Configuration configuration) {
    log.trace("create({},{})", schema, configuration);
    final EntityCodec<T> codec = new EntityCodec<>(schema, configuration.hashKey(), configuration.sortKey(),
        configuration.strictType());
    return new DynamoDbKeyVal<>(client, configuration, codec, new MatchManager<>(client, configuration, codec));
  }
}
