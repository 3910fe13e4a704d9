package com.codeheadsystems.dynamap;

import com.codeheadsystems.dynamap.api.BatchResult;
import com.codeheadsystems.dynamap.api.ImmutableBatchResult;
import com.codeheadsystems.dynamap.api.MatchOption;
import com.codeheadsystems.dynamap.api.Page;
import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.api.exception.NotFoundException;
import com.codeheadsystems.dynamap.api.exception.PreConditionFailedException;
import com.codeheadsystems.dynamap.api.exception.ServiceIoException;
import com.codeheadsystems.dynamap.converter.EntityCodec;
import com.codeheadsystems.dynamap.expression.CompiledExpression;
import com.codeheadsystems.dynamap.expression.Constraint;
import com.codeheadsystems.dynamap.expression.Constraints;
import com.codeheadsystems.dynamap.expression.UpdateClauses;
import com.codeheadsystems.dynamap.expression.Updater;
import com.codeheadsystems.dynamap.manager.MatchManager;
import com.codeheadsystems.dynamap.model.Configuration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Key-value storage of one entity type in a DynamoDB table.
 *
 * @param <T> the entity type
 */
public class DynamoDbKeyVal<T extends Thing> implements KeyVal<T> {

  /**
   * Most keys a single batch read may carry.
   */
  public static final int BATCH_GET_SIZE = 100;

  /**
   * Most requests a single batch write may carry.
   */
  public static final int BATCH_WRITE_SIZE = 25;

  private static final String CONDITION_SCOPE = "c_";
  private static final Logger log = LoggerFactory.getLogger(DynamoDbKeyVal.class);

  private final DynamoDbClient client;
  private final Configuration configuration;
  private final EntityCodec<T> codec;
  private final MatchManager<T> matchManager;

  /**
   * Instantiates a new Dynamo db key val.
   *
   * @param client        the client
   * @param configuration the configuration
   * @param codec         the codec
   * @param matchManager  the match manager
   */
  public DynamoDbKeyVal(final DynamoDbClient client,
                        final Configuration configuration,
                        final EntityCodec<T> codec,
                        final MatchManager<T> matchManager) {
    log.info("DynamoDbKeyVal({},{})", configuration, codec.schema().type().getSimpleName());
    this.client = client;
    this.configuration = configuration;
    this.codec = codec;
    this.matchManager = matchManager;
  }

  @Override
  public T get(final T key) {
    log.trace("get({})", key);
    final GetItemRequest request = GetItemRequest.builder()
        .tableName(configuration.table())
        .key(codec.encodeKey(key))
        .projectionExpression(codec.projection())
        .expressionAttributeNames(codec.projectionNames())
        .build();
    final GetItemResponse response;
    try {
      response = client.getItem(request);
    } catch (SdkException e) {
      throw serviceIo("get", key, e);
    }
    if (!response.hasItem() || response.item().isEmpty()) {
      throw new NotFoundException(key);
    }
    return codec.decode(response.item());
  }

  @Override
  @SafeVarargs
  public final void put(final T entity, final Constraint<T>... constraints) {
    log.trace("put({})", entity);
    final List<Constraint<T>> conditions = Arrays.asList(constraints);
    final CompiledExpression condition = Constraints.compile(conditions);
    final PutItemRequest request = PutItemRequest.builder()
        .tableName(configuration.table())
        .item(codec.encode(entity))
        .conditionExpression(condition.expression().orElse(null))
        .expressionAttributeNames(condition.namesOrNull())
        .expressionAttributeValues(condition.valuesOrNull())
        .build();
    try {
      client.putItem(request);
    } catch (ConditionalCheckFailedException e) {
      throw preConditionFailed(entity, conditions, e);
    } catch (SdkException e) {
      throw serviceIo("put", entity, e);
    }
  }

  @Override
  @SafeVarargs
  public final Optional<T> remove(final T key, final Constraint<T>... constraints) {
    log.trace("remove({})", key);
    final List<Constraint<T>> conditions = Arrays.asList(constraints);
    final CompiledExpression condition = Constraints.compile(conditions);
    final DeleteItemRequest request = DeleteItemRequest.builder()
        .tableName(configuration.table())
        .key(codec.encodeKey(key))
        .conditionExpression(condition.expression().orElse(null))
        .expressionAttributeNames(condition.namesOrNull())
        .expressionAttributeValues(condition.valuesOrNull())
        .returnValues(ReturnValue.ALL_OLD)
        .build();
    final DeleteItemResponse response;
    try {
      response = client.deleteItem(request);
    } catch (ConditionalCheckFailedException e) {
      throw preConditionFailed(key, conditions, e);
    } catch (SdkException e) {
      throw serviceIo("remove", key, e);
    }
    if (!response.hasAttributes() || response.attributes().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(codec.decode(response.attributes()));
  }

  @Override
  @SafeVarargs
  public final T update(final T entity, final Constraint<T>... constraints) {
    return updateWith(Updater.of(entity), constraints);
  }

  @Override
  @SafeVarargs
  public final T updateWith(final Updater<T> updater, final Constraint<T>... constraints) {
    log.trace("updateWith({})", updater);
    final T entity = updater.entity();
    final Map<String, AttributeValue> key = codec.encodeKey(entity);
    final Map<String, AttributeValue> item = codec.encode(entity);
    final UpdateClauses clauses = updater.clauses();
    clauses.covered().stream()
        .filter(codec::isKeyAttribute)
        .findFirst()
        .ifPresent(name -> {
          throw new IllegalArgumentException("Key attribute " + name + " cannot be updated");
        });
    item.forEach((name, value) -> {
      if (!codec.isKeyAttribute(name) && !Boolean.TRUE.equals(value.nul()) && !clauses.isCovered(name)) {
        clauses.set(name, value);
      }
    });
    final List<Constraint<T>> conditions = Arrays.asList(constraints);
    final Optional<String> condition = Constraints.render(clauses.attributes().scoped(CONDITION_SCOPE), conditions);

    final UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(configuration.table())
        .key(key)
        .updateExpression(clauses.expression().orElse(null))
        .conditionExpression(condition.orElse(null))
        .expressionAttributeNames(clauses.attributes().namesOrNull())
        .expressionAttributeValues(clauses.attributes().valuesOrNull())
        .returnValues(ReturnValue.ALL_NEW)
        .build();
    final UpdateItemResponse response;
    try {
      response = client.updateItem(request);
    } catch (ConditionalCheckFailedException e) {
      throw preConditionFailed(entity, conditions, e);
    } catch (SdkException e) {
      throw serviceIo("update", entity, e);
    }
    return codec.decode(response.attributes());
  }

  @Override
  public Page<T> match(final T key, final MatchOption... options) {
    return matchManager.match(key, options);
  }

  @Override
  public Page<T> matchKey(final Thing key, final MatchOption... options) {
    return matchManager.match(key, options);
  }

  @Override
  public Stream<T> stream(final Thing key, final int pageSize) {
    return matchManager.stream(key, pageSize);
  }

  @Override
  public BatchResult<T> batchGet(final List<T> keys) {
    log.trace("batchGet({})", keys.size());
    final ImmutableBatchResult.Builder<T> result = ImmutableBatchResult.builder();
    for (List<T> chunk : partition(keys, BATCH_GET_SIZE)) {
      final KeysAndAttributes request = KeysAndAttributes.builder()
          .keys(chunk.stream().map(codec::encodeKey).toList())
          .projectionExpression(codec.projection())
          .expressionAttributeNames(codec.projectionNames())
          .build();
      final BatchGetItemResponse response;
      try {
        response = client.batchGetItem(BatchGetItemRequest.builder()
            .requestItems(Map.of(configuration.table(), request))
            .build());
      } catch (SdkException e) {
        throw new ServiceIoException("Service I/O failed on batch get", e);
      }
      response.responses().getOrDefault(configuration.table(), List.of())
          .forEach(item -> result.addItems(codec.decode(item)));
      Optional.ofNullable(response.unprocessedKeys().get(configuration.table()))
          .ifPresent(unprocessed -> unprocessed.keys().forEach(item -> result.addUnprocessed(codec.decode(item))));
    }
    return logged("batchGet", result.build());
  }

  @Override
  public BatchResult<T> batchPut(final List<T> entities) {
    log.trace("batchPut({})", entities.size());
    return batchWrite("batchPut", entities,
        entity -> WriteRequest.builder()
            .putRequest(PutRequest.builder().item(codec.encode(entity)).build())
            .build(),
        write -> write.putRequest().item());
  }

  @Override
  public BatchResult<T> batchRemove(final List<T> keys) {
    log.trace("batchRemove({})", keys.size());
    return batchWrite("batchRemove", keys,
        key -> WriteRequest.builder()
            .deleteRequest(DeleteRequest.builder().key(codec.encodeKey(key)).build())
            .build(),
        write -> write.deleteRequest().key());
  }

  private BatchResult<T> batchWrite(final String operation,
                                    final List<T> entities,
                                    final Function<T, WriteRequest> toRequest,
                                    final Function<WriteRequest, Map<String, AttributeValue>> fromUnprocessed) {
    final ImmutableBatchResult.Builder<T> result = ImmutableBatchResult.builder();
    for (List<T> chunk : partition(entities, BATCH_WRITE_SIZE)) {
      final List<WriteRequest> requests = chunk.stream().map(toRequest).toList();
      final BatchWriteItemResponse response;
      try {
        response = client.batchWriteItem(BatchWriteItemRequest.builder()
            .requestItems(Map.of(configuration.table(), requests))
            .build());
      } catch (SdkException e) {
        throw new ServiceIoException("Service I/O failed on " + operation, e);
      }
      response.unprocessedItems().getOrDefault(configuration.table(), List.of())
          .forEach(write -> result.addUnprocessed(codec.decode(fromUnprocessed.apply(write))));
    }
    return logged(operation, result.build());
  }

  private BatchResult<T> logged(final String operation, final BatchResult<T> result) {
    if (!result.isComplete()) {
      log.warn("{}: {} item(s) unprocessed", operation, result.unprocessed().size());
    }
    return result;
  }

  private static <E> List<List<E>> partition(final List<E> list, final int size) {
    final List<List<E>> chunks = new ArrayList<>();
    for (int i = 0; i < list.size(); i += size) {
      chunks.add(list.subList(i, Math.min(list.size(), i + size)));
    }
    return chunks;
  }

  private PreConditionFailedException preConditionFailed(final Thing key,
                                                         final List<Constraint<T>> conditions,
                                                         final ConditionalCheckFailedException e) {
    log.debug("Pre condition failed for {}: {}", key, e.getMessage());
    return new PreConditionFailedException(key, Constraints.signalsConflict(conditions),
        Constraints.signalsGone(conditions), e);
  }

  private ServiceIoException serviceIo(final String operation, final Thing key, final SdkException e) {
    log.error("Service I/O failed on {} {}", operation, key, e);
    return new ServiceIoException("Service I/O failed on " + operation + " (" + key.hashKey() + ", "
        + key.sortKey() + ")", e);
  }
}
