package com.codeheadsystems.dynamap.manager;

import com.codeheadsystems.dynamap.api.Cursor;
import com.codeheadsystems.dynamap.api.ImmutablePage;
import com.codeheadsystems.dynamap.api.Limit;
import com.codeheadsystems.dynamap.api.MatchOption;
import com.codeheadsystems.dynamap.api.Page;
import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.api.exception.InvalidKeyException;
import com.codeheadsystems.dynamap.api.exception.ServiceIoException;
import com.codeheadsystems.dynamap.converter.EntityCodec;
import com.codeheadsystems.dynamap.model.Configuration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

/**
 * Runs match queries: every item under a hash key, optionally restricted to a sort key prefix, one page at a time.
 *
 * <p>A match starts without a cursor and continues with the cursor of the previous page. A page comes back with a
 * cursor while the backend reports more items and without one once the results are exhausted.
 *
 * @param <T> the entity type
 */
public class MatchManager<T extends Thing> {

  private static final Logger log = LoggerFactory.getLogger(MatchManager.class);

  private final DynamoDbClient client;
  private final Configuration configuration;
  private final EntityCodec<T> codec;

  /**
   * Instantiates a new Match manager.
   *
   * @param client        the client
   * @param configuration the configuration
   * @param codec         the codec
   */
  public MatchManager(final DynamoDbClient client,
                      final Configuration configuration,
                      final EntityCodec<T> codec) {
    log.info("MatchManager({},{})", configuration, codec.schema().type().getSimpleName());
    this.client = client;
    this.configuration = configuration;
    this.codec = codec;
  }

  /**
   * Reads one page.
   *
   * @param key     hash key, and sort key prefix if not empty
   * @param options limit and cursor, the last of each kind wins
   * @return the page
   */
  public Page<T> match(final Thing key, final MatchOption... options) {
    log.trace("match({},{})", key, options);
    final Map<String, AttributeValue> encodedKey = codec.encodeKey(key);
    final String hashKey = codec.hashKey();
    final String sortKey = codec.sortKey();
    final String sortPrefix = encodedKey.get(sortKey).s();

    final Map<String, String> names = new HashMap<>(codec.projectionNames());
    final Map<String, AttributeValue> values = new HashMap<>();
    names.put("#__" + hashKey + "__", hashKey);
    values.put(":__" + hashKey + "__", encodedKey.get(hashKey));
    String keyCondition = "#__" + hashKey + "__ = :__" + hashKey + "__";
    if (!EntityCodec.SORT_KEY_SENTINEL.equals(sortPrefix)) {
      names.put("#__" + sortKey + "__", sortKey);
      values.put(":__" + sortKey + "__", encodedKey.get(sortKey));
      keyCondition += " and begins_with(#__" + sortKey + "__, :__" + sortKey + "__)";
    }

    final QueryRequest.Builder builder = QueryRequest.builder()
        .tableName(configuration.table())
        .keyConditionExpression(keyCondition)
        .projectionExpression(codec.projection())
        .expressionAttributeNames(names)
        .expressionAttributeValues(values);
    configuration.index().ifPresent(builder::indexName);

    Optional<Cursor> cursor = Optional.empty();
    for (MatchOption option : options) {
      if (option instanceof Limit) {
        builder.limit(((Limit) option).size());
      } else if (option instanceof Cursor) {
        cursor = Optional.of((Cursor) option);
      }
    }
    cursor.ifPresent(start -> builder.exclusiveStartKey(startKey(start)));
    final State from = cursor.isPresent() ? State.CONTINUING : State.INITIAL;

    final QueryResponse response;
    try {
      response = client.query(builder.build());
    } catch (SdkException e) {
      throw new ServiceIoException("Service I/O failed on match " + key.hashKey(), e);
    }

    final List<T> items = response.items().stream().map(codec::decode).toList();
    final Optional<Cursor> next = nextCursor(response);
    log.debug("match: {} -> {} ({} items)", from, next.isPresent() ? State.HAS_MORE : State.EXHAUSTED,
        items.size());
    return ImmutablePage.<T>builder()
        .items(items)
        .cursor(next)
        .build();
  }

  /**
   * Every match of a key. Pages are read when the stream reaches them.
   *
   * @param key      the key
   * @param pageSize the page size
   * @return the stream
   */
  public Stream<T> stream(final Thing key, final int pageSize) {
    log.trace("stream({},{})", key, pageSize);
    final Limit limit = Limit.of(pageSize);
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
        new PageIterator(key, limit), Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  private Map<String, AttributeValue> startKey(final Cursor cursor) {
    if (cursor.hashKey() == null || cursor.hashKey().isEmpty()) {
      throw new InvalidKeyException("Invalid cursor: hash key is empty: " + cursor);
    }
    final Map<String, AttributeValue> startKey = new HashMap<>();
    startKey.put(codec.hashKey(), AttributeValue.fromS(cursor.hashKey()));
    startKey.put(codec.sortKey(), AttributeValue.fromS(
        cursor.sortKey().isEmpty() ? EntityCodec.SORT_KEY_SENTINEL : cursor.sortKey()));
    return startKey;
  }

  private Optional<Cursor> nextCursor(final QueryResponse response) {
    if (!response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
      return Optional.empty();
    }
    final Map<String, AttributeValue> last = response.lastEvaluatedKey();
    return Optional.of(Cursor.of(stringOf(last.get(codec.hashKey())), stringOf(last.get(codec.sortKey()))));
  }

  private static String stringOf(final AttributeValue value) {
    return value == null ? "" : value.s();
  }

  private enum State {
    INITIAL, CONTINUING, HAS_MORE, EXHAUSTED
  }

  private class PageIterator implements Iterator<T> {

    private final Thing key;
    private final Limit limit;
    private Iterator<T> current = null;
    private Optional<Cursor> cursor = Optional.empty();

    PageIterator(final Thing key, final Limit limit) {
      this.key = key;
      this.limit = limit;
    }

    @Override
    public boolean hasNext() {
      while (current == null || (!current.hasNext() && cursor.isPresent())) {
        final Page<T> page = cursor.isPresent() ? match(key, limit, cursor.get()) : match(key, limit);
        current = page.items().iterator();
        cursor = page.cursor();
      }
      return current.hasNext();
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }
  }
}
