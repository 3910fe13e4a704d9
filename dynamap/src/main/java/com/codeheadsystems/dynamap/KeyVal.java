package com.codeheadsystems.dynamap;

import com.codeheadsystems.dynamap.api.BatchResult;
import com.codeheadsystems.dynamap.api.MatchOption;
import com.codeheadsystems.dynamap.api.Page;
import com.codeheadsystems.dynamap.api.Thing;
import com.codeheadsystems.dynamap.expression.Constraint;
import com.codeheadsystems.dynamap.expression.Updater;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Typed key-value storage of entities of type {@code T}.
 *
 * <p>Failures are reported with the exceptions of {@code com.codeheadsystems.dynamap.api.exception}: an invalid
 * key or entity, a missing item, a failed constraint or a backend failure.
 *
 * @param <T> the entity type
 */
public interface KeyVal<T extends Thing> {

  /**
   * Reads the item with the key of the given thing.
   *
   * @param key the key
   * @return the entity
   * @throws com.codeheadsystems.dynamap.api.exception.NotFoundException when there is no such item
   */
  T get(T key);

  /**
   * Writes the entity, replacing any stored item with the same key.
   *
   * @param entity      the entity
   * @param constraints must all hold on the stored item
   * @throws com.codeheadsystems.dynamap.api.exception.PreConditionFailedException when a constraint fails
   */
  void put(T entity, Constraint<T>... constraints);

  /**
   * Deletes the item with the key of the given thing.
   *
   * @param key         the key
   * @param constraints must all hold on the stored item
   * @return the deleted item, empty if nothing was stored
   */
  Optional<T> remove(T key, Constraint<T>... constraints);

  /**
   * Writes the fields of the entity onto the stored item, creating it if absent.
   *
   * @param entity      the entity
   * @param constraints must all hold on the stored item
   * @return the item as stored after the update
   */
  T update(T entity, Constraint<T>... constraints);

  /**
   * Applies explicit update actions plus the remaining fields of the entity.
   *
   * @param updater     the updater
   * @param constraints must all hold on the stored item
   * @return the item as stored after the update
   */
  T updateWith(Updater<T> updater, Constraint<T>... constraints);

  /**
   * Reads a page of the items sharing the hash key of the given thing, restricted to sort keys starting with
   * its sort key when it has one.
   *
   * @param key     the key
   * @param options limit and cursor
   * @return the page
   */
  Page<T> match(T key, MatchOption... options);

  /**
   * Like {@link #match(Thing, MatchOption...)}, for a key that is not an entity.
   *
   * @param key     the key
   * @param options limit and cursor
   * @return the page
   */
  Page<T> matchKey(Thing key, MatchOption... options);

  /**
   * Every match of a key, reading pages lazily.
   *
   * @param key      the key
   * @param pageSize items read per call
   * @return the stream
   */
  Stream<T> stream(Thing key, int pageSize);

  /**
   * Reads many items at once.
   *
   * @param keys the keys
   * @return the found items, and the keys left unread
   */
  BatchResult<T> batchGet(List<T> keys);

  /**
   * Writes many items at once.
   *
   * @param entities the entities
   * @return the entities left unwritten
   */
  BatchResult<T> batchPut(List<T> entities);

  /**
   * Deletes many items at once.
   *
   * @param keys the keys
   * @return the keys left undeleted
   */
  BatchResult<T> batchRemove(List<T> keys);
}
