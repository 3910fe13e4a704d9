package com.codeheadsystems.dynamap.api;

/**
 * Anything with a composite identity: a partition key and an optional sort key.
 */
public interface Thing {

  /**
   * Partition key. Must not be empty for any storage operation.
   *
   * @return the identity
   */
  Identity hashKey();

  /**
   * Sort key. Empty means the item has no sort key.
   *
   * @return the identity
   */
  default Identity sortKey() {
    return Identity.EMPTY;
  }
}
