package com.example.documentdb.core;

/** Limits the service puts on user-defined collection throughput. */
final class ThroughputRules {

  static final int MINIMUM = 400;
  static final int STEP = 100;
  static final int SINGLE_PARTITION_MAXIMUM = 10_000;
  static final int PARTITIONED_MINIMUM = 10_100;
  static final String OFFER_VERSION_V2 = "V2";

  private ThroughputRules() {}

  /**
   * Checks the requested value on its own.
   *
   * @param throughput requested request units per second
   * @throws IllegalArgumentException if the value is not a multiple of 100 or below 400
   */
  static void validate(final int throughput) {
    if (throughput % STEP != 0)
      throw new IllegalArgumentException("throughput must be a multiple of " + STEP);
    if (throughput < MINIMUM)
      throw new IllegalArgumentException(
          "The minimum throughput supported by DocumentDB is " + MINIMUM + " RU's");
  }

  /**
   * Checks the requested value against the collection's current offer.
   *
   * @param throughput requested request units per second
   * @param collectionId collection the offer belongs to, for messages
   * @param offerVersion version of the current offer
   * @param currentThroughput throughput of a V2 offer, or null
   * @throws IllegalArgumentException if the offer does not allow the requested value
   */
  static void validate(
      final int throughput,
      final String collectionId,
      final String offerVersion,
      final Integer currentThroughput) {
    validate(throughput);

    if (!OFFER_VERSION_V2.equals(offerVersion)) {
      if (throughput > SINGLE_PARTITION_MAXIMUM)
        throw new IllegalArgumentException(
            ("Collection \"%s\" currently has an offer version of %s. When switching to a"
                    + " user-defined throughput, the maximum throughput is 10,000.")
                .formatted(collectionId, offerVersion));
      return;
    }

    final var current = currentThroughput == null ? 0 : currentThroughput;
    if (current <= SINGLE_PARTITION_MAXIMUM && throughput > SINGLE_PARTITION_MAXIMUM)
      throw new IllegalArgumentException(
          "The maximum throughput for collection \"%s\" is 10,000 because it has only one partition."
              .formatted(collectionId));
    if (current > SINGLE_PARTITION_MAXIMUM && throughput < PARTITIONED_MINIMUM)
      throw new IllegalArgumentException(
          "The minimum throughput for collection \"%s\" is 10,100 because it has multiple partitions."
              .formatted(collectionId));
  }
}
