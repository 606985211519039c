package com.scholary.dialogue.grouping;

/**
 * When client lines get a {@code "[Partner X]: "} prefix.
 *
 * <p>Both are used for building corpora; which one a run uses is a configuration decision.
 */
public enum PartnerPrefixPolicy {
  /** Prefix every client line. */
  ALWAYS_PREFIX,

  /**
   * Prefix a client line only when its partner differs from the previous client line of the same
   * turn. The first line of a turn is always prefixed.
   */
  PREFIX_ON_CHANGE
}
