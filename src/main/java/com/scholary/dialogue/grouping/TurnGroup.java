package com.scholary.dialogue.grouping;

import java.util.List;

/**
 * A maximal run of consecutive utterances sharing one role.
 *
 * <p>Client lines may carry a {@code "[Partner X]: "} prefix depending on the prefix policy.
 */
public record TurnGroup(Role role, List<String> lines) {

  public TurnGroup {
    lines = List.copyOf(lines);
  }
}
