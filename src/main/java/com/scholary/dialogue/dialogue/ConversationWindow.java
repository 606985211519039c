package com.scholary.dialogue.dialogue;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One training example: a run of consecutive human/gpt exchanges ending at an anchor exchange.
 *
 * <p>JSON shape: {@code {"conversations": [{"from": ..., "value": ...}, ...]}}.
 */
public record ConversationWindow(@JsonProperty("conversations") List<DialogueMessage> messages) {

  public ConversationWindow {
    messages = List.copyOf(messages);
  }
}
