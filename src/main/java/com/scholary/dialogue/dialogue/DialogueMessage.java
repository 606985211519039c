package com.scholary.dialogue.dialogue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One turn serialized for training.
 *
 * <p>JSON shape: {@code {"from": "human", "value": "..."}}.
 */
public record DialogueMessage(@JsonProperty("from") Sender from, @JsonProperty("value") String value) {

  public static DialogueMessage human(String value) {
    return new DialogueMessage(Sender.HUMAN, value);
  }

  public static DialogueMessage gpt(String value) {
    return new DialogueMessage(Sender.GPT, value);
  }

  /** Author of a message in the training format. */
  public enum Sender {
    HUMAN("human"),
    GPT("gpt");

    private final String wireName;

    Sender(String wireName) {
      this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
      return wireName;
    }
  }
}
