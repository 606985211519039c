package com.scholary.dialogue.dialogue;

import com.scholary.dialogue.dialogue.DialogueMessage.Sender;
import com.scholary.dialogue.grouping.Role;
import com.scholary.dialogue.grouping.TurnGroup;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns grouped dialogue into overlapping training conversations.
 *
 * <p>Client turns become human messages and therapist turns become gpt messages. Only a human
 * message directly followed by a gpt message counts as an exchange; anything else is skipped one
 * message at a time. Every exchange then anchors one window holding it and up to
 * {@code windowSize - 1} exchanges before it.
 */
@Component
public class DialogueWindowizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(DialogueWindowizer.class);

  public static final int DEFAULT_WINDOW_SIZE = 5;

  /** Serialize turns as messages, joining each turn's lines with the policy's separator. */
  public List<DialogueMessage> toMessages(List<TurnGroup> turns, LineJoinPolicy joinPolicy) {
    List<DialogueMessage> messages = new ArrayList<>(turns.size());
    for (TurnGroup turn : turns) {
      String content = String.join(joinPolicy.separator(), turn.lines());
      messages.add(
          turn.role() == Role.CLIENT ? DialogueMessage.human(content) : DialogueMessage.gpt(content));
    }
    return messages;
  }

  /**
   * Find human-then-gpt adjacencies, scanning left to right without reusing a message.
   *
   * <p>For {@code [human, gpt, human, human, gpt]} this finds (0,1) and (3,4).
   */
  public List<Exchange> findExchanges(List<DialogueMessage> messages) {
    List<Exchange> exchanges = new ArrayList<>();
    int i = 0;
    while (i < messages.size() - 1) {
      if (messages.get(i).from() == Sender.HUMAN && messages.get(i + 1).from() == Sender.GPT) {
        exchanges.add(new Exchange(i, i + 1));
        i += 2;
      } else {
        i++;
      }
    }
    return exchanges;
  }

  /**
   * Build one window per exchange.
   *
   * <p>The window for exchange k holds exchanges max(0, k - windowSize + 1) through k, each as its
   * human message followed by its gpt message.
   *
   * @throws IllegalArgumentException if windowSize is not positive
   */
  public List<ConversationWindow> windows(List<DialogueMessage> messages, int windowSize) {
    if (windowSize < 1) {
      throw new IllegalArgumentException("Window size must be positive: " + windowSize);
    }
    if (messages.size() < 2) {
      return List.of();
    }

    List<Exchange> exchanges = findExchanges(messages);
    List<ConversationWindow> windows = new ArrayList<>(exchanges.size());

    for (int k = 0; k < exchanges.size(); k++) {
      List<DialogueMessage> window = new ArrayList<>();
      for (int j = Math.max(0, k - windowSize + 1); j <= k; j++) {
        Exchange exchange = exchanges.get(j);
        window.add(messages.get(exchange.humanIndex()));
        window.add(messages.get(exchange.gptIndex()));
      }
      windows.add(new ConversationWindow(window));
    }

    int skipped = messages.size() - exchanges.size() * 2;
    if (skipped > 0) {
      LOGGER.debug("{} of {} messages are not part of any exchange", skipped, messages.size());
    }
    return windows;
  }
}
