package com.scholary.dialogue.api;

import com.scholary.dialogue.dialogue.ConversationWindow;
import com.scholary.dialogue.dialogue.DialogueMessage;
import com.scholary.dialogue.grouping.TurnGroup;
import java.util.List;
import java.util.Map;

/**
 * Every intermediate stage of a preview run.
 */
public record PreviewResponse(
    List<String> attributedLines,
    List<TurnGroup> turns,
    List<DialogueMessage> messages,
    List<ConversationWindow> windows,
    Map<String, Integer> unmappedSpeakers) {}
