package com.scholary.dialogue.service;

import com.scholary.dialogue.align.AttributedUtterance;
import com.scholary.dialogue.dialogue.ConversationWindow;
import com.scholary.dialogue.dialogue.DialogueMessage;
import com.scholary.dialogue.grouping.GroupingResult;
import java.util.List;

/** Every stage's output for one recording. */
public record PipelineResult(
    List<AttributedUtterance> utterances,
    GroupingResult grouping,
    List<DialogueMessage> messages,
    List<ConversationWindow> windows) {}
