package com.scholary.dialogue.dialogue;

/** Positions of a human message and the gpt message immediately after it. */
public record Exchange(int humanIndex, int gptIndex) {}
