package com.scholary.dialogue.grouping;

/** Conversational role of a turn. */
public enum Role {
  THERAPIST,
  CLIENT
}
