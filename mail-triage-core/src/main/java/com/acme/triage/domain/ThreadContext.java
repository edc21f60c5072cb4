package com.acme.triage.domain;

import java.util.List;

/** Where the message sits in a conversation, and how earlier messages were classified. */
public record ThreadContext(boolean reply, String threadId, List<String> previousCategories) {

  private static final ThreadContext NONE = new ThreadContext(false, null, List.of());

  public ThreadContext {
    previousCategories = previousCategories == null ? List.of() : List.copyOf(previousCategories);
  }

  public static ThreadContext none() {
    return NONE;
  }
}
