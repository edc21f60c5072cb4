package com.acme.triage.domain;

import java.time.Instant;

/** A message as returned by the mailbox poller. */
public record InboundMessage(
    String messageId, String sender, String subject, String body, Instant receivedAt) {}
