package com.acme.triage.domain;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MessageTest {

  @Test
  @DisplayName("sender domain is the lower-cased part after the last @")
  void testDomainOf() {
    assertThat(Message.domainOf("Billing <Billing@ACME-Supplies.com>"))
        .isEqualTo("acme-supplies.com");
    assertThat(Message.domainOf("ops@example.org")).isEqualTo("example.org");
    assertThat(Message.domainOf("\"a@b\" <c@d.io>")).isEqualTo("d.io");
  }

  @Test
  @DisplayName("missing or empty senders map to the unknown domain")
  void testUnknownDomain() {
    assertThat(Message.domainOf(null)).isEqualTo(Message.UNKNOWN_DOMAIN);
    assertThat(Message.domainOf("  ")).isEqualTo(Message.UNKNOWN_DOMAIN);
    assertThat(Message.domainOf("nobody@")).isEqualTo(Message.UNKNOWN_DOMAIN);
  }

  @Test
  @DisplayName("a message built from polled mail keeps its body and sender domain")
  void testFromInbound() {
    InboundMessage in =
        new InboundMessage(
            "<m-1@x>", "Dean <dean@uni.edu>", "Exam moved", "Room 204 instead.", null);

    Message m = Message.fromInbound(in, "hash");

    assertThat(m.getSenderDomain()).isEqualTo("uni.edu");
    assertThat(m.getBody()).isEqualTo("Room 204 instead.");
    assertThat(m.getStatus()).isEqualTo(MessageStatus.PENDING);
    assertThat(m.getReceivedAt()).isBeforeOrEqualTo(Instant.now());
  }

  @Test
  @DisplayName("a stored message without a domain derives it from the sender")
  void testDerivedDomain() {
    Message m = new Message();
    m.setSender("help@it.uni.edu");

    assertThat(m.getSenderDomain()).isEqualTo("it.uni.edu");
  }
}
