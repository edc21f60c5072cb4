package com.acme.triage.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Inbound mail message as tracked by the workflow (pure domain object, no persistence
 * annotations). The body is stored next to its SHA-256 fingerprint so that stored work is
 * retried with the same input the first attempt saw.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Message {

  public static final String UNKNOWN_DOMAIN = "unknown";

  private UUID id;
  private String messageId;
  private String sender;
  private String senderDomain;
  private String subject;
  private String bodyHash;
  private MessageStatus status;
  private String lastErrorClass;
  private String lastErrorMessage;
  private Instant receivedAt;
  private Instant updatedAt;

  private String body;

  public static Message fromInbound(InboundMessage inbound, String bodyHash) {
    Message m = new Message();
    m.setId(UUID.randomUUID());
    m.setMessageId(inbound.messageId());
    m.setSender(inbound.sender());
    m.setSenderDomain(domainOf(inbound.sender()));
    m.setSubject(inbound.subject());
    m.setBodyHash(bodyHash);
    m.setStatus(MessageStatus.PENDING);
    m.setReceivedAt(inbound.receivedAt() != null ? inbound.receivedAt() : Instant.now());
    m.setBody(inbound.body());
    return m;
  }

  /** Lower-cased part after the last {@code @}, without a closing angle bracket. */
  public static String domainOf(String sender) {
    if (sender == null || sender.isBlank()) {
      return UNKNOWN_DOMAIN;
    }
    int at = sender.lastIndexOf('@');
    String domain = at >= 0 ? sender.substring(at + 1) : sender;
    domain = domain.replace(">", "").trim().toLowerCase();
    return domain.isEmpty() ? UNKNOWN_DOMAIN : domain;
  }

  public String getSenderDomain() {
    return senderDomain != null ? senderDomain : domainOf(sender);
  }

  public boolean isQuarantined() {
    return status == MessageStatus.QUARANTINED;
  }
}
