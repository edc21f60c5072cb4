package com.acme.triage.idempotency;

import com.acme.triage.config.TallyScope;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Deterministic key derivation for claims, tallies and body fingerprints. */
public final class IdempotencyKeys {

  private IdempotencyKeys() {}

  /**
   * Lowercase hex SHA-256 of {@code "{messageId}:{schemaVersion}"}. Case-sensitive in both parts.
   *
   * @throws IllegalArgumentException if either part is null or blank
   */
  public static String keyFor(String messageId, String schemaVersion) {
    if (messageId == null || messageId.isBlank()) {
      throw new IllegalArgumentException("messageId must not be blank");
    }
    if (schemaVersion == null || schemaVersion.isBlank()) {
      throw new IllegalArgumentException("schemaVersion must not be blank");
    }
    return sha256Hex(messageId + ":" + schemaVersion);
  }

  /** Key under which consecutive failures are counted for the given scope. */
  public static String tallyKey(TallyScope scope, String messageId, String schemaVersion) {
    return switch (scope) {
      case MESSAGE -> messageId;
      case MESSAGE_AND_SCHEMA -> keyFor(messageId, schemaVersion);
    };
  }

  public static String fingerprint(String body) {
    return sha256Hex(body == null ? "" : body);
  }

  static String sha256Hex(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
