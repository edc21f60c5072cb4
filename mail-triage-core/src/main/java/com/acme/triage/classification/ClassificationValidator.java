package com.acme.triage.classification;

import com.acme.triage.core.SchemaValidationException;
import com.acme.triage.domain.ActionItem;
import com.acme.triage.domain.Classification;
import com.acme.triage.domain.DeadlineConfidence;
import java.util.List;
import java.util.regex.Pattern;

/** Structural contract every classification must satisfy before it is persisted. */
public class ClassificationValidator {
  public static final int MAX_SECONDARY_CATEGORIES = 3;
  public static final int MAX_ACTION_ITEMS = 10;
  public static final int MAX_RATIONALE_LENGTH = 200;
  public static final int MAX_FOLDER_LENGTH = 255;

  private static final Pattern CATEGORY = Pattern.compile("^[a-z_]+\\.[a-z_]+$");

  private final String schemaVersion;
  private final Taxonomy taxonomy;

  public ClassificationValidator(String schemaVersion) {
    this(schemaVersion, Taxonomy.open());
  }

  public ClassificationValidator(String schemaVersion, Taxonomy taxonomy) {
    this.schemaVersion = schemaVersion;
    this.taxonomy = taxonomy;
  }

  public static boolean isValidCategory(String category) {
    return category != null && CATEGORY.matcher(category).matches();
  }

  public Taxonomy taxonomy() {
    return taxonomy;
  }

  /**
   * Well formed and under a known parent.
   *
   * @throws SchemaValidationException on {@code field} otherwise
   */
  public void checkCategory(String field, String category) {
    if (!isValidCategory(category)) {
      throw new SchemaValidationException(field, "Invalid category: " + category);
    }
    if (!taxonomy.knows(category)) {
      throw new SchemaValidationException(
          field, "Category " + category + " is outside the taxonomy " + taxonomy.parents());
    }
  }

  /**
   * @throws SchemaValidationException naming the first field that violates the contract
   */
  public Classification validate(Classification c) {
    if (c == null) {
      throw new SchemaValidationException("classification", "Classifier returned no result");
    }
    if (!schemaVersion.equals(c.schemaVersion())) {
      throw new SchemaValidationException(
          "schemaVersion",
          "Expected schema version " + schemaVersion + " but got " + c.schemaVersion());
    }
    checkCategory("primaryCategory", c.primaryCategory());
    if (c.secondaryCategories().size() > MAX_SECONDARY_CATEGORIES) {
      throw new SchemaValidationException(
          "secondaryCategories",
          "At most " + MAX_SECONDARY_CATEGORIES + " secondary categories allowed");
    }
    for (String secondary : c.secondaryCategories()) {
      if (!isValidCategory(secondary)) {
        throw new SchemaValidationException(
            "secondaryCategories", "Invalid secondary category: " + secondary);
      }
    }
    if (Double.isNaN(c.confidence()) || c.confidence() < 0.0 || c.confidence() > 1.0) {
      throw new SchemaValidationException(
          "confidence", "Confidence must be within [0,1]: " + c.confidence());
    }
    if (c.deadlineConfidence() != DeadlineConfidence.NONE && c.deadlineUtc() == null) {
      throw new SchemaValidationException(
          "deadlineConfidence",
          "Deadline confidence " + c.deadlineConfidence().dbValue() + " given without a deadline");
    }
    if (c.rationale() != null && c.rationale().length() > MAX_RATIONALE_LENGTH) {
      throw new SchemaValidationException(
          "rationale", "Rationale exceeds " + MAX_RATIONALE_LENGTH + " characters");
    }
    if (c.actionItems().size() > MAX_ACTION_ITEMS) {
      throw new SchemaValidationException(
          "actionItems", "At most " + MAX_ACTION_ITEMS + " action items allowed");
    }
    for (ActionItem item : c.actionItems()) {
      if (item == null || item.description() == null || item.description().isBlank()) {
        throw new SchemaValidationException("actionItems", "Action item needs a description");
      }
    }
    checkPreviousCategories(c.threadContext().previousCategories());
    if (c.suggestedFolder() != null
        && (c.suggestedFolder().isBlank() || c.suggestedFolder().length() > MAX_FOLDER_LENGTH)) {
      throw new SchemaValidationException(
          "suggestedFolder", "Suggested folder must be 1 to " + MAX_FOLDER_LENGTH + " characters");
    }
    return c;
  }

  private static void checkPreviousCategories(List<String> previous) {
    for (String category : previous) {
      if (!isValidCategory(category)) {
        throw new SchemaValidationException(
            "threadContext", "Invalid previous category: " + category);
      }
    }
  }
}
