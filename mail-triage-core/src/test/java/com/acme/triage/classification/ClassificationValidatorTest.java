package com.acme.triage.classification;

import static org.assertj.core.api.Assertions.*;

import com.acme.triage.core.SchemaValidationException;
import com.acme.triage.domain.ActionItem;
import com.acme.triage.domain.CategoryType;
import com.acme.triage.domain.Classification;
import com.acme.triage.domain.DeadlineConfidence;
import com.acme.triage.domain.Priority;
import com.acme.triage.domain.Sentiment;
import com.acme.triage.domain.Tag;
import com.acme.triage.domain.ThreadContext;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClassificationValidatorTest {

  private final ClassificationValidator validator = new ClassificationValidator("v2");

  private static Classification valid() {
    return new Classification(
        "work.meeting",
        List.of("work.scheduling"),
        Priority.HIGH,
        0.87,
        "Calendar invite from a colleague",
        List.of(new ActionItem("Accept invite", null, false)),
        "v2");
  }

  private static Classification withConfidence(double confidence) {
    Classification c = valid();
    return new Classification(
        c.primaryCategory(),
        c.secondaryCategories(),
        c.priority(),
        confidence,
        c.rationale(),
        c.actionItems(),
        c.schemaVersion());
  }

  @Test
  @DisplayName("valid classification passes unchanged")
  void testValid() {
    Classification c = valid();

    assertThat(validator.validate(c)).isSameAs(c);
  }

  @Test
  @DisplayName("confidence bounds are inclusive")
  void testConfidenceBounds() {
    assertThatCode(() -> validator.validate(withConfidence(0.0))).doesNotThrowAnyException();
    assertThatCode(() -> validator.validate(withConfidence(1.0))).doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validate(withConfidence(1.01)))
        .isInstanceOf(SchemaValidationException.class)
        .extracting("field")
        .isEqualTo("confidence");
    assertThatThrownBy(() -> validator.validate(withConfidence(-0.1)))
        .isInstanceOf(SchemaValidationException.class);
  }

  @Test
  @DisplayName("categories must use parent.child taxonomy form")
  void testCategoryFormat() {
    assertThat(ClassificationValidator.isValidCategory("finance.invoice")).isTrue();
    assertThat(ClassificationValidator.isValidCategory("Finance.Invoice")).isFalse();
    assertThat(ClassificationValidator.isValidCategory("finance")).isFalse();
    assertThat(ClassificationValidator.isValidCategory("a.b.c")).isFalse();
  }

  @Test
  @DisplayName("too many secondaries, action items or a long rationale are rejected")
  void testLimits() {
    Classification c = valid();
    Classification secondaries =
        new Classification(
            c.primaryCategory(),
            List.of("a.b", "a.c", "a.d", "a.e"),
            c.priority(),
            c.confidence(),
            c.rationale(),
            c.actionItems(),
            "v2");
    Classification items =
        new Classification(
            c.primaryCategory(),
            List.of(),
            c.priority(),
            c.confidence(),
            c.rationale(),
            Collections.nCopies(11, new ActionItem("do it", null, false)),
            "v2");
    Classification rationale =
        new Classification(
            c.primaryCategory(), List.of(), c.priority(), c.confidence(), "x".repeat(201), null, "v2");

    assertThatThrownBy(() -> validator.validate(secondaries)).hasMessageContaining("secondary");
    assertThatThrownBy(() -> validator.validate(items)).hasMessageContaining("action items");
    assertThatThrownBy(() -> validator.validate(rationale)).hasMessageContaining("Rationale");
  }

  @Test
  @DisplayName("schema version must match; a missing priority defaults to normal")
  void testVersionAndPriority() {
    Classification c = valid();
    Classification wrongVersion =
        new Classification(
            c.primaryCategory(), List.of(), c.priority(), 0.5, "r", List.of(), "v1");
    Classification noPriority =
        new Classification(c.primaryCategory(), List.of(), null, 0.5, "r", List.of(), "v2");

    assertThatThrownBy(() -> validator.validate(wrongVersion))
        .isInstanceOf(SchemaValidationException.class)
        .hasMessageContaining("v1");
    assertThat(validator.validate(noPriority).priority()).isEqualTo(Priority.NORMAL);
  }

  @Test
  @DisplayName("absent optional fields take their neutral defaults")
  void testDefaults() {
    Classification c =
        new Classification(
            "work.meeting", null, null, null, null, 0.5, null, null, null, null, null, null, "v2");

    Classification checked = validator.validate(c);

    assertThat(checked.secondaryCategories()).isEmpty();
    assertThat(checked.deadlineConfidence()).isEqualTo(DeadlineConfidence.NONE);
    assertThat(checked.sentiment()).isEqualTo(Sentiment.NEUTRAL);
    assertThat(checked.detectedEntities().urls()).isEmpty();
    assertThat(checked.threadContext().reply()).isFalse();
    assertThat(checked.suggestedFolder()).isNull();
  }

  @Test
  @DisplayName("a deadline confidence other than none needs a deadline")
  void testDeadlineConfidence() {
    Classification missing =
        new Classification(
            "work.meeting", List.of(), Priority.HIGH, null, DeadlineConfidence.INFERRED, 0.8,
            "r", null, Sentiment.URGENT, List.of(), null, null, "v2");
    Classification present =
        new Classification(
            "work.meeting", List.of(), Priority.HIGH, Instant.parse("2024-03-01T09:00:00Z"),
            DeadlineConfidence.EXTRACTED, 0.8, "r", null, Sentiment.URGENT, List.of(), null,
            null, "v2");

    assertThatThrownBy(() -> validator.validate(missing))
        .isInstanceOf(SchemaValidationException.class)
        .extracting("field")
        .isEqualTo("deadlineConfidence");
    assertThatCode(() -> validator.validate(present)).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("suggested folder and thread categories are checked")
  void testFolderAndThread() {
    Classification longFolder =
        new Classification(
            "work.meeting", List.of(), null, null, null, 0.8, "r", null, null, List.of(), null,
            "f".repeat(ClassificationValidator.MAX_FOLDER_LENGTH + 1), "v2");
    Classification badThread =
        new Classification(
            "work.meeting", List.of(), null, null, null, 0.8, "r", null, null, List.of(),
            new ThreadContext(true, "t-1", List.of("Not A Category")), "Work", "v2");

    assertThatThrownBy(() -> validator.validate(longFolder))
        .extracting("field")
        .isEqualTo("suggestedFolder");
    assertThatThrownBy(() -> validator.validate(badThread))
        .extracting("field")
        .isEqualTo("threadContext");
  }

  @Test
  @DisplayName("with a taxonomy, unknown parents are rejected and new children accepted")
  void testTaxonomy() {
    ClassificationValidator strict =
        new ClassificationValidator(
            "v2",
            Taxonomy.of(
                List.of(
                    new Tag("work.meeting", "Meetings", CategoryType.ACTION, true, 1),
                    new Tag("finance.aid", "Aid", CategoryType.FINANCE, true, 1),
                    new Tag("legal.contract", "Contracts", CategoryType.ADMIN, false, 1))));

    assertThatCode(() -> strict.validate(valid())).doesNotThrowAnyException();
    assertThatCode(() -> strict.checkCategory("primaryCategory", "finance.refunds"))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> strict.checkCategory("primaryCategory", "legal.contract"))
        .isInstanceOf(SchemaValidationException.class)
        .hasMessageContaining("taxonomy");
    assertThat(strict.taxonomy().parents()).containsExactly("finance", "work");
  }
}
