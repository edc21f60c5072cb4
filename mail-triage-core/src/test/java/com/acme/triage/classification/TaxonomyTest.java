package com.acme.triage.classification;

import static org.assertj.core.api.Assertions.*;

import com.acme.triage.domain.CategoryType;
import com.acme.triage.domain.Tag;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaxonomyTest {

  @Test
  @DisplayName("no active tags means every well-formed category is known")
  void testOpen() {
    Taxonomy none = Taxonomy.of(List.of());
    Taxonomy inactive =
        Taxonomy.of(List.of(new Tag("spam.scam", "Scams", CategoryType.SPAM, false, 1)));

    assertThat(none.isOpen()).isTrue();
    assertThat(inactive.isOpen()).isTrue();
    assertThat(Taxonomy.open().knows("anything.goes")).isTrue();
  }

  @Test
  @DisplayName("parents come from active tags only")
  void testParents() {
    Taxonomy taxonomy =
        Taxonomy.of(
            List.of(
                new Tag("academic.exams", "Exams", CategoryType.ACADEMIC, true, 2),
                new Tag("academic.grades", "Grades", CategoryType.ACADEMIC, true, 5),
                new Tag("spam.scam", "Scams", CategoryType.SPAM, false, 3)));

    assertThat(taxonomy.parents()).containsExactly("academic");
    assertThat(taxonomy.knows("academic.thesis")).isTrue();
    assertThat(taxonomy.knows("spam.scam")).isFalse();
    assertThat(taxonomy.knows("academic")).isFalse();
  }
}
