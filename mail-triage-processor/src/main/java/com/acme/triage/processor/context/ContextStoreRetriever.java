package com.acme.triage.processor.context;

import com.acme.triage.domain.ContextEntry;
import com.acme.triage.domain.ContextSnippet;
import com.acme.triage.domain.Message;
import com.acme.triage.spi.ContextRetriever;
import com.acme.triage.spi.ContextStore;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword retrieval over the context store: subject words and the sender domain, scored by the
 * share of terms an entry contains. Replaced by any other {@link ContextRetriever} bean.
 */
@Singleton
@Secondary
public class ContextStoreRetriever implements ContextRetriever {
  private static final int MIN_TERM_LENGTH = 3;
  private static final int CANDIDATE_FACTOR = 4;

  private final ContextStore store;

  public ContextStoreRetriever(ContextStore store) {
    this.store = store;
  }

  @Override
  public List<ContextSnippet> retrieve(Message message, int limit) {
    Set<String> terms = terms(message);
    if (terms.isEmpty() || limit <= 0) {
      return List.of();
    }
    return store.search(terms, limit * CANDIDATE_FACTOR).stream()
        .map(entry -> new ContextSnippet(entry.id(), entry.text(), score(entry, terms)))
        .sorted(Comparator.comparingDouble(ContextSnippet::score).reversed())
        .limit(limit)
        .toList();
  }

  static Set<String> terms(Message message) {
    Set<String> terms = new LinkedHashSet<>();
    if (message.getSubject() != null) {
      for (String word : message.getSubject().toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
        if (word.length() >= MIN_TERM_LENGTH) {
          terms.add(word);
        }
      }
    }
    if (message.getSender() != null) {
      terms.add(message.getSenderDomain());
    }
    return terms;
  }

  private static double score(ContextEntry entry, Set<String> terms) {
    String text = entry.text().toLowerCase(Locale.ROOT);
    long hits = terms.stream().filter(text::contains).count();
    return (double) hits / terms.size();
  }
}
