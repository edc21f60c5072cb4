package com.acme.triage.spi;

import com.acme.triage.domain.ContextEntry;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Storage for retrievable context. Upserting an existing id overwrites it. */
public interface ContextStore {

  void upsert(ContextEntry entry);

  Optional<ContextEntry> findById(String id);

  /** Entries whose text contains any of {@code terms}, newest first. */
  List<ContextEntry> search(Set<String> terms, int limit);
}
