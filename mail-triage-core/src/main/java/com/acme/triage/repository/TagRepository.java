package com.acme.triage.repository;

import com.acme.triage.domain.Tag;
import java.util.List;
import java.util.Optional;

/** Category taxonomy. Seeded by migration, maintained by operators. */
public interface TagRepository {

    /**
     * Active tags ordered by name
     */
    List<Tag> findActive();

    Optional<Tag> findByName(String name);

    /**
     * Insert the tag or overwrite description, type, active flag and order of an existing one
     */
    void upsert(Tag tag);
}
