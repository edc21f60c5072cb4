package com.acme.triage.repository;

import com.acme.triage.domain.Message;
import com.acme.triage.domain.MessageStatus;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/** Repository for tracked mail messages. Status changes are compare-and-set. */
public interface MessageRepository {

    /**
     * Insert the message unless one with the same external id exists
     *
     * @return number of rows inserted (1 if inserted, 0 if already known)
     */
    int insertIfAbsent(Message message);

    Optional<Message> findById(UUID id);

    Optional<Message> findByMessageId(String messageId);

    /**
     * Messages in pending or failed status, oldest first
     */
    List<Message> findEligibleForPickup(int limit);

    /**
     * Move the message to {@code to} only if its current status is one of {@code from}
     *
     * @return true if the row was updated
     */
    boolean transition(UUID id, Set<MessageStatus> from, MessageStatus to);

    /**
     * Same as {@link #transition(UUID, Set, MessageStatus)}, also recording the last error
     */
    boolean transition(
            UUID id, Set<MessageStatus> from, MessageStatus to, String errorClass, String errorMessage);

    long countByStatus(Set<MessageStatus> statuses);

    /**
     * Messages left in classifying for longer than {@code olderThan}, oldest first. The caller
     * settles each one with a guarded transition.
     */
    List<Message> findStuck(Duration olderThan);
}
