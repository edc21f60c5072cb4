package com.acme.triage.spi;

import com.acme.triage.domain.Classification;
import com.acme.triage.domain.ContextSnippet;
import com.acme.triage.domain.Message;
import java.util.List;

/**
 * Language-model classifier. Implementations signal retryable failures with {@link
 * com.acme.triage.core.TransientException} and contract failures with {@link
 * com.acme.triage.core.PermanentException}.
 */
public interface Classifier {
  Classification classify(Message message, List<ContextSnippet> context);
}
