package com.acme.triage.spi;

import com.acme.triage.domain.ContextSnippet;
import com.acme.triage.domain.Message;
import java.util.List;

public interface ContextRetriever {
  List<ContextSnippet> retrieve(Message message, int limit);
}
