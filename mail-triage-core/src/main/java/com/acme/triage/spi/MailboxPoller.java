package com.acme.triage.spi;

import com.acme.triage.domain.InboundMessage;
import java.util.List;

/** Source of inbound messages. Messages seen in earlier polls may be returned again. */
public interface MailboxPoller {
  List<InboundMessage> poll();
}
