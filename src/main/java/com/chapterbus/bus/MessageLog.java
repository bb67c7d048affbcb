package com.chapterbus.bus;

import com.chapterbus.contract.Message;

import java.util.List;
import java.util.Optional;

/**
 * Sequence-numbered history of bus traffic, for debugging and the message query endpoint.
 */
public interface MessageLog {

    LoggedMessage append(Message message);

    List<LoggedMessage> query(Optional<String> topic,
                              Optional<Integer> chapterNumber,
                              int limit);

    long getLatestSequence();

    void clear();
}
