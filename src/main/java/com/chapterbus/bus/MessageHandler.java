package com.chapterbus.bus;

import com.chapterbus.contract.Message;

/**
 * The single capability every bus subscriber implements. Handlers that serve requests
 * answer by publishing a reply built with {@link Message#reply}.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Message message) throws Exception;
}
