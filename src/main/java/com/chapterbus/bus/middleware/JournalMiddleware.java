package com.chapterbus.bus.middleware;

import com.chapterbus.bus.MessageLog;
import com.chapterbus.contract.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records every published message in the {@link MessageLog} and, when a journal file
 * is configured, appends one JSON line per message to it.
 *
 * Journal lines carry routing metadata and payload keys only, never payload values.
 */
public class JournalMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(JournalMiddleware.class);

    private final MessageLog messageLog;
    private final ObjectMapper objectMapper;
    private final Path journalFile;

    public JournalMiddleware(MessageLog messageLog, ObjectMapper objectMapper, Path journalFile) {
        this.messageLog = messageLog;
        this.objectMapper = objectMapper;
        this.journalFile = journalFile;
        if (journalFile != null && journalFile.getParent() != null) {
            try {
                Files.createDirectories(journalFile.getParent());
            } catch (IOException ex) {
                throw new IllegalStateException("cannot create journal directory for " + journalFile, ex);
            }
        }
    }

    @Override
    public void beforePublish(Message message) {
        messageLog.append(message);
        if (journalFile != null) {
            writeLine(message);
        }
    }

    private void writeLine(Message message) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", message.id());
        record.put("topic", message.topic());
        record.put("correlation_id", message.correlationId());
        record.put("reply_to", message.replyTo());
        record.put("chapter_number", message.chapterNumber());
        record.put("created_at", message.createdAt().toString());
        record.put("payload_keys", new ArrayList<>(message.payload().keySet()));
        try {
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            synchronized (this) {
                Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (JsonProcessingException ex) {
            log.warn("Cannot serialise journal record for message={}: {}", message.id(), ex.getMessage());
        } catch (IOException ex) {
            log.warn("Journal write to {} failed: {}", journalFile, ex.getMessage());
        }
    }
}
