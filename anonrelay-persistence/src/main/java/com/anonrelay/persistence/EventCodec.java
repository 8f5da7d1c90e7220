package com.anonrelay.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * JSON encoding of log records. One event per line, so output is never indented.
 */
public final class EventCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    // Written through the base type so the variant wrapper is always emitted.
    private static final ObjectWriter WRITER = MAPPER.writerFor(Event.class);

    private EventCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes an event to a single-line JSON string without the trailing newline.
     */
    public static String encode(Event event) {
        try {
            return WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to serialize event " + event, e);
        }
    }

    /**
     * Parses one log line.
     *
     * @param line       the raw line, without its newline
     * @param lineNumber 1-based line number, used for error reporting
     * @throws JournalException.CorruptedDataException if the line is not a valid event
     */
    public static Event decode(String line, long lineNumber) {
        try {
            Event event = MAPPER.readValue(line, Event.class);
            if (event == null) {
                throw new JournalException.CorruptedDataException("Empty event record", lineNumber);
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new JournalException.CorruptedDataException("Failed to decode event: " + e.getOriginalMessage(),
                    lineNumber, e);
        }
    }
}
