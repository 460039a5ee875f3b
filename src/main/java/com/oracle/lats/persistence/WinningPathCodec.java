package com.oracle.lats.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.oracle.lats.search.model.WinningPath;

/**
 * One-line JSON form of a {@link WinningPath}.
 */
public class WinningPathCodec {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT);

    public String toJsonLine(WinningPath winningPath) throws JsonProcessingException {
        return objectMapper.writeValueAsString(winningPath);
    }

    public WinningPath fromJsonLine(String line) throws JsonProcessingException {
        return objectMapper.readValue(line, WinningPath.class);
    }
}
