package com.oracle.lats.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelResponseParserTest {

    private final ModelResponseParser parser = new ModelResponseParser();

    @Test
    void readsPlainFencedAndEmbeddedJson() throws Exception {
        assertThat(parser.extractJson("{\"thoughts\": [\"a\"]}").get("thoughts").size()).isEqualTo(1);

        JsonNode fenced = parser.extractJson("Here you go:\n```json\n{\"title\": \"t\"}\n```\nanything else?");
        assertThat(fenced.get("title").asText()).isEqualTo("t");

        JsonNode embedded = parser.extractJson("Sure! {\"title\": \"x\", \"n\": {\"k\": 1}} Hope this helps }");
        assertThat(embedded.get("n").get("k").asInt()).isEqualTo(1);
    }

    @Test
    void failsWithoutJson() {
        assertThatThrownBy(() -> parser.extractJson("no structure here"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findsTheFirstNonJsonCodeBlock() {
        String reply = "```json\n{}\n```\nthen\n```python\nprint(1)\n```";

        assertThat(parser.extractCodeFromFence(reply)).contains(Map.entry("python", "print(1)"));
        assertThat(parser.extractCodeFromFence("plain text")).isEmpty();
    }

    @Test
    void normalizesScores() {
        assertThat(parser.extractScore("0.75")).contains(0.75);
        assertThat(parser.extractScore("Score: 8/10")).contains(0.8);
        assertThat(parser.extractScore("42")).contains(1.0);
        assertThat(parser.extractScore("no idea")).isEmpty();
    }
}
