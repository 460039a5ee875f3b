package com.oracle.lats.model;

import com.oracle.lats.search.model.LatsEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchEventView {

    private String type;

    private Integer iteration;

    private String nodeId;

    private String message;

    private Map<String, Object> metadata;

    private Instant timestamp;

    public static SearchEventView from(LatsEvent event) {
        return SearchEventView.builder()
                .type(event.getType().name())
                .iteration(event.getIteration())
                .nodeId(event.getNodeId())
                .message(event.getMessage())
                .metadata(event.getMetadata())
                .timestamp(event.getTimestamp())
                .build();
    }
}
