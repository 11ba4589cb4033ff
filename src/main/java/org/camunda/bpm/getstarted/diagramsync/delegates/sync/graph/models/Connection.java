package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Domain projection of an edge cell.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection(
        String from,
        String to,
        String id,
        String style,
        String strokeWidth,
        String strokeColor,
        String endArrow,
        String startArrow,
        Boolean dashed,
        String dashPattern
) {
    public static Connection of(String from, String to) {
        return Connection.builder().from(from).to(to).build();
    }
}
