package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Numeric ranges for generated cell ids. A range starts at {@code max(floor, maxId + offset)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IdConfig {
    public long subprocessFloor = 10000;
    public long subprocessOffset = 1000;
    public long edgeFloor = 20000;
    public long edgeOffset = 2000;
    public int maxAllocationAttempts = 100000;
}
