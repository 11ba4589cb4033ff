package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowConfig {
    /**
     * Upper bound on edges visited while searching for the longest start-to-end path.
     */
    public long maxPathSearchSteps = 200000;
}
