package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of {@code sync-config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {
    public LayoutConfig layout = new LayoutConfig();
    public IdConfig ids = new IdConfig();
    public StyleConfig styles = new StyleConfig();
    public FlowConfig flow = new FlowConfig();

    public static SyncConfig defaults() {
        return new SyncConfig();
    }
}
