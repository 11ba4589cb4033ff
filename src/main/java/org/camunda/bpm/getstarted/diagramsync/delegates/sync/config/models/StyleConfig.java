package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StyleConfig {
    /**
     * Style of edges the patch engine adds between a step and its sub-steps.
     */
    public String subprocessEdge = "edgeStyle=none;startArrow=none;endArrow=block;startSize=5;endSize=5;"
            + "strokeColor=#000000;html=1;exitX=1;exitY=0.5;exitDx=0;exitDy=0;entryX=0;entryY=0.5;entryDx=0;entryDy=0;";
    /**
     * Style of edges written by the builder when a connection carries none.
     */
    public String defaultEdge = "edgeStyle=orthogonalEdgeStyle;rounded=0;orthogonalLoop=1;jettySize=auto;html=1;";
}
