package org.camunda.bpm.getstarted.diagramsync.delegates.sync.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {
    public double nodeWidth = 120;
    public double nodeHeight = 60;
    /**
     * Height of ellipse vertices; the editor keeps them round with {@code aspect=fixed}.
     */
    public double ellipseHeight = 80;
    /**
     * Horizontal space between a step and its first sub-step column.
     */
    public double subprocessGap = 100;
    /**
     * Vertical distance between consecutive sub-steps of one step.
     */
    public double subprocessSpacing = 80;
    /**
     * Horizontal distance between steps laid out by the builder.
     */
    public double nodeSpacing = 100;
    public double originX = 40;
    public double originY = 40;
    /**
     * Parent of new vertices and edges when the owning step has none.
     */
    public String defaultParent = "1";
}
