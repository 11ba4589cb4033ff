package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.ShapeKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StyleHelperTest {

    @Test
    void shouldParseFlagsAndPairsInOrder() {
        Map<String, String> style = StyleHelper.parse("ellipse;whiteSpace=wrap; html=1 ;;");

        assertEquals(3, style.size());
        assertEquals("", style.get("ellipse"));
        assertEquals("wrap", style.get("whiteSpace"));
        assertEquals("1", style.get("html"));
        assertEquals("ellipse;whiteSpace=wrap;html=1;", StyleHelper.format(style));
    }

    @Test
    void shouldInferShapeFromStyle() {
        assertEquals(ShapeKind.ELLIPSE, StyleHelper.inferShape("ellipse;whiteSpace=wrap;html=1;"));
        assertEquals(ShapeKind.DECISION, StyleHelper.inferShape("rhombus;whiteSpace=wrap;"));
        assertEquals(ShapeKind.DATA, StyleHelper.inferShape("shape=parallelogram;perimeter=parallelogramPerimeter;"));
        assertEquals(ShapeKind.SUBPROCESS, StyleHelper.inferShape("swimlane;startSize=20;"));
        assertEquals(ShapeKind.DOCUMENT, StyleHelper.inferShape("shape=document;html=1;"));
        assertEquals(ShapeKind.RECTANGLE, StyleHelper.inferShape("rounded=1;whiteSpace=wrap;"));
        assertEquals(ShapeKind.RECTANGLE, StyleHelper.inferShape("shape=cloud;"));
        assertEquals(ShapeKind.RECTANGLE, StyleHelper.inferShape(null));
    }

    @Test
    void shouldReplaceOnlyShapeTokens() {
        String style = StyleHelper.withShape("rounded=0;whiteSpace=wrap;html=1;fillColor=#dae8fc;", ShapeKind.ELLIPSE);

        assertEquals(ShapeKind.ELLIPSE, StyleHelper.inferShape(style));
        assertEquals("#dae8fc", StyleHelper.value(style, "fillColor"));
        assertEquals("1", StyleHelper.value(style, "html"));
    }

    @Test
    void shouldDropOldShapeWhenChangingBack() {
        String style = StyleHelper.withShape("shape=parallelogram;perimeter=parallelogramPerimeter;strokeColor=red;", ShapeKind.RECTANGLE);

        assertEquals(ShapeKind.RECTANGLE, StyleHelper.inferShape(style));
        assertFalse(style.contains("parallelogram"));
        assertEquals("red", StyleHelper.value(style, "strokeColor"));
    }

    @Test
    void shouldDetectHtmlLabels() {
        assertTrue(StyleHelper.isHtml("rounded=0;html=1;"));
        assertFalse(StyleHelper.isHtml("rounded=0;"));
        assertFalse(StyleHelper.isHtml(""));
    }
}
