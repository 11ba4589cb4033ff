package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import java.util.regex.Pattern;

/**
 * Converts between the HTML labels the visual editor stores and the plain text shown in the form.
 */
public class LabelHelper {
    private static final Pattern LINE_BREAK_TAGS = Pattern.compile("(?i)<br\\s*/?>|</p>|</div>|</li>");
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern MARKUP = Pattern.compile("<[a-zA-Z/][^>]*>");
    private static final Pattern BLANK_LINES = Pattern.compile("\n{2,}");

    public static String toPlainText(String label) {
        if (label == null || label.isEmpty()) {
            return "";
        }
        if (!MARKUP.matcher(label).find()) {
            return decodeEntities(label).trim();
        }
        String text = LINE_BREAK_TAGS.matcher(label).replaceAll("\n");
        text = ANY_TAG.matcher(text).replaceAll("");
        text = decodeEntities(text).replace('\u00A0', ' ');
        text = BLANK_LINES.matcher(text).replaceAll("\n");
        return text.trim();
    }

    /**
     * Turns form text into the label stored on a cell. HTML cells get one paragraph per line,
     * the same markup the editor produces; text that already carries markup is kept as is.
     */
    public static String toStoredLabel(String text, boolean htmlCell) {
        if (text == null) {
            return "";
        }
        if (!htmlCell || MARKUP.matcher(text).find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder("<div>");
        for (String line : text.split("\n", -1)) {
            sb.append("<p>").append(escapeHtml(line)).append("</p>");
        }
        return sb.append("</div>").toString();
    }

    public static boolean sameText(String storedLabel, String text) {
        return toPlainText(storedLabel).equals(toPlainText(text));
    }

    private static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private static String decodeEntities(String text) {
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
