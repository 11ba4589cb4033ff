package org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Reads and writes draw.io documents.
 * <p>
 * A document is an {@code <mxfile>} holding one {@code <diagram>} whose text is either a literal
 * {@code <mxGraphModel>} or the model compressed the way the editor stores it:
 * {@code base64(rawDeflate(encodeURIComponent(xml)))}. A bare model or a bare compressed payload
 * is accepted too.
 */
@Slf4j
public class DiagramCodec {
    private static final Pattern DIAGRAM_START = Pattern.compile("<diagram(?=[\\s>/])[^>]*>");
    private static final String DIAGRAM_END = "</diagram>";
    private static final String GRAPH_MODEL_START = "<mxGraphModel";
    private static final String GRAPH_MODEL_END = "</mxGraphModel>";
    private static final Pattern NAME_ATTRIBUTE = Pattern.compile("\\sname=\"([^\"]*)\"");
    private static final Pattern ID_ATTRIBUTE = Pattern.compile("\\sid=\"([^\"]*)\"");

    /**
     * Splits a document into prefix, payload and suffix and decompresses the payload if needed.
     *
     * @param document the full document text
     * @return the decoded envelope
     * @throws DecompressionFailureException if a compressed payload cannot be inflated
     */
    public static DiagramEnvelope decode(String document) {
        String text = document == null ? "" : document;

        Matcher diagramStart = DIAGRAM_START.matcher(text);
        if (diagramStart.find() && !diagramStart.group().endsWith("/>")) {
            int payloadStart = diagramStart.end();
            int payloadEnd = text.indexOf(DIAGRAM_END, payloadStart);
            if (payloadEnd < 0) {
                payloadEnd = text.length();
            }
            String startTag = diagramStart.group();
            return envelope(
                    text.substring(0, payloadStart),
                    text.substring(payloadStart, payloadEnd),
                    text.substring(payloadEnd),
                    attributeValue(NAME_ATTRIBUTE, startTag),
                    attributeValue(ID_ATTRIBUTE, startTag));
        }

        int modelStart = text.indexOf(GRAPH_MODEL_START);
        if (modelStart >= 0) {
            int modelEnd = text.indexOf(GRAPH_MODEL_END, modelStart);
            int payloadEnd = modelEnd < 0 ? text.length() : modelEnd + GRAPH_MODEL_END.length();
            return envelope(
                    text.substring(0, modelStart),
                    text.substring(modelStart, payloadEnd),
                    text.substring(payloadEnd),
                    null,
                    null);
        }

        String trimmed = text.strip();
        int leading = trimmed.isEmpty() ? text.length() : text.indexOf(trimmed);
        return envelope(
                text.substring(0, leading),
                trimmed,
                text.substring(leading + trimmed.length()),
                null,
                null);
    }

    /**
     * Puts a body back into the document it was decoded from. An unchanged body re-emits the
     * original payload, so an unmodified document comes back byte for byte.
     */
    public static String encode(DiagramEnvelope envelope, String newBody) {
        String payload;
        if (newBody == null || newBody.equals(envelope.body())) {
            payload = envelope.originalPayload();
        } else if (envelope.compressed()) {
            payload = compress(newBody);
        } else {
            payload = newBody;
        }
        return envelope.prefix() + payload + envelope.suffix();
    }

    /**
     * Wraps a body into a standalone {@code <mxfile>} document with a single page.
     */
    public static String wrap(String body, String diagramName, String diagramId, boolean compress) {
        StringBuilder sb = new StringBuilder("<mxfile host=\"diagram-sync\">");
        sb.append("<diagram");
        if (diagramName != null) {
            sb.append(" name=\"").append(escapeAttribute(diagramName)).append('"');
        }
        if (diagramId != null) {
            sb.append(" id=\"").append(escapeAttribute(diagramId)).append('"');
        }
        sb.append('>');
        sb.append(compress ? compress(body) : body);
        sb.append(DIAGRAM_END).append("</mxfile>");
        return sb.toString();
    }

    public static boolean isCompressedPayload(String payload) {
        if (payload == null) {
            return false;
        }
        String trimmed = payload.trim();
        return !trimmed.isEmpty() && !trimmed.startsWith("<") && !trimmed.contains(GRAPH_MODEL_START);
    }

    /**
     * Base64-decodes, inflates and percent-decodes a payload. Raw deflate data is tried first,
     * then a zlib stream.
     *
     * @throws DecompressionFailureException if the payload is not valid compressed data
     */
    public static String decompress(String payload) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(payload.replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new DecompressionFailureException("Diagram payload is not valid base64", e);
        }

        byte[] inflated;
        try {
            inflated = inflate(bytes, true);
        } catch (DataFormatException rawFailure) {
            log.debug("Raw inflate failed ({}), trying zlib stream", rawFailure.getMessage());
            try {
                inflated = inflate(bytes, false);
            } catch (DataFormatException zlibFailure) {
                zlibFailure.addSuppressed(rawFailure);
                throw new DecompressionFailureException("Failed to inflate diagram payload", zlibFailure);
            }
        }

        String encoded = new String(inflated, StandardCharsets.UTF_8);
        try {
            // '+' is literal in the editor's percent-encoding
            return URLDecoder.decode(encoded.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new DecompressionFailureException("Diagram payload has invalid percent-encoding", e);
        }
    }

    /**
     * Inverse of {@link #decompress(String)}.
     */
    public static String compress(String xml) {
        byte[] input = encodeUriComponent(xml).getBytes(StandardCharsets.UTF_8);

        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buffer = new byte[4096];
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                out.write(buffer, 0, count);
            }
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } finally {
            deflater.end();
        }
    }

    static String encodeUriComponent(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }

    private static byte[] inflate(byte[] data, boolean nowrap) throws DataFormatException {
        Inflater inflater = new Inflater(nowrap);
        try {
            // raw streams need one byte of padding past the end of the data
            inflater.setInput(nowrap ? Arrays.copyOf(data, data.length + 1) : data);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length * 4));
            byte[] buffer = new byte[4096];
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated deflate stream");
                }
                out.write(buffer, 0, count);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }

    private static DiagramEnvelope envelope(String prefix, String payload, String suffix,
                                            String diagramName, String diagramId) {
        boolean compressed = isCompressedPayload(payload);
        String body = compressed ? decompress(payload.trim()) : payload;
        return new DiagramEnvelope(prefix, body, suffix, compressed, diagramName, diagramId, payload);
    }

    private static String attributeValue(Pattern pattern, String tag) {
        Matcher matcher = pattern.matcher(tag);
        return matcher.find() ? unescapeAttribute(matcher.group(1)) : null;
    }

    private static String escapeAttribute(String value) {
        return value.replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private static String unescapeAttribute(String value) {
        return value.replace("&quot;", "\"")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }
}
