package org.camunda.bpm.getstarted.diagramsync.delegates.sync.codec;

/**
 * A decoded diagram document split around its graph body.
 * <p>
 * {@code prefix + originalPayload + suffix} is the document exactly as it was read.
 *
 * @param prefix          everything before the payload
 * @param body            the decompressed {@code <mxGraphModel>} body
 * @param suffix          everything after the payload
 * @param compressed      whether the payload was stored compressed
 * @param diagramName     the {@code name} attribute of the {@code <diagram>} element, if any
 * @param diagramId       the {@code id} attribute of the {@code <diagram>} element, if any
 * @param originalPayload the payload text as it appeared in the document
 */
public record DiagramEnvelope(
        String prefix,
        String body,
        String suffix,
        boolean compressed,
        String diagramName,
        String diagramId,
        String originalPayload
) {
}
