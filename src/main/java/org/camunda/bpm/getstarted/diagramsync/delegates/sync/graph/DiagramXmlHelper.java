package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM plumbing for diagram bodies ({@code <mxGraphModel>...</mxGraphModel>}).
 */
public class DiagramXmlHelper {
    public static final String GRAPH_MODEL_TAG = "mxGraphModel";
    public static final String ROOT_TAG = "root";
    public static final String CELL_TAG = "mxCell";
    public static final String GEOMETRY_TAG = "mxGeometry";

    /**
     * Parses a diagram body into a DOM document.
     *
     * @param body the decompressed body
     * @return the parsed document
     * @throws MalformedDocumentException if the body is not well-formed XML
     */
    public static Document parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedDocumentException("Diagram body is empty");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(null);
            return builder.parse(new InputSource(new StringReader(body.trim())));
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException("Failed to parse diagram body: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Serializes a document without an XML declaration and without re-indenting, so text
     * between the existing cells is kept as it was parsed.
     */
    public static String writeBody(Document doc) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (Exception e) {
            throw new RuntimeException("Failed to write diagram body", e);
        }
    }

    /**
     * Finds the {@code <root>} element holding the cells.
     *
     * @throws MalformedDocumentException if the document has no graph model root
     */
    public static Element findCellRoot(Document doc) {
        Element model = doc.getDocumentElement();
        if (!GRAPH_MODEL_TAG.equals(model.getTagName())) {
            NodeList models = doc.getElementsByTagName(GRAPH_MODEL_TAG);
            if (models.getLength() == 0) {
                throw new MalformedDocumentException("Invalid diagram: <" + GRAPH_MODEL_TAG + "> not found");
            }
            model = (Element) models.item(0);
        }
        Element root = firstChildElement(model, ROOT_TAG);
        if (root == null) {
            throw new MalformedDocumentException("Invalid " + GRAPH_MODEL_TAG + ": root not found");
        }
        return root;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    public static Element firstChildElement(Element parent, String tagName) {
        for (Element child : childElements(parent)) {
            if (tagName.equals(child.getTagName())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Returns the attribute value, or null when the attribute is absent.
     */
    public static String attribute(Element element, String name) {
        return element != null && element.hasAttribute(name) ? element.getAttribute(name) : null;
    }
}
