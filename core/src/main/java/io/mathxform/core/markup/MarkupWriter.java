package io.mathxform.core.markup;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Serializes a DOM element back to compact markup: no XML declaration, no indentation, attributes
 * (including namespace declarations) as they appear on the element, childless elements
 * self-closed.
 */
final class MarkupWriter {

    private MarkupWriter() {}

    static String write(Element element) {
        StringBuilder out = new StringBuilder();
        write(element, out);
        return out.toString();
    }

    private static void write(Node node, StringBuilder out) {
        switch (node.getNodeType()) {
            case Node.ELEMENT_NODE:
                element((Element) node, out);
                break;
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                out.append(MathMl.escape(node.getNodeValue()));
                break;
            default:
                // comments and processing instructions are dropped
                break;
        }
    }

    private static void element(Element element, StringBuilder out) {
        String name = element.getTagName();
        out.append('<').append(name);
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            out.append(' ')
                    .append(attribute.getName())
                    .append("=\"")
                    .append(MathMl.escape(attribute.getValue()))
                    .append('"');
        }
        NodeList children = element.getChildNodes();
        if (children.getLength() == 0) {
            out.append("/>");
            return;
        }
        out.append('>');
        for (int i = 0; i < children.getLength(); i++) {
            write(children.item(i), out);
        }
        out.append("</").append(name).append('>');
    }
}
