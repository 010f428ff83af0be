package io.mathxform.core.markup;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Presentation MathML pass that fences sum bases of powers: every {@code <msup>} whose base is an
 * {@code <mrow>} with a top-level {@code +}, {@code -} or {@code −} operator, and is not already
 * {@code ( ... )}, becomes {@code <msup><mrow><mo>(</mo>base<mo>)</mo></mrow>exponent</msup>}.
 */
public final class PowerBaseGrouping {

    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-", MathMl.MINUS_SIGN);

    /**
     * Applies the pass to a complete presentation document.
     *
     * @throws IllegalArgumentException if the markup is not well-formed XML
     */
    public String apply(String presentation) {
        Document document;
        try {
            document = MathDocuments.parse(presentation);
        } catch (SAXException | IOException e) {
            throw new IllegalArgumentException("Presentation markup is not well-formed: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        NodeList powers = root.getElementsByTagNameNS("*", "msup");
        for (int i = 0; i < powers.getLength(); i++) {
            Element power = (Element) powers.item(i);
            List<Element> operands = MathDocuments.childElements(power);
            if (operands.size() >= 2 && isUnfencedSum(operands.get(0))) {
                fence(document, power, operands.get(0));
            }
        }
        return MarkupWriter.write(root);
    }

    private static boolean isUnfencedSum(Element base) {
        if (!"mrow".equals(MathDocuments.localName(base))) {
            return false;
        }
        List<Element> children = MathDocuments.childElements(base);
        if (children.isEmpty()) {
            return false;
        }
        if (isOperator(children.get(0), "(") && isOperator(children.get(children.size() - 1), ")")) {
            return false;
        }
        for (Element child : children) {
            if ("mo".equals(MathDocuments.localName(child))
                    && ADDITIVE_OPERATORS.contains(child.getTextContent().trim())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOperator(Element element, String text) {
        return "mo".equals(MathDocuments.localName(element)) && text.equals(element.getTextContent().trim());
    }

    private static void fence(Document document, Element power, Element base) {
        String namespace = power.getNamespaceURI();
        Element group = document.createElementNS(namespace, qualified(power, "mrow"));
        Element open = document.createElementNS(namespace, qualified(power, "mo"));
        open.setTextContent("(");
        Element close = document.createElementNS(namespace, qualified(power, "mo"));
        close.setTextContent(")");
        power.replaceChild(group, base);
        group.appendChild(open);
        group.appendChild(base);
        group.appendChild(close);
    }

    private static String qualified(Element sibling, String localName) {
        String prefix = sibling.getPrefix();
        return prefix == null ? localName : prefix + ":" + localName;
    }
}
