package io.mathxform.core.markup;

import io.mathxform.core.error.MarkupParseException;
import io.mathxform.core.error.UnsupportedOperatorException;
import io.mathxform.core.model.Call;
import io.mathxform.core.model.Derivative;
import io.mathxform.core.model.ExpressionNode;
import io.mathxform.core.model.Identifier;
import io.mathxform.core.model.NumberLiteral;
import io.mathxform.core.model.Power;
import io.mathxform.core.model.Product;
import io.mathxform.core.model.Sum;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Parses a Content MathML fragment into an {@link ExpressionNode} tree, keeping operand order.
 *
 * <p>
 * Supported vocabulary: {@code ci}, {@code cn} (including {@code type="rational"} with {@code
 * <sep/>}), {@code imaginaryi}, and {@code apply} with heads {@code power}, {@code plus}, {@code
 * times}, {@code diff}, the unary functions {@code sin cos tan sec csc cot log ln exp abs
 * absolutevalue conjugate conj}, or a {@code <ci>} naming a unary function. Any other element with
 * exactly one child element is unwrapped.
 *
 * <p>
 * Thread-safe: holds no state.
 */
public final class MathMarkupParser {

    private static final Map<String, String> UNARY_HEADS = Map.ofEntries(
            Map.entry("sin", "sin"),
            Map.entry("cos", "cos"),
            Map.entry("tan", "tan"),
            Map.entry("sec", "sec"),
            Map.entry("csc", "csc"),
            Map.entry("cot", "cot"),
            Map.entry("log", "log"),
            Map.entry("ln", "log"),
            Map.entry("exp", "exp"),
            Map.entry("abs", "abs"),
            Map.entry("absolutevalue", "abs"),
            Map.entry("conjugate", "conjugate"),
            Map.entry("conj", "conjugate"));

    /**
     * Parses the fragment. It may be a complete {@code <math>} document or a bare fragment, and may be
     * HTML-entity escaped.
     *
     * @param fragment Content MathML text
     * @return the expression tree
     * @throws MarkupParseException if the markup is empty or malformed
     * @throws UnsupportedOperatorException if it uses an operator or tag outside the vocabulary
     */
    public ExpressionNode parse(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            throw new MarkupParseException("Content MathML is empty");
        }
        String xml = HtmlEntities.unescape(fragment.trim());
        Document document = read(xml);
        Element root = document.getDocumentElement();
        List<Element> children = MathDocuments.childElements(root);
        if ("math".equals(MathDocuments.localName(root)) && !children.isEmpty()) {
            return toNode(children.get(0));
        }
        return toNode(root);
    }

    private static Document read(String xml) {
        try {
            return MathDocuments.parse(xml);
        } catch (SAXException | IOException first) {
            try {
                return MathDocuments.parse(MathMl.contentRoot(xml));
            } catch (SAXException | IOException second) {
                MarkupParseException failure =
                        new MarkupParseException("Malformed Content MathML: " + first.getMessage(), first);
                failure.addSuppressed(second);
                throw failure;
            }
        }
    }

    private ExpressionNode toNode(Element element) {
        String tag = MathDocuments.localName(element);
        switch (tag) {
            case "ci": {
                String name = element.getTextContent().trim();
                return new Identifier(name.isEmpty() ? "x" : name);
            }
            case "cn":
                return number(element);
            case "imaginaryi":
                return new Identifier("i");
            case "apply":
                return apply(element);
            default: {
                List<Element> children = MathDocuments.childElements(element);
                if (children.size() == 1) {
                    return toNode(children.get(0));
                }
                throw new UnsupportedOperatorException("Unsupported tag: " + tag, tag);
            }
        }
    }

    private static ExpressionNode number(Element element) {
        if ("rational".equals(element.getAttribute("type")) || hasSeparator(element)) {
            List<String> parts = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            NodeList nodes = element.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node instanceof Element && "sep".equals(MathDocuments.localName(node))) {
                    parts.add(current.toString().trim());
                    current.setLength(0);
                } else {
                    current.append(node.getTextContent());
                }
            }
            parts.add(current.toString().trim());
            if (parts.size() == 2 && !parts.get(0).isEmpty() && !parts.get(1).isEmpty()) {
                return new NumberLiteral(parts.get(0) + "/" + parts.get(1));
            }
            return new NumberLiteral(String.join("", parts));
        }
        String literal = element.getTextContent().trim();
        return new NumberLiteral(literal.isEmpty() ? "0" : literal);
    }

    private static boolean hasSeparator(Element element) {
        for (Element child : MathDocuments.childElements(element)) {
            if ("sep".equals(MathDocuments.localName(child))) {
                return true;
            }
        }
        return false;
    }

    private ExpressionNode apply(Element element) {
        List<Element> children = MathDocuments.childElements(element);
        if (children.isEmpty()) {
            throw new MarkupParseException("Empty <apply> element");
        }
        Element head = children.get(0);
        String operator = MathDocuments.localName(head);
        List<ExpressionNode> args = new ArrayList<>(children.size() - 1);
        for (Element child : children.subList(1, children.size())) {
            args.add(toNode(child));
        }
        if ("ci".equals(operator)) {
            String function = head.getTextContent().trim();
            if (args.size() != 1) {
                throw new UnsupportedOperatorException(
                        "Function '" + function + "' applied to " + args.size() + " arguments", function);
            }
            return new Call(function.isEmpty() ? "f" : function, args.get(0));
        }
        switch (operator) {
            case "power":
                requireArity(operator, args, 2);
                return new Power(args.get(0), args.get(1));
            case "plus":
                return args.isEmpty() ? new NumberLiteral("0") : new Sum(args);
            case "times":
                return args.isEmpty() ? new NumberLiteral("1") : new Product(args);
            case "diff":
                return derivative(args);
            default:
                String function = UNARY_HEADS.get(operator);
                if (function == null) {
                    throw new UnsupportedOperatorException("Unsupported operator: " + operator, operator);
                }
                requireArity(operator, args, 1);
                return new Call(function, args.get(0));
        }
    }

    private static ExpressionNode derivative(List<ExpressionNode> args) {
        if (args.size() == 2) {
            if (args.get(0) instanceof Identifier) {
                return new Derivative(args.get(0), args.get(1));
            }
            if (args.get(1) instanceof Identifier) {
                return new Derivative(args.get(1), args.get(0));
            }
        }
        throw new UnsupportedOperatorException("Unsupported operator: diff needs a variable and a body", "diff");
    }

    private static void requireArity(String operator, List<ExpressionNode> args, int arity) {
        if (args.size() != arity) {
            throw new UnsupportedOperatorException(
                    "Operator '" + operator + "' expects " + arity + " operand(s), got " + args.size(), operator);
        }
    }
}
