package io.mathxform.core.markup;

/** MathML constants and text escaping shared by the printers. */
public final class MathMl {

    public static final String NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    /** Invisible times operator placed between adjacent non-numeric factors. */
    public static final String INVISIBLE_TIMES = "\u2062";

    public static final String MINUS_SIGN = "\u2212";

    private MathMl() {}

    /** Escapes {@code & < > "} for use in element text or a double-quoted attribute. */
    public static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }

    /** Wraps presentation markup body in a block-display {@code <math>} root. */
    public static String presentationRoot(String body) {
        return "<math xmlns=\"" + NAMESPACE + "\" display=\"block\">" + body + "</math>";
    }

    /** Wraps content markup body in a {@code <math>} root. */
    public static String contentRoot(String body) {
        return "<math xmlns=\"" + NAMESPACE + "\">" + body + "</math>";
    }
}
