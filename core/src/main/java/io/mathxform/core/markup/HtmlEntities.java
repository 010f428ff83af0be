package io.mathxform.core.markup;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Unescapes the HTML entities callers sometimes apply to the whole markup payload. */
final class HtmlEntities {

    private static final Pattern ENTITY = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z]+);");

    private static final Map<String, String> NAMED = Map.of(
            "lt", "<",
            "gt", ">",
            "amp", "&",
            "quot", "\"",
            "apos", "'",
            "nbsp", " ",
            "minus", "−",
            "InvisibleTimes", "⁢");

    private HtmlEntities() {}

    static String unescape(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = ENTITY.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(decode(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String decode(String body, String original) {
        if (body.charAt(0) == '#') {
            try {
                int codePoint = body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')
                        ? Integer.parseInt(body.substring(2), 16)
                        : Integer.parseInt(body.substring(1));
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : original;
            } catch (NumberFormatException e) {
                return original;
            }
        }
        return NAMED.getOrDefault(body, original);
    }
}
