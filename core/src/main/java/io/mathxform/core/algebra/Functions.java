package io.mathxform.core.algebra;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Names of the functions the engine interprets natively, plus the aliases it accepts for them. */
public final class Functions {

    public static final String SIN = "sin";
    public static final String COS = "cos";
    public static final String TAN = "tan";
    public static final String COT = "cot";
    public static final String SEC = "sec";
    public static final String CSC = "csc";
    public static final String EXP = "exp";
    public static final String LOG = "log";
    public static final String ABS = "abs";
    public static final String CONJUGATE = "conjugate";

    /** Native functions in the order factors are sorted within a product. */
    public static final List<String> NATIVE = List.of(SIN, COS, TAN, COT, SEC, CSC, EXP, LOG, ABS, CONJUGATE);

    public static final Set<String> TRIGONOMETRIC = Set.of(SIN, COS, TAN, COT, SEC, CSC);

    private static final Set<String> ODD = Set.of(SIN, TAN, COT, CSC);
    private static final Set<String> EVEN = Set.of(COS, SEC);

    private static final Map<String, String> ALIASES = Map.of(
            "ln", LOG,
            "absolutevalue", ABS,
            "conj", CONJUGATE);

    private Functions() {}

    /**
     * Lower-cases a function name and resolves aliases ({@code ln}, {@code absolutevalue}, {@code
     * conj}). Unknown names are returned lower-cased.
     */
    public static String canonicalName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(lower, lower);
    }

    public static boolean isNative(String name) {
        return NATIVE.contains(name);
    }

    static boolean isOdd(String name) {
        return ODD.contains(name);
    }

    static boolean isEven(String name) {
        return EVEN.contains(name);
    }

    /** Sort rank within a product; opaque functions sort after every native one. */
    static int rank(String name) {
        int index = NATIVE.indexOf(name);
        return index < 0 ? NATIVE.size() : index;
    }

    /** Returns {@code true} if any subexpression applies a trigonometric function. */
    public static boolean containsTrigonometric(Expr expr) {
        return Exprs.anyMatch(expr, e -> e instanceof Fn fn && TRIGONOMETRIC.contains(fn.name()));
    }
}
