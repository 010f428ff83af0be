package io.mathxform.core.model;

/**
 * 32-bit node identifier: the djb2 hash ({@code h = h * 33 + c}, seed 5381) of a node's canonical
 * string, over its UTF-16 code units, truncated to 32 bits. Rendered as lowercase hex without
 * leading zeros.
 *
 * <p>
 * The hash function and rendering are shared with the system that rendered the markup and
 * assigned the caller's selected node id. Changing either breaks node selection.
 */
public record NodeId(int value) {

    private static final int SEED = 5381;

    public static NodeId of(String canonical) {
        int h = SEED;
        for (int i = 0; i < canonical.length(); i++) {
            h = h * 33 + canonical.charAt(i);
        }
        return new NodeId(h);
    }

    public String hex() {
        return Integer.toHexString(value);
    }

    @Override
    public String toString() {
        return hex();
    }
}
