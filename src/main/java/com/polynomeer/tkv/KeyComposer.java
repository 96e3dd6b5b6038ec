package com.polynomeer.tkv;

/**
 * Packs a namespace and composite id segments into one storage key.
 * <p>
 * Segments must not contain the delimiter; nothing checks this, and two different ids may then
 * compose to the same key.
 */
public final class KeyComposer {

    /**
     * ASCII unit separator. Non-printable, so the safest choice.
     */
    public static final String DELIM_UNIT = "\u001f";

    /**
     * ASCII pipe. Printable, easier to read in a key dump.
     */
    public static final String DELIM_PIPE = "|";

    private final String delimiter;
    private final String namespace;

    public KeyComposer(String delimiter, String namespace) {
        this.delimiter = delimiter;
        this.namespace = namespace;
    }

    public String compose(String... segments) {
        return namespace + delimiter + String.join(delimiter, segments);
    }
}
