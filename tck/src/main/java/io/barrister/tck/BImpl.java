package io.barrister.tck;

import org.jspecify.annotations.Nullable;

/**
 * Reference implementation of the conformance interface {@code B}.
 */
public class BImpl {

    public static final String RETURN_NULL = "return-null";

    /**
     * Returns {@code s}, or {@code null} when {@code s} is {@value #RETURN_NULL}.
     *
     * @param s the value to echo
     * @return {@code s} or {@code null}
     */
    public @Nullable String echo(String s) {
        if (RETURN_NULL.equals(s)) {
            return null;
        }
        return s;
    }
}
