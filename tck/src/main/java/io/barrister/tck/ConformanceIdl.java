package io.barrister.tck;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Access to the conformance IDL document bundled with this module.
 */
public final class ConformanceIdl {

    public static final String RESOURCE = "/conform.json";

    private ConformanceIdl() {
    }

    /**
     * Returns the raw bytes of {@code conform.json}.
     *
     * @return the IDL document
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static byte[] bytes() {
        try (InputStream in = ConformanceIdl.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Missing classpath resource " + RESOURCE));
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }

    /**
     * Returns {@code conform.json} as a string.
     *
     * @return the IDL document
     */
    public static String json() {
        return new String(bytes(), StandardCharsets.UTF_8);
    }
}
