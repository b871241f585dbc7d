package io.barrister.server.requesthandlers;

import io.barrister.util.Assert;
import io.barrister.util.Utils;

/**
 * A JSON-RPC method name split into interface and function.
 * <p>
 * The name is split at the first {@code '.'} and the function part is capitalized, so
 * {@code "B.echo"} becomes interface {@code B}, function {@code Echo}. A name without a
 * separator, or whose only separator is its last character, is kept whole as the interface
 * name and has an empty function name.
 *
 * @param interfaceName the interface name
 * @param functionName the capitalized function name, possibly empty
 */
public record MethodName(String interfaceName, String functionName) {

    public static final char SEPARATOR = '.';

    public static MethodName parse(String method) {
        Assert.checkNotNullParam("method", method);
        int idx = method.indexOf(SEPARATOR);
        if (idx < 0 || idx == method.length() - 1) {
            return new MethodName(method, "");
        }
        return new MethodName(method.substring(0, idx), Utils.capitalize(method.substring(idx + 1)));
    }
}
