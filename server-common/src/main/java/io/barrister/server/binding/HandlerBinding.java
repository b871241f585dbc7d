package io.barrister.server.binding;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The binding table of one handler: capitalized IDL function name to {@link FunctionBinding}.
 * <p>
 * A table is either built explicitly,
 * <pre>{@code
 * HandlerBinding echo = HandlerBinding.builder()
 *         .bind("echo", String.class, args -> args[0], String.class)
 *         .build();
 * }</pre>
 * or derived once from the public methods of a handler object with {@link #reflect(Object)}.
 * Either way the table is fixed before registration and is never consulted reflectively
 * while serving requests.
 */
public final class HandlerBinding {

    private final Map<String, FunctionBinding> functions;
    private final Set<String> ambiguous;

    private HandlerBinding(Map<String, FunctionBinding> functions, Set<String> ambiguous) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.ambiguous = Set.copyOf(ambiguous);
    }

    /**
     * Looks up a function.
     *
     * @param name the function name; it is capitalized before the lookup
     * @return the binding, or {@code null} if none is bound or the name is ambiguous
     */
    public @Nullable FunctionBinding function(String name) {
        return functions.get(Utils.capitalize(name));
    }

    /**
     * Returns whether more than one reflected method binds to {@code name}.
     *
     * @param name the function name; it is capitalized before the lookup
     * @return {@code true} if the name is overloaded on the handler
     */
    public boolean isAmbiguous(String name) {
        return ambiguous.contains(Utils.capitalize(name));
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the binding table of a handler object from its public instance methods.
     * <p>
     * Each method binds under its capitalized name, so {@code echo} and {@code Echo} both
     * implement the IDL function {@code echo}. Methods declared by {@link Object} are
     * skipped. A name shared by several methods is recorded as ambiguous and left unbound.
     *
     * @param handler the handler object
     * @return the binding table
     */
    public static HandlerBinding reflect(Object handler) {
        Assert.checkNotNullParam("handler", handler);
        Map<String, FunctionBinding> functions = new LinkedHashMap<>();
        Set<String> ambiguous = new HashSet<>();

        for (Method method : handler.getClass().getMethods()) {
            if (method.getDeclaringClass() == Object.class
                    || Modifier.isStatic(method.getModifiers())
                    || method.isBridge()
                    || method.isSynthetic()) {
                continue;
            }
            String name = Utils.capitalize(method.getName());
            if (ambiguous.contains(name)) {
                continue;
            }
            if (functions.remove(name) != null) {
                ambiguous.add(name);
                continue;
            }
            functions.put(name, bindMethod(handler, method));
        }
        return new HandlerBinding(functions, ambiguous);
    }

    private static FunctionBinding bindMethod(Object handler, Method method) {
        // public methods of non-public classes, e.g. anonymous handlers
        method.trySetAccessible();

        List<Class<?>> checked = new ArrayList<>();
        for (Class<?> exceptionType : method.getExceptionTypes()) {
            if (!RuntimeException.class.isAssignableFrom(exceptionType) && !Error.class.isAssignableFrom(exceptionType)) {
                checked.add(exceptionType);
            }
        }

        return FunctionBinding.of(method.getGenericReturnType(), Arrays.asList(method.getGenericParameterTypes()), checked,
                args -> {
                    try {
                        return method.invoke(handler, args);
                    } catch (InvocationTargetException e) {
                        Throwable cause = e.getCause();
                        if (cause instanceof Exception exception) {
                            throw exception;
                        }
                        if (cause instanceof Error error) {
                            throw error;
                        }
                        throw e;
                    }
                });
    }

    public static class Builder {

        private final Map<String, FunctionBinding> functions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Binds a function. A later binding for the same name replaces an earlier one.
         *
         * @param name the IDL function name
         * @param function the binding
         * @return this builder
         */
        public Builder bind(String name, FunctionBinding function) {
            Assert.checkNotEmptyParam("name", name);
            Assert.checkNotNullParam("function", function);
            functions.put(Utils.capitalize(name), function);
            return this;
        }

        public Builder bind(String name, Type returnType, FunctionBinding.Invoker invoker, Type... parameterTypes) {
            return bind(name, FunctionBinding.of(returnType, invoker, parameterTypes));
        }

        public HandlerBinding build() {
            return new HandlerBinding(functions, Set.of());
        }
    }
}
