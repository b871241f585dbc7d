package io.barrister.server.binding;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;

import io.barrister.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A callable bound to one IDL function, together with the Java types it declares.
 * <p>
 * The declared types drive both the registration-time conformance check and the
 * per-request conversion of parameters. A callable reports an RPC error by throwing a
 * {@link io.barrister.spec.JSONRPCError}; any other exception is an internal error.
 */
public final class FunctionBinding {

    /**
     * Invokes the bound callable with converted arguments.
     */
    @FunctionalInterface
    public interface Invoker {

        @Nullable Object invoke(@Nullable Object[] args) throws Exception;
    }

    private final List<Type> parameterTypes;
    private final Type returnType;
    private final List<Class<?>> checkedExceptions;
    private final Invoker invoker;

    private FunctionBinding(Type returnType, List<Type> parameterTypes, List<Class<?>> checkedExceptions, Invoker invoker) {
        this.returnType = Assert.checkNotNullParam("returnType", returnType);
        this.parameterTypes = List.copyOf(Assert.checkNotNullParam("parameterTypes", parameterTypes));
        this.checkedExceptions = List.copyOf(checkedExceptions);
        this.invoker = Assert.checkNotNullParam("invoker", invoker);
    }

    /**
     * Creates a binding.
     *
     * @param returnType the declared result type
     * @param parameterTypes the declared parameter types, in IDL order
     * @param invoker the callable
     * @return the binding
     */
    public static FunctionBinding of(Type returnType, List<Type> parameterTypes, Invoker invoker) {
        return new FunctionBinding(returnType, parameterTypes, List.of(), invoker);
    }

    /**
     * Creates a binding.
     *
     * @param returnType the declared result type
     * @param invoker the callable
     * @param parameterTypes the declared parameter types, in IDL order
     * @return the binding
     */
    public static FunctionBinding of(Type returnType, Invoker invoker, Type... parameterTypes) {
        return of(returnType, Arrays.asList(parameterTypes), invoker);
    }

    static FunctionBinding of(Type returnType, List<Type> parameterTypes, List<Class<?>> checkedExceptions, Invoker invoker) {
        return new FunctionBinding(returnType, parameterTypes, checkedExceptions, invoker);
    }

    public List<Type> parameterTypes() {
        return parameterTypes;
    }

    public Type returnType() {
        return returnType;
    }

    /**
     * Returns the checked exceptions the callable declares. Only reflected bindings can
     * declare any.
     *
     * @return the declared checked exception types
     */
    public List<Class<?>> checkedExceptions() {
        return checkedExceptions;
    }

    public int arity() {
        return parameterTypes.size();
    }

    /**
     * Invokes the callable.
     *
     * @param args the converted arguments, one per declared parameter
     * @return the result
     * @throws Exception whatever the callable throws
     */
    public @Nullable Object invoke(@Nullable Object... args) throws Exception {
        return invoker.invoke(args);
    }
}
