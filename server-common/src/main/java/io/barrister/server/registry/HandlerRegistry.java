package io.barrister.server.registry;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.barrister.idl.Idl;
import io.barrister.idl.RepresentativeValues;
import io.barrister.idl.convert.ConversionException;
import io.barrister.idl.convert.Converter;
import io.barrister.server.binding.FunctionBinding;
import io.barrister.server.binding.HandlerBinding;
import io.barrister.spec.Field;
import io.barrister.spec.Function;
import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds IDL interfaces to handlers.
 * <p>
 * {@link #register(String, HandlerBinding)} checks the handler against its interface before
 * storing it. Every IDL function must be bound under its capitalized name, with the declared
 * number of parameters, a non-void result and no checked exceptions. A sample value of every
 * parameter and of the result is then converted to the Java type the binding declares, so
 * that a handler whose signature has drifted from the IDL is rejected at startup.
 *
 * <h2>Lifecycle</h2>
 * All registrations must happen before requests are served. Registering an interface again
 * replaces the earlier handler. The registry is sealed when the first request is dispatched,
 * after which {@code register} fails with an {@link IllegalStateException}.
 */
public class HandlerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Idl idl;
    private final Converter converter;
    private final Map<String, HandlerBinding> handlers = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public HandlerRegistry(Idl idl) {
        this(idl, new Converter(idl));
    }

    public HandlerRegistry(Idl idl, Converter converter) {
        this.idl = Assert.checkNotNullParam("idl", idl);
        this.converter = Assert.checkNotNullParam("converter", converter);
    }

    /**
     * Registers a handler object, binding its public methods with {@link HandlerBinding#reflect(Object)}.
     *
     * @param interfaceName the IDL interface the handler implements
     * @param handler the handler object
     * @throws RegistrationException if the handler does not implement the interface
     * @throws io.barrister.idl.SchemaException if the interface references an unknown type
     * @throws IllegalStateException if requests are already being served
     */
    public void register(String interfaceName, Object handler) {
        Assert.checkNotNullParam("handler", handler);
        if (handler instanceof HandlerBinding binding) {
            register(interfaceName, binding);
        } else {
            register(interfaceName, HandlerBinding.reflect(handler));
        }
    }

    /**
     * Registers a binding table.
     *
     * @param interfaceName the IDL interface the binding implements
     * @param binding the binding table
     * @throws RegistrationException if the binding does not implement the interface
     * @throws io.barrister.idl.SchemaException if the interface references an unknown type
     * @throws IllegalStateException if requests are already being served
     */
    public void register(String interfaceName, HandlerBinding binding) {
        Assert.checkNotNullParam("interfaceName", interfaceName);
        Assert.checkNotNullParam("binding", binding);
        if (sealed) {
            throw new IllegalStateException("Cannot register interface " + interfaceName
                    + ": requests are already being served");
        }

        List<Function> functions = idl.lookupInterface(interfaceName);
        if (functions == null) {
            throw new RegistrationException("No interface found with name: " + interfaceName);
        }

        for (Function function : functions) {
            checkFunction(interfaceName, function, binding);
        }

        if (handlers.put(interfaceName, binding) != null) {
            LOGGER.info("Replaced handler for interface {}", interfaceName);
        } else {
            LOGGER.info("Registered handler for interface {} ({} functions)", interfaceName, functions.size());
        }
    }

    private void checkFunction(String interfaceName, Function function, HandlerBinding binding) {
        String qualifiedName = interfaceName + "." + function.name();
        String bindingName = Utils.capitalize(function.name());

        if (binding.isAmbiguous(bindingName)) {
            throw new RegistrationException(qualifiedName + ": handler has more than one method named " + bindingName);
        }
        FunctionBinding functionBinding = binding.function(bindingName);
        if (functionBinding == null) {
            throw new RegistrationException(qualifiedName + ": handler has no function named " + bindingName);
        }

        if (functionBinding.arity() != function.params().size()) {
            throw new RegistrationException(qualifiedName + ": handler function " + bindingName + " takes "
                    + functionBinding.arity() + " parameters, the IDL declares " + function.params().size());
        }
        Type returnType = functionBinding.returnType();
        if (returnType == void.class || returnType == Void.class) {
            throw new RegistrationException(qualifiedName + ": handler function " + bindingName + " returns no result");
        }
        if (!functionBinding.checkedExceptions().isEmpty()) {
            throw new RegistrationException(qualifiedName + ": handler function " + bindingName
                    + " declares checked exceptions " + functionBinding.checkedExceptions()
                    + ", errors must be reported as JSONRPCError");
        }

        for (int i = 0; i < function.params().size(); i++) {
            checkType(qualifiedName, function.params().get(i), functionBinding.parameterTypes().get(i), "param[" + i + "]");
        }
        checkType(qualifiedName, function.returns(), returnType, "result");
    }

    private void checkType(String qualifiedName, Field field, Type type, String path) {
        Object sample = RepresentativeValues.of(idl, field);
        try {
            converter.convert(field, type, sample, path);
        } catch (ConversionException e) {
            throw new RegistrationException(qualifiedName + ": type mismatch with the IDL: " + e.getMessage(), e);
        }
    }

    /**
     * Looks up the handler of an interface.
     *
     * @param interfaceName the interface name
     * @return the binding table, or {@code null} if no handler is registered
     */
    public @Nullable HandlerBinding lookup(String interfaceName) {
        return handlers.get(interfaceName);
    }

    /**
     * Prevents further registration. Called by the dispatcher before it serves its first request.
     */
    public void seal() {
        if (!sealed) {
            sealed = true;
            LOGGER.debug("Handler registry sealed with interfaces {}", handlers.keySet());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    public Idl idl() {
        return idl;
    }

    public Converter converter() {
        return converter;
    }
}
