package io.barrister.server.requesthandlers;

import java.lang.reflect.Type;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.barrister.idl.Idl;
import io.barrister.idl.convert.ConversionException;
import io.barrister.idl.convert.Converter;
import io.barrister.server.binding.FunctionBinding;
import io.barrister.server.binding.HandlerBinding;
import io.barrister.server.registry.HandlerRegistry;
import io.barrister.spec.Field;
import io.barrister.spec.Function;
import io.barrister.spec.InternalError;
import io.barrister.spec.InvalidParamsError;
import io.barrister.spec.JSONRPCError;
import io.barrister.spec.MethodNotFoundError;
import io.barrister.util.Assert;
import io.barrister.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link RequestHandler}, dispatching to the handlers of a {@link HandlerRegistry}.
 * <p>
 * A call is resolved against the IDL method table first, then against the registered handler
 * of the interface. Parameters are converted to the types the handler's binding declares and
 * the handler is invoked. Failures map to JSON-RPC errors:
 * <ul>
 *   <li>{@link MethodNotFoundError} - unknown method, interface without handler, unbound function</li>
 *   <li>{@link InvalidParamsError} - wrong parameter count, or a parameter that does not conform</li>
 *   <li>{@link InternalError} - the handler threw anything other than a {@link JSONRPCError}, or its
 *       result does not conform when result validation is enabled</li>
 * </ul>
 * A {@link JSONRPCError} thrown by the handler is propagated unchanged.
 * <p>
 * The first call seals the registry.
 */
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private final HandlerRegistry registry;
    private final Idl idl;
    private final Converter converter;
    private final ObjectMapper objectMapper;
    private final boolean validateResults;

    private DefaultRequestHandler(Builder builder) {
        this.registry = builder.registry;
        this.idl = registry.idl();
        this.converter = registry.converter();
        this.objectMapper = builder.objectMapper;
        this.validateResults = builder.validateResults;
    }

    public static DefaultRequestHandler create(HandlerRegistry registry) {
        return builder(registry).build();
    }

    public static Builder builder(HandlerRegistry registry) {
        return new Builder(registry);
    }

    @Override
    public Idl idl() {
        return idl;
    }

    @Override
    public @Nullable Object call(String method, @Nullable Object... params) throws JSONRPCError {
        Assert.checkNotNullParam("method", method);
        @Nullable Object[] args = params == null ? new Object[0] : params;
        registry.seal();

        Function function = idl.lookupMethod(method);
        if (function == null) {
            LOGGER.debug("Method not found: {}", method);
            throw new MethodNotFoundError("Method not found: " + method);
        }

        MethodName name = MethodName.parse(method);
        HandlerBinding handler = registry.lookup(name.interfaceName());
        if (handler == null) {
            LOGGER.debug("No handler registered for interface {}", name.interfaceName());
            throw new MethodNotFoundError("No handler registered for interface: " + name.interfaceName());
        }
        FunctionBinding binding = handler.function(name.functionName());
        if (binding == null) {
            LOGGER.debug("Handler for {} has no function {}", name.interfaceName(), name.functionName());
            throw new MethodNotFoundError("Function not found on handler: " + method);
        }

        List<Field> declared = function.params();
        if (args.length != binding.arity() || args.length != declared.size()) {
            LOGGER.debug("{} called with {} parameters, expected {}", method, args.length, declared.size());
            throw new InvalidParamsError("Method " + method + " expects " + declared.size()
                    + " parameters, got " + args.length);
        }

        @Nullable Object[] converted = new Object[args.length];
        List<Type> types = binding.parameterTypes();
        for (int i = 0; i < args.length; i++) {
            try {
                converted[i] = converter.convert(declared.get(i), types.get(i), args[i], "param[" + i + "]");
            } catch (ConversionException e) {
                LOGGER.debug("Invalid parameters for {}: {}", method, e.getMessage());
                throw new InvalidParamsError(e.getMessage());
            }
        }

        Object result;
        try {
            result = binding.invoke(converted);
        } catch (JSONRPCError e) {
            LOGGER.debug("{} returned error {}", method, e.getCode());
            throw e;
        } catch (Exception e) {
            LOGGER.warn("Unexpected exception from handler for {}", method, e);
            throw new InternalError("Unexpected error calling " + method + ": " + e);
        }

        if (validateResults) {
            validateResult(method, function.returns(), result);
        }
        return result;
    }

    private void validateResult(String method, Field returns, @Nullable Object result) {
        try {
            converter.convert(returns, objectMapper.convertValue(result, Object.class), "result");
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Unable to serialize result of {}", method, e);
            throw new InternalError("Unable to serialize result of " + method + ": " + e.getMessage());
        } catch (ConversionException e) {
            LOGGER.warn("Result of {} does not conform to the IDL: {}", method, e.getMessage());
            throw new InternalError("Invalid result from " + method + ": " + e.getMessage());
        }
    }

    public static class Builder {

        private final HandlerRegistry registry;
        private ObjectMapper objectMapper = Utils.OBJECT_MAPPER;
        private boolean validateResults;

        private Builder(HandlerRegistry registry) {
            this.registry = Assert.checkNotNullParam("registry", registry);
        }

        /**
         * Enables checking every result against the function's declared return type.
         *
         * @param validateResults whether to validate results
         * @return this builder
         */
        public Builder validateResults(boolean validateResults) {
            this.validateResults = validateResults;
            return this;
        }

        /**
         * Sets the mapper used to turn results into JSON values for validation.
         *
         * @param objectMapper the mapper
         * @return this builder
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
            return this;
        }

        public DefaultRequestHandler build() {
            return new DefaultRequestHandler(this);
        }
    }
}
