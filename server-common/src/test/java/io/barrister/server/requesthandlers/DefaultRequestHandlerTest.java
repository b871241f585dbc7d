package io.barrister.server.requesthandlers;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.barrister.idl.Idl;
import io.barrister.server.binding.FunctionBinding;
import io.barrister.server.binding.HandlerBinding;
import io.barrister.server.registry.HandlerRegistry;
import io.barrister.spec.BarristerErrorCodes;
import io.barrister.spec.InternalError;
import io.barrister.spec.InvalidParamsError;
import io.barrister.spec.JSONRPCError;
import io.barrister.spec.MethodNotFoundError;
import io.barrister.tck.AImpl;
import io.barrister.tck.BImpl;
import io.barrister.tck.ConformanceIdl;
import io.barrister.tck.HiResponse;
import io.barrister.tck.RepeatResponse;
import io.barrister.tck.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

public class DefaultRequestHandlerTest {

    private Idl idl;
    private HandlerRegistry registry;
    private RequestHandler requestHandler;
    private ListAppender<ILoggingEvent> logs;
    private Logger logger;

    @BeforeEach
    public void init() throws Exception {
        idl = Idl.parse(ConformanceIdl.bytes());
        registry = new HandlerRegistry(idl);
        registry.register("A", new AImpl());
        registry.register("B", new BImpl());
        requestHandler = DefaultRequestHandler.create(registry);

        logger = (Logger) LoggerFactory.getLogger(DefaultRequestHandler.class);
        logs = new ListAppender<>();
        logs.start();
        logger.addAppender(logs);
    }

    @AfterEach
    public void tearDown() {
        logger.detachAppender(logs);
    }

    @Test
    public void testEcho() {
        assertEquals("hi", requestHandler.call("B.echo", "hi"));
        assertNull(requestHandler.call("B.echo", BImpl.RETURN_NULL));
    }

    @Test
    public void testPrimitiveParameters() {
        assertEquals(5L, requestHandler.call("A.add", 2, 3L));
        assertEquals(3.0, requestHandler.call("A.sqrt", 9));
        assertEquals(List.of(7L, 7L, 7L), requestHandler.call("A.repeat_num", 7L, 3L));
    }

    @Test
    public void testArrayAndEnumParameters() {
        assertEquals(6.0, requestHandler.call("A.calc", List.of(1, 2.0, 3L), "add"));
        assertEquals(6.0, requestHandler.call("A.calc", List.of(1, 2, 3), "multiply"));
    }

    @Test
    public void testStructParameter() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("to_repeat", "ab");
        request.put("count", 2);
        request.put("force_uppercase", true);

        Object result = requestHandler.call("A.repeat", request);

        assertEquals(new RepeatResponse(Status.OK, 2, List.of("AB", "AB")), result);
    }

    @Test
    public void testOptionalStructFieldMayBeNull() {
        Map<String, Object> person = new LinkedHashMap<>();
        person.put("personId", "p1");
        person.put("firstName", "Ada");
        person.put("lastName", "Lovelace");
        person.put("email", null);

        assertEquals("p1", requestHandler.call("A.putPerson", person));
    }

    @Test
    public void testNoParameters() {
        assertEquals(new HiResponse("hi"), requestHandler.call("A.say_hi"));
    }

    @Test
    public void testUnknownMethod() {
        JSONRPCError e = assertThrows(JSONRPCError.class, () -> requestHandler.call("UnknownIface.foo"));
        assertEquals(BarristerErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, e.getCode());
        assertInstanceOf(MethodNotFoundError.class, e);

        assertThrows(MethodNotFoundError.class, () -> requestHandler.call("B.nope", "x"));
        assertThrows(MethodNotFoundError.class, () -> requestHandler.call("B."));
        assertThrows(MethodNotFoundError.class, () -> requestHandler.call("barrister-idl"));
    }

    @Test
    public void testInterfaceWithoutHandler() throws Exception {
        HandlerRegistry onlyB = new HandlerRegistry(idl);
        onlyB.register("B", new BImpl());
        RequestHandler handler = DefaultRequestHandler.create(onlyB);

        MethodNotFoundError e = assertThrows(MethodNotFoundError.class, () -> handler.call("A.add", 1, 2));
        assertTrue(e.getMessage().contains("A"));
    }

    @Test
    public void testConversionFailureIsInvalidParams() {
        JSONRPCError e = assertThrows(JSONRPCError.class, () -> requestHandler.call("B.echo", 1));
        assertEquals(BarristerErrorCodes.INVALID_PARAMS_ERROR_CODE, e.getCode());
        assertEquals("Invalid value for 'param[0]': expected string but got number 1", e.getMessage());
    }

    @Test
    public void testNestedConversionFailureNamesPath() {
        InvalidParamsError e = assertThrows(InvalidParamsError.class,
                () -> requestHandler.call("A.calc", Arrays.asList(1.0, "two"), "add"));
        assertTrue(e.getMessage().startsWith("Invalid value for 'param[0][1]'"));
    }

    @Test
    public void testFractionForIntIsInvalidParams() {
        assertThrows(InvalidParamsError.class, () -> requestHandler.call("A.add", 1.5, 2));
    }

    @Test
    public void testInvalidEnumIsInvalidParams() {
        InvalidParamsError e = assertThrows(InvalidParamsError.class,
                () -> requestHandler.call("A.calc", List.of(1.0), "divide"));
        assertTrue(e.getMessage().contains("[add, multiply]"));
    }

    @Test
    public void testRequiredNullIsInvalidParams() {
        assertThrows(InvalidParamsError.class, () -> requestHandler.call("B.echo", (Object) null));
    }

    @Test
    public void testArityMismatch() {
        JSONRPCError e = assertThrows(JSONRPCError.class, () -> requestHandler.call("B.echo"));
        assertEquals(BarristerErrorCodes.INVALID_PARAMS_ERROR_CODE, e.getCode());
        assertThrows(InvalidParamsError.class, () -> requestHandler.call("B.echo", "a", "b"));
    }

    @Test
    public void testHandlerErrorIsPropagated() throws Exception {
        FunctionBinding.Invoker invoker = mock(FunctionBinding.Invoker.class);
        when(invoker.invoke(any())).thenThrow(new JSONRPCError(-32001, "quota exceeded", Map.of("limit", 5)));
        RequestHandler handler = handlerFor(invoker);

        JSONRPCError e = assertThrows(JSONRPCError.class, () -> handler.call("B.echo", "x"));

        assertEquals(-32001, e.getCode());
        assertEquals("quota exceeded", e.getMessage());
        assertEquals(Map.of("limit", 5), e.getData());
        assertTrue(logs.list.stream().noneMatch(event -> event.getLevel() == Level.WARN));
    }

    @Test
    public void testUnexpectedExceptionIsInternalError() throws Exception {
        FunctionBinding.Invoker invoker = mock(FunctionBinding.Invoker.class);
        when(invoker.invoke(any())).thenThrow(new IllegalStateException("boom"));
        RequestHandler handler = handlerFor(invoker);

        JSONRPCError e = assertThrows(JSONRPCError.class, () -> handler.call("B.echo", "x"));

        assertInstanceOf(InternalError.class, e);
        assertEquals(BarristerErrorCodes.INTERNAL_ERROR_CODE, e.getCode());
        assertTrue(e.getMessage().contains("boom"));
        ILoggingEvent warning = logs.list.stream().filter(event -> event.getLevel() == Level.WARN).findFirst().orElseThrow();
        assertNotNull(warning.getThrowableProxy());
    }

    @Test
    public void testConvertedArgumentsReachHandler() throws Exception {
        FunctionBinding.Invoker invoker = mock(FunctionBinding.Invoker.class);
        when(invoker.invoke(any())).thenReturn(7L);
        HandlerRegistry addRegistry = new HandlerRegistry(idl);
        addRegistry.register("A", HandlerBinding.builder()
                .bind("add", int.class, invoker, int.class, long.class)
                .bind("calc", double.class, args -> 0.0, double[].class, String.class)
                .bind("sqrt", double.class, args -> 0.0, double.class)
                .bind("repeat", Map.class, args -> Map.of(), Map.class)
                .bind("say_hi", Object.class, args -> null)
                .bind("repeat_num", long[].class, args -> new long[0], long.class, long.class)
                .bind("putPerson", String.class, args -> "", Map.class)
                .build());
        RequestHandler handler = DefaultRequestHandler.create(addRegistry);

        assertEquals(7L, handler.call("A.add", 3.0, 4));

        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(invoker).invoke(args.capture());
        assertArrayEquals(new Object[] {3, 4L}, args.getValue());
    }

    @Test
    public void testInvalidParamsNeverInvokesHandler() throws Exception {
        FunctionBinding.Invoker invoker = mock(FunctionBinding.Invoker.class);
        RequestHandler handler = handlerFor(invoker);

        assertThrows(InvalidParamsError.class, () -> handler.call("B.echo", true));

        verify(invoker, never()).invoke(any());
    }

    @Test
    public void testResultValidation() throws Exception {
        HandlerRegistry liar = new HandlerRegistry(idl);
        liar.register("B", HandlerBinding.builder()
                .bind("echo", Object.class, args -> 42L, String.class)
                .build());

        assertEquals(42L, DefaultRequestHandler.create(liar).call("B.echo", "x"));

        RequestHandler validating = DefaultRequestHandler.builder(liar).validateResults(true).build();
        JSONRPCError e = assertThrows(JSONRPCError.class, () -> validating.call("B.echo", "x"));
        assertEquals(BarristerErrorCodes.INTERNAL_ERROR_CODE, e.getCode());
        assertTrue(e.getMessage().contains("expected string"));
    }

    @Test
    public void testResultValidationAcceptsTypedResults() {
        RequestHandler validating = DefaultRequestHandler.builder(registry).validateResults(true).build();

        assertEquals(new HiResponse("hi"), validating.call("A.say_hi"));
        assertNull(validating.call("B.echo", BImpl.RETURN_NULL));
    }

    @Test
    public void testFirstCallSealsRegistry() {
        assertFalse(registry.isSealed());
        requestHandler.call("B.echo", "x");
        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register("B", new BImpl()));
    }

    private RequestHandler handlerFor(FunctionBinding.Invoker echoInvoker) {
        HandlerRegistry echoRegistry = new HandlerRegistry(idl);
        echoRegistry.register("B", HandlerBinding.builder()
                .bind("echo", String.class, echoInvoker, String.class)
                .build());
        return DefaultRequestHandler.create(echoRegistry);
    }
}
