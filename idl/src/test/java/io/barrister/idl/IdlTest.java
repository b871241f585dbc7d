package io.barrister.idl;

import static io.barrister.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.barrister.spec.CommentElement;
import io.barrister.spec.Field;
import io.barrister.spec.Function;
import io.barrister.spec.IdlElement;
import io.barrister.spec.StructElement;
import io.barrister.tck.ConformanceIdl;
import org.junit.jupiter.api.Test;

public class IdlTest {

    @Test
    public void testParseConformanceIdl() throws Exception {
        Idl idl = Idl.parse(ConformanceIdl.bytes());

        assertEquals(11, idl.rawElements().size());
        assertInstanceOf(CommentElement.class, idl.rawElements().get(0));
        assertEquals(List.of("A", "B"), List.copyOf(idl.interfaces().keySet()));
        assertEquals(List.of("Status", "MathOp"), List.copyOf(idl.enums().keySet()));
        assertTrue(idl.structs().containsKey("RepeatResponse"));

        Function echo = idl.lookupMethod("B.echo");
        assertNotNull(echo);
        assertEquals(1, echo.params().size());
        assertTrue(echo.returns().optional());

        Function calc = idl.lookupMethod("A.calc");
        assertNotNull(calc);
        assertTrue(calc.params().get(0).isArray());
        assertEquals("MathOp", calc.params().get(1).type());

        assertNull(idl.lookupMethod("B.nope"));
        assertNull(idl.lookupMethod("B"));
        assertNull(idl.lookupStruct("Nope"));
        assertNull(idl.lookupEnum("Nope"));
        assertNull(idl.lookupInterface("Nope"));
        assertEquals(List.of("B.echo"), idl.methodNames("B"));
        assertEquals(List.of(), idl.methodNames("Nope"));
    }

    @Test
    public void testParseFromStringAndStream() throws Exception {
        Idl fromBytes = Idl.parse(ConformanceIdl.bytes());
        assertEquals(fromBytes, Idl.parse(ConformanceIdl.json()));
        assertEquals(fromBytes, Idl.parse(new ByteArrayInputStream(ConformanceIdl.bytes())));
    }

    @Test
    public void testTwoParsesOfTheSameBytesAreEqual() throws Exception {
        Idl first = Idl.parse(ConformanceIdl.bytes());
        Idl second = Idl.parse(ConformanceIdl.bytes());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.structs(), second.structs());
        assertEquals(first.methods(), second.methods());
        assertEquals(first.enums(), second.enums());
    }

    @Test
    public void testMetaIsScaledToNanoseconds() throws Exception {
        Idl.Meta meta = Idl.parse(ConformanceIdl.bytes()).meta();

        assertEquals("0.1.2", meta.barristerVersion());
        assertEquals(1337654725230000000L, meta.dateGenerated());
        assertEquals("34f6238ed03c6319017382e0fdc638a7", meta.checksum());
        assertEquals(Instant.ofEpochMilli(1337654725230L), meta.generatedAt());
    }

    @Test
    public void testMissingMetaIsEmpty() {
        Idl idl = Idl.build(List.of(new CommentElement("nothing here")));
        assertEquals(Idl.Meta.EMPTY, idl.meta());
    }

    @Test
    public void testInheritedFieldsAreResolved() throws Exception {
        Struct struct = Idl.parse(ConformanceIdl.bytes()).lookupStruct("RepeatResponse");

        assertNotNull(struct);
        assertEquals("Response", struct.extendsName());
        assertEquals(2, struct.fields().size());
        assertEquals(List.of("status", "count", "items"), List.copyOf(struct.resolvedFields().keySet()));
        assertEquals("Status", struct.field("status").type());
    }

    @Test
    public void testChildFieldReplacesInheritedField() {
        Idl idl = Idl.build(List.of(
                new StructElement("Base", null, List.of(
                        new Field("id", Field.INT, false, false),
                        new Field("label", Field.STRING, false, false))),
                new StructElement("Middle", "Base", List.of(
                        new Field("size", Field.FLOAT, false, false))),
                new StructElement("Leaf", "Middle", List.of(
                        new Field("id", Field.STRING, true, false)))));

        Struct leaf = idl.lookupStruct("Leaf");
        assertNotNull(leaf);
        assertEquals(3, leaf.resolvedFields().size());
        assertEquals(Field.STRING, leaf.field("id").type());
        assertTrue(leaf.field("id").optional());
        assertEquals(Field.STRING, leaf.field("label").type());
        assertEquals(Field.FLOAT, leaf.field("size").type());
    }

    @Test
    public void testUnknownParentStopsTheWalk() {
        Idl idl = Idl.build(List.of(
                new StructElement("Orphan", "Missing", List.of(new Field("a", Field.INT, false, false)))));

        Struct orphan = idl.lookupStruct("Orphan");
        assertNotNull(orphan);
        assertEquals(List.of("a"), List.copyOf(orphan.resolvedFields().keySet()));
    }

    @Test
    public void testCyclicExtendsTerminates() {
        Idl idl = Idl.build(List.of(
                new StructElement("X", "Y", List.of(new Field("x", Field.INT, false, false))),
                new StructElement("Y", "X", List.of(new Field("y", Field.INT, false, false)))));

        assertEquals(2, idl.lookupStruct("X").resolvedFields().size());
        assertEquals(2, idl.lookupStruct("Y").resolvedFields().size());
    }

    @Test
    public void testRawElementsAreUnmodifiable() throws Exception {
        List<IdlElement> elements = Idl.parse(ConformanceIdl.bytes()).rawElements();
        assertThrows(UnsupportedOperationException.class, () -> elements.add(new CommentElement("x")));
    }

    @Test
    public void testMalformedDocumentFails() {
        IdlParseException e = assertThrows(IdlParseException.class, () -> Idl.parse("{not json"));
        assertNotNull(e.getCause());

        assertThrows(IdlParseException.class, () -> Idl.parse("[{\"type\": \"widget\"}]"));
        assertThrows(IdlParseException.class, () -> Idl.parse("{\"type\": \"comment\", \"value\": \"x\"}"));
    }

    @Test
    public void testDocumentIsKeptAsRead() throws Exception {
        Idl idl = Idl.parse(ConformanceIdl.bytes());

        JsonNode document = idl.document();

        assertEquals(OBJECT_MAPPER.readTree(ConformanceIdl.bytes()), document);
        assertEquals("", document.get(3).get("extends").asText());
        assertNull(((StructElement) idl.rawElements().get(3)).extendsName());

        ((ArrayNode) document).removeAll();
        assertEquals(11, idl.document().size());
    }

    @Test
    public void testBuiltModelDocumentCarriesTypes() throws Exception {
        Idl parsed = Idl.parse(ConformanceIdl.bytes());

        JsonNode document = Idl.build(parsed.rawElements()).document();

        assertEquals(11, document.size());
        assertEquals("comment", document.get(0).get("type").asText());
        assertEquals("struct", document.get(3).get("type").asText());
        assertEquals("meta", document.get(10).get("type").asText());
        assertEquals(parsed, Idl.parse(OBJECT_MAPPER.writeValueAsBytes(document)));
    }

    @Test
    public void testDocumentMustBeAnArray() {
        IdlParseException e = assertThrows(IdlParseException.class, () -> Idl.parse("{\"type\": \"comment\"}"));
        assertTrue(e.getMessage().contains("JSON array"), e.getMessage());
        assertThrows(IdlParseException.class, () -> Idl.parse(""));
    }
}
