package com.questrail.pvl.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class LabelMappingTest
{
    @Test
    void builderPreservesInsertionOrderAndDuplicateKeys()
    {
        LabelMapping mapping = LabelMapping.builder()
                .put("B", 2)
                .put("A", 1)
                .put("B", "again")
                .build();

        assertEquals(List.of("B", "A", "B"),
                mapping.entries().stream().map(LabelEntry::key).toList());
        assertEquals(Optional.of(IntegerValue.of(2)), mapping.get("B"));
        assertEquals(List.of(IntegerValue.of(2), TextValue.of("again")), mapping.getAll("B"));
        assertEquals(Optional.empty(), mapping.get("C"));
    }

    @Test
    void kindIsSelectedByBuilder_notByContents()
    {
        LabelMapping object = LabelMapping.builder().put("X", 1).build();
        LabelMapping group = LabelMapping.groupBuilder().put("X", 1).build();

        assertEquals(MappingKind.OBJECT, object.kind());
        assertFalse(object.isGroup());
        assertTrue(group.isGroup());
        assertNotEquals(object, group);
    }

    @Test
    void builtMappingIsNotAffectedByLaterBuilderUse()
    {
        LabelMapping.Builder builder = LabelMapping.builder().put("A", 1);
        LabelMapping first = builder.build();
        builder.put("B", 2);

        assertEquals(1, first.size());
        assertThrows(UnsupportedOperationException.class,
                () -> first.entries().add(new LabelEntry("C", NullValue.INSTANCE)));
    }

    @Test
    void nullKeyIsRejected()
    {
        assertThrows(NullPointerException.class,
                () -> LabelMapping.builder().put(null, 1));
    }

    @Test
    void convenienceSettersProduceMatchingVariants()
    {
        LabelMapping mapping = LabelMapping.builder()
                .put("I", 3)
                .put("R", 2.5)
                .put("B", true)
                .put("T", "text")
                .putNull("N")
                .build();

        assertEquals(IntegerValue.of(3), mapping.get("I").orElseThrow());
        assertEquals(RealValue.of(2.5), mapping.get("R").orElseThrow());
        assertEquals(BooleanValue.TRUE, mapping.get("B").orElseThrow());
        assertEquals(TextValue.of("text"), mapping.get("T").orElseThrow());
        assertEquals(NullValue.INSTANCE, mapping.get("N").orElseThrow());
    }
}
