package com.geofeature.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.BeforeEach;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Unit tests for FeatureSchema slot registration
 */
public class FeatureSchemaTest {

    private FeatureSchema schema;

    @BeforeEach
    public void setUp() {
        schema = new FeatureSchema();
    }

    @Test
    public void testRegisterSlotAssignsDenseIndices() {
        String[] names = {"pop", "name", "area", "zoning"};
        for (int i = 0; i < names.length; i++) {
            assertEquals(i, schema.registerSlot(names[i]));
            assertEquals(i + 1, schema.size());
        }

        assertEquals(0, schema.indexOf("pop").getAsInt());
        assertEquals(1, schema.indexOf("name").getAsInt());
        assertEquals(2, schema.indexOf("area").getAsInt());
        assertEquals(3, schema.indexOf("zoning").getAsInt());
    }

    @Test
    public void testDuplicateRegistrationKeepsMapping() {
        schema.registerSlot("name");
        schema.registerSlot("pop");

        int returned = schema.registerSlot("name");

        // Mapping and size unchanged
        assertEquals(2, schema.size());
        assertEquals(0, schema.indexOf("name").getAsInt());
        assertEquals(1, schema.indexOf("pop").getAsInt());

        // Return value is the index a new name would have received
        assertEquals(2, returned);
    }

    @Test
    public void testRegisterExistingDoesNotOverwrite() {
        assertEquals(5, schema.registerExisting("height", 5));
        assertEquals(9, schema.registerExisting("height", 9));

        assertEquals(1, schema.size());
        assertEquals(5, schema.indexOf("height").getAsInt());
    }

    @Test
    public void testRegisterExistingRejectsNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> schema.registerExisting("x", -1));
        assertEquals(0, schema.size());
    }

    @Test
    public void testEntriesAreSortedByName() {
        schema.registerSlot("zoning");
        schema.registerSlot("area");
        schema.registerSlot("name");

        List<String> names = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : schema.entries()) {
            names.add(entry.getKey());
            indices.add(entry.getValue());
        }

        assertEquals(List.of("area", "name", "zoning"), names);
        assertEquals(List.of(1, 2, 0), indices);
    }

    @Test
    public void testEntriesAreReadOnly() {
        schema.registerSlot("name");
        assertThrows(UnsupportedOperationException.class, () -> schema.entries().clear());
    }

    @Test
    public void testLookupOfUnknownName() {
        schema.registerSlot("name");

        assertTrue(schema.contains("name"));
        assertFalse(schema.contains("missing"));
        assertFalse(schema.contains(null));
        assertTrue(schema.indexOf("missing").isEmpty());
    }

    @Test
    public void testOfRegistersInArgumentOrder() {
        FeatureSchema built = FeatureSchema.of("name", "pop", "name");

        assertEquals(2, built.size());
        assertEquals(0, built.indexOf("name").getAsInt());
        assertEquals(1, built.indexOf("pop").getAsInt());
    }
}
