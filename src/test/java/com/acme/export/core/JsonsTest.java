package com.acme.export.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class JsonsTest {

    @Test
    void testToJson() {
        Map<String, String> data = Map.of("key1", "value1", "key2", "value2");
        String json = Jsons.toJson(data);
        assertNotNull(json);
        assertTrue(json.contains("key1"));
        assertTrue(json.contains("value1"));
    }

    @Test
    void testOf() {
        String json = Jsons.of("error", "something went wrong");
        assertTrue(json.contains("error"));
        assertTrue(json.contains("something went wrong"));
    }

    @Test
    void testWorkItemIsWrittenAsBareNumber() {
        String json = Jsons.toJson(List.of(WorkItem.of(7), WorkItem.of(42)));
        assertEquals("[7,42]", json.replaceAll("\\s", ""));
        assertEquals(WorkItem.of(42), Jsons.fromJson("42", WorkItem.class));
    }

    @Test
    void testExportStateUsesSnakeCaseKeys() {
        var state = new ExportState(ExportState.CURRENT_VERSION,
                new TreeSet<>(List.of(WorkItem.of(3), WorkItem.of(1))),
                new TreeSet<>(List.of(WorkItem.of(1), WorkItem.of(2), WorkItem.of(3))));

        String json = Jsons.toJson(state).replaceAll("\\s", "");

        assertEquals("{\"version\":3,\"done_ids\":[1,3],\"discovered_ids\":[1,2,3]}", json);
    }

    @Test
    void testFromJsonWrapsParseErrors() {
        assertThrows(RuntimeException.class, () -> Jsons.fromJson("{not json", Map.class));
    }
}
