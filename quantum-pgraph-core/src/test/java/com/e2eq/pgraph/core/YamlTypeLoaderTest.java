package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.TypeDescriptor;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YamlTypeLoaderTest {

    @Test
    void testLoadFromClasspath() throws Exception {
        List<TypeDescriptor> types = new YamlTypeLoader().loadFromClasspath("/pgraph/test-types.yaml");
        assertEquals(List.of("Sample", "Site", "Marker"), types.stream().map(TypeDescriptor::name).toList());
        TypeDescriptor sample = types.get(0);
        assertEquals(FieldType.STRING_LIST, sample.field("keywords").orElseThrow().type());
        assertTrue(types.get(2).fields().isEmpty());
    }

    @Test
    void testMissingResource() {
        assertThrows(IOException.class, () -> new YamlTypeLoader().loadFromClasspath("/pgraph/nope.yaml"));
    }

    @Test
    void testUnknownFieldType() {
        String yaml = "types:\n  - name: T\n    fields:\n      - { name: f, type: POINT }\n";
        GraphConfigException ex = assertThrows(GraphConfigException.class,
                () -> new YamlTypeLoader().load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertEquals("f", ex.getFieldName());
    }
}
