package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads node type descriptors from YAML:
 * <pre>
 * types:
 *   - name: Sample
 *     fields:
 *       - { name: identifier, type: STRING }
 *       - { name: keywords, type: STRING_LIST }
 * </pre>
 */
public final class YamlTypeLoader {

    // DTOs mirroring YAML
    public record YTypes(List<YType> types) {}
    public record YType(String name, List<YField> fields) {}
    public record YField(String name, String type) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public List<TypeDescriptor> loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toDescriptors(mapper.readValue(in, YTypes.class));
        }
    }

    public List<TypeDescriptor> loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toDescriptors(mapper.readValue(in, YTypes.class));
        }
    }

    public List<TypeDescriptor> load(InputStream in) throws IOException {
        return toDescriptors(mapper.readValue(in, YTypes.class));
    }

    private List<TypeDescriptor> toDescriptors(YTypes y) {
        List<TypeDescriptor> out = new ArrayList<>();
        for (YType t : Optional.ofNullable(y.types()).orElse(List.of())) {
            if (t.name() == null || t.name().isBlank()) {
                throw new GraphConfigException("Type entry without a name");
            }
            List<TypeDescriptor.FieldDef> fields = new ArrayList<>();
            for (YField f : Optional.ofNullable(t.fields()).orElse(List.of())) {
                if (f.name() == null || f.type() == null) {
                    throw new GraphConfigException(t.name(), f.name(), "Field entries need both a name and a type");
                }
                FieldType type;
                try {
                    type = FieldType.valueOf(f.type().trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException iae) {
                    throw new GraphConfigException(t.name(), f.name(), "Unknown field type '" + f.type() + "' for field '" + f.name()
                            + "'. Expected one of: " + java.util.Arrays.toString(FieldType.values()));
                }
                fields.add(new TypeDescriptor.FieldDef(f.name(), type));
            }
            out.add(new TypeDescriptor(t.name(), fields));
        }
        return out;
    }
}
