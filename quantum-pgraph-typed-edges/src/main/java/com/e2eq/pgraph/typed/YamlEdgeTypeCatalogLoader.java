package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads an edge type catalog from YAML:
 * <pre>
 * edgeTypes:
 *   - name: MSR_PRODUCED_BY
 *     subject: MaterialSampleRecord
 *     predicate: produced_by
 *     object: SamplingEvent
 *     multivalued: false
 *     description: Sampling event that produced this sample
 * </pre>
 */
public final class YamlEdgeTypeCatalogLoader {

    public record YCatalog(List<YEdgeType> edgeTypes) {}
    public record YEdgeType(String name, String subject, String predicate, String object,
                            Boolean multivalued, String description) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public EdgeTypeCatalog loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toCatalog(mapper.readValue(in, YCatalog.class));
        }
    }

    public EdgeTypeCatalog loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toCatalog(mapper.readValue(in, YCatalog.class));
        }
    }

    public EdgeTypeCatalog load(InputStream in) throws IOException {
        return toCatalog(mapper.readValue(in, YCatalog.class));
    }

    private EdgeTypeCatalog toCatalog(YCatalog y) {
        List<EdgeTypeDef> out = new ArrayList<>();
        for (YEdgeType e : Optional.ofNullable(y.edgeTypes()).orElse(List.of())) {
            String subject = require(e, "subject", e.subject());
            String predicate = require(e, "predicate", e.predicate());
            String object = require(e, "object", e.object());
            String name = e.name() == null || e.name().isBlank()
                    ? EdgeTypeDef.idOf(subject, predicate, object)
                    : e.name();
            out.add(new EdgeTypeDef(name, subject, predicate, object,
                    Boolean.TRUE.equals(e.multivalued()), e.description()));
        }
        return new EdgeTypeCatalog(out);
    }

    private static String require(YEdgeType e, String key, String value) {
        if (value == null || value.isBlank()) {
            throw new GraphConfigException("Edge type " + (e.name() == null ? "" : "'" + e.name() + "' ")
                    + "is missing '" + key + "'");
        }
        return value;
    }
}
