package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.core.PropertyGraph;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Writes edges after checking them against an {@link EdgeTypeCatalog}. The iSamples
 * shortcuts expect the bundled catalog, or one that uses the same type names.
 */
public class TypedEdgeGenerator {

    private static final Logger LOG = Logger.getLogger(TypedEdgeGenerator.class);

    private final PropertyGraph graph;
    private final TypedEdgeQueries queries;

    public TypedEdgeGenerator(PropertyGraph graph, EdgeTypeCatalog catalog) {
        this.graph = graph;
        this.queries = new TypedEdgeQueries(graph, catalog);
    }

    public String addTypedEdge(String subject, String predicate, List<String> objects) {
        return addTypedEdge(subject, predicate, objects, null, null, true);
    }

    /**
     * Validates every (subject, predicate, object) triple, then writes one edge.
     *
     * @param expectedType catalog name or id the edge must have, or null for any known type
     * @param validate     false writes the edge unchecked
     * @return the edge pid
     * @throws EdgeValidationException if a triple does not fit; nothing is written
     */
    public String addTypedEdge(String subject, String predicate, List<String> objects,
                               String expectedType, String namedGraph, boolean validate) {
        if (validate) {
            EdgeTypeDef expected = null;
            if (expectedType != null) {
                EdgeTypeCatalog catalog = queries.catalog();
                expected = catalog.byName(expectedType).or(() -> catalog.byId(expectedType))
                        .orElseThrow(() -> new EdgeValidationException(subject, predicate, "Unknown edge type: " + expectedType));
                if (!expected.multivalued() && objects != null && objects.size() > 1) {
                    throw new EdgeValidationException(subject, predicate,
                            expected.name() + " takes one object but got " + objects.size());
                }
            }
            for (String object : objects == null ? List.<String>of() : objects) {
                EdgeValidationResult r = queries.validateEdge(subject, predicate, object, expected);
                if (!r.valid()) {
                    LOG.warnf("Rejected typed edge (%s, %s, %s): %s", subject, predicate, object, r.message());
                    throw new EdgeValidationException(subject, predicate, r.message());
                }
            }
        }
        return graph.addEdge(subject, predicate, objects, namedGraph);
    }

    private String typed(String type, String subject, String predicate, List<String> objects) {
        return addTypedEdge(subject, predicate, objects, type, null, true);
    }

    public String addMsrProducedBy(String sample, String event) {
        return typed("MSR_PRODUCED_BY", sample, "produced_by", List.of(event));
    }

    public String addMsrRegistrant(String sample, String agent) {
        return typed("MSR_REGISTRANT", sample, "registrant", List.of(agent));
    }

    public String addMsrCuration(String sample, String curation) {
        return typed("MSR_CURATION", sample, "curation", List.of(curation));
    }

    public String addMsrKeywords(String sample, List<String> concepts) {
        return typed("MSR_KEYWORDS", sample, "keywords", concepts);
    }

    public String addMsrHasContextCategory(String sample, List<String> concepts) {
        return typed("MSR_HAS_CONTEXT_CATEGORY", sample, "has_context_category", concepts);
    }

    public String addMsrHasMaterialCategory(String sample, List<String> concepts) {
        return typed("MSR_HAS_MATERIAL_CATEGORY", sample, "has_material_category", concepts);
    }

    public String addMsrHasSampleObjectType(String sample, List<String> concepts) {
        return typed("MSR_HAS_SAMPLE_OBJECT_TYPE", sample, "has_sample_object_type", concepts);
    }

    public String addMsrRelatedResource(String sample, List<String> relations) {
        return typed("MSR_RELATED_RESOURCE", sample, "related_resource", relations);
    }

    public String addEventSamplingSite(String event, String site) {
        return typed("EVENT_SAMPLING_SITE", event, "sampling_site", List.of(site));
    }

    public String addEventResponsibility(String event, List<String> agents) {
        return typed("EVENT_RESPONSIBILITY", event, "responsibility", agents);
    }

    public String addEventSampleLocation(String event, String location) {
        return typed("EVENT_SAMPLE_LOCATION", event, "sample_location", List.of(location));
    }

    public String addEventHasContextCategory(String event, List<String> concepts) {
        return typed("EVENT_HAS_CONTEXT_CATEGORY", event, "has_context_category", concepts);
    }

    public String addSiteLocation(String site, String location) {
        return typed("SITE_LOCATION", site, "site_location", List.of(location));
    }

    public String addCurationResponsibility(String curation, List<String> agents) {
        return typed("CURATION_RESPONSIBILITY", curation, "responsibility", agents);
    }
}
