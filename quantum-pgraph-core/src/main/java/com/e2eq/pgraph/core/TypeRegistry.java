package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.GraphEntity;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.TypeDescriptor;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects node type descriptors until the schema is finalized, then serves the frozen
 * {@link GraphSchema} and the entity bindings used by decomposition.
 */
public class TypeRegistry {

    private static final Logger LOG = Logger.getLogger(TypeRegistry.class);

    private final GraphConfig config;
    private final AnnotationTypeLoader annotationLoader = new AnnotationTypeLoader();
    private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();
    private final Map<Class<?>, EntityBinding> bindings = new LinkedHashMap<>();
    private GraphSchema schema;

    public TypeRegistry(GraphConfig config) {
        this.config = config;
    }

    /**
     * Registers a descriptor. Registering an identical descriptor again is a no-op.
     *
     * @throws GraphConfigException after finalization, or when a different descriptor
     *                              with the same name is already registered
     */
    public synchronized void registerType(TypeDescriptor descriptor) {
        requireOpen(descriptor.name());
        TypeDescriptor existing = types.get(descriptor.name());
        if (existing != null) {
            if (existing.equals(descriptor)) return;
            throw new GraphConfigException(descriptor.name(), null,
                    "Type '" + descriptor.name() + "' is already registered with fields " + existing.fields()
                            + "; cannot re-register it with " + descriptor.fields());
        }
        types.put(descriptor.name(), descriptor);
        LOG.debugf("Registered type '%s' with %d field(s)", descriptor.name(), descriptor.fields().size());
    }

    public synchronized void registerTypes(Collection<TypeDescriptor> descriptors) {
        for (TypeDescriptor d : descriptors) registerType(d);
    }

    /**
     * Registers an entity class and every entity class it references.
     */
    public synchronized void registerType(Class<? extends GraphEntity> entityClass) {
        requireOpen(entityClass.getName());
        List<EntityBinding> loaded = annotationLoader.load(entityClass);
        // check all descriptors before registering any of them
        for (EntityBinding b : loaded) {
            TypeDescriptor existing = types.get(b.otype());
            if (existing != null && !existing.equals(b.descriptor())) {
                throw new GraphConfigException(b.otype(), null,
                        "Type '" + b.otype() + "' derived from " + b.entityClass().getName() + " conflicts with the registered descriptor");
            }
            EntityBinding bound = bindings.get(b.entityClass());
            if (bound == null) {
                for (EntityBinding other : bindings.values()) {
                    if (other.otype().equals(b.otype()) && other.entityClass() != b.entityClass()) {
                        throw new GraphConfigException(b.otype(), null, "Classes " + other.entityClass().getName()
                                + " and " + b.entityClass().getName() + " both map to type '" + b.otype() + "'");
                    }
                }
            }
        }
        for (EntityBinding b : loaded) {
            registerType(b.descriptor());
            bindings.putIfAbsent(b.entityClass(), b);
        }
    }

    /**
     * Merges all registered descriptors into the shared schema. Calling it again returns
     * the same schema.
     */
    public synchronized GraphSchema finalizeSchema() {
        if (schema == null) {
            schema = new SchemaBuilder(config).build(types.values());
            LOG.debugf("Finalized schema: %d type(s), %d extension column(s)", schema.types().size(), schema.columns().size());
        }
        return schema;
    }

    public synchronized boolean isFinalized() {
        return schema != null;
    }

    public synchronized Optional<GraphSchema> schema() {
        return Optional.ofNullable(schema);
    }

    public synchronized Optional<TypeDescriptor> descriptor(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public synchronized Optional<EntityBinding> bindingFor(Class<?> entityClass) {
        return Optional.ofNullable(bindings.get(entityClass));
    }

    public GraphConfig config() {
        return config;
    }

    private void requireOpen(String what) {
        if (schema != null) {
            throw new GraphConfigException("Cannot register " + what + ": the schema is already finalized");
        }
    }
}
