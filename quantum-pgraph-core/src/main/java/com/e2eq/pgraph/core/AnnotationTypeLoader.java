package com.e2eq.pgraph.core;

import com.e2eq.pgraph.annotations.NodeField;
import com.e2eq.pgraph.annotations.NodeType;
import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphEntity;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives node types from {@link GraphEntity} subclasses by reflection.
 * <p>
 * Every non-static, non-transient field declared below {@link GraphEntity} is either a
 * literal column (its Java type maps to a {@link FieldType}) or a reference (a
 * {@code GraphEntity} subtype, or an array or collection of one). Concrete entity types
 * reached through references are bound as well.
 * </p>
 */
public final class AnnotationTypeLoader {

    private static final Logger LOG = Logger.getLogger(AnnotationTypeLoader.class);

    /**
     * Binds {@code root} and every concrete entity class reachable through its references,
     * root first.
     */
    public List<EntityBinding> load(Class<? extends GraphEntity> root) {
        Map<Class<?>, EntityBinding> out = new LinkedHashMap<>();
        Deque<Class<? extends GraphEntity>> work = new ArrayDeque<>();
        work.add(root);
        while (!work.isEmpty()) {
            Class<? extends GraphEntity> cls = work.poll();
            if (out.containsKey(cls)) continue;
            EntityBinding binding = bind(cls);
            out.put(cls, binding);
            for (EntityBinding.ReferenceBinding ref : binding.references()) {
                Class<?> target = ref.targetType;
                if (isConcreteEntity(target) && !out.containsKey(target)) {
                    work.add(target.asSubclass(GraphEntity.class));
                }
            }
        }
        return new ArrayList<>(out.values());
    }

    public EntityBinding bind(Class<? extends GraphEntity> cls) {
        if (!isConcreteEntity(cls)) {
            throw new GraphConfigException("Cannot bind " + cls.getName() + ": not a concrete GraphEntity subclass");
        }
        String otype = otypeOf(cls);
        List<EntityBinding.LiteralBinding> literals = new ArrayList<>();
        List<EntityBinding.ReferenceBinding> references = new ArrayList<>();
        MethodHandles.Lookup lookup = MethodHandles.lookup();
        for (Field f : declaredFields(cls)) {
            int mod = f.getModifiers();
            if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) continue;
            NodeField nf = f.getAnnotation(NodeField.class);
            String name = nf != null && !nf.id().isEmpty() ? nf.id() : f.getName();
            MethodHandle mh = getter(lookup, f, otype);
            Class<?> target = referenceTarget(f);
            if (target != null) {
                boolean collection = Collection.class.isAssignableFrom(f.getType()) || f.getType().isArray();
                references.add(new EntityBinding.ReferenceBinding(name, collection, target, mh));
                continue;
            }
            FieldType type = literalType(f, nf, otype, name);
            literals.add(new EntityBinding.LiteralBinding(name, type, mh));
        }
        LOG.debugf("Bound %s as '%s': %d literal field(s), %d reference(s)", cls.getName(), otype, literals.size(), references.size());
        return new EntityBinding(cls, otype, literals, references);
    }

    public static String otypeOf(Class<?> cls) {
        NodeType nt = cls.getAnnotation(NodeType.class);
        if (nt != null && !nt.id().isEmpty()) return nt.id();
        return cls.getSimpleName();
    }

    static boolean isConcreteEntity(Class<?> cls) {
        return cls != GraphEntity.class
                && GraphEntity.class.isAssignableFrom(cls)
                && !cls.isInterface()
                && !Modifier.isAbstract(cls.getModifiers());
    }

    // Superclass fields first so column order follows the class hierarchy.
    private static List<Field> declaredFields(Class<?> cls) {
        Deque<Class<?>> chain = new ArrayDeque<>();
        for (Class<?> c = cls; c != null && c != GraphEntity.class && c != Object.class; c = c.getSuperclass()) {
            chain.push(c);
        }
        List<Field> out = new ArrayList<>();
        for (Class<?> c : chain) {
            for (Field f : c.getDeclaredFields()) out.add(f);
        }
        return out;
    }

    private static MethodHandle getter(MethodHandles.Lookup lookup, Field f, String otype) {
        try {
            f.setAccessible(true);
            return lookup.unreflectGetter(f);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new GraphConfigException(otype, f.getName(), "Cannot access field '" + f.getName() + "' of " + f.getDeclaringClass().getName());
        }
    }

    private static Class<?> referenceTarget(Field f) {
        Class<?> raw = f.getType();
        if (GraphEntity.class.isAssignableFrom(raw)) return raw;
        if (raw.isArray() && GraphEntity.class.isAssignableFrom(raw.getComponentType())) return raw.getComponentType();
        if (Collection.class.isAssignableFrom(raw) && f.getGenericType() instanceof ParameterizedType pt) {
            Type[] args = pt.getActualTypeArguments();
            if (args.length == 1) {
                Class<?> element = erase(args[0]);
                if (element != null && GraphEntity.class.isAssignableFrom(element)) return element;
            }
        }
        return null;
    }

    private static Class<?> erase(Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> c) return c;
        if (t instanceof WildcardType wt && wt.getUpperBounds().length == 1) return erase(wt.getUpperBounds()[0]);
        return null;
    }

    private static FieldType literalType(Field f, NodeField nf, String otype, String name) {
        if (nf != null && !nf.type().isEmpty()) {
            try {
                return FieldType.valueOf(nf.type().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new GraphConfigException(otype, name, "Unknown field type '" + nf.type() + "' on field '" + name + "'");
            }
        }
        return FieldType.forJavaType(f.getType(), f.getGenericType())
                .orElseThrow(() -> new GraphConfigException(otype, name,
                        "Field '" + name + "' of type '" + otype + "' has unsupported Java type " + f.getGenericType().getTypeName()));
    }
}
