package io.lighting.beacon.meta;

import io.lighting.beacon.NotARecordException;
import io.lighting.beacon.naming.Inflector;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ModelMetaRegistry deriving metadata from declared fields and annotations.
 * <p>
 * Every non-static, non-transient instance field is mapped, superclass fields first, unless it
 * carries {@link Ignore} or {@link Association}. A superclass field hidden by a subclass field of
 * the same name is left out. Fields marked {@link Embedded} contribute the
 * fields of their type instead of a column of their own.
 */
public final class ReflectionModelMetaRegistry implements ModelMetaRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReflectionModelMetaRegistry.class);

    private final ConcurrentMap<Class<?>, ModelMeta> cache = new ConcurrentHashMap<>();
    private final Inflector inflector;

    public ReflectionModelMetaRegistry() {
        this(Inflector.defaults());
    }

    public ReflectionModelMetaRegistry(Inflector inflector) {
        this.inflector = Objects.requireNonNull(inflector, "inflector");
    }

    @Override
    public ModelMeta metaOf(Class<?> modelType) {
        Objects.requireNonNull(modelType, "modelType");
        if (!isRecordType(modelType)) {
            throw new NotARecordException(modelType);
        }
        return cache.computeIfAbsent(modelType, this::buildMeta);
    }

    @Override
    public void register(ModelMeta meta) {
        Objects.requireNonNull(meta, "meta");
        cache.put(meta.type(), meta);
        LOGGER.debug("Registered model metadata for {}", meta.type().getName());
    }

    /**
     * Reads {@code @Table} directly unless metadata for the type is already known, so that a
     * table name resolves even when the column mapping of the type is invalid.
     */
    @Override
    public Optional<String> declaredTable(Class<?> modelType) {
        Objects.requireNonNull(modelType, "modelType");
        ModelMeta meta = cache.get(modelType);
        if (meta != null) {
            return meta.table();
        }
        if (!isRecordType(modelType)) {
            return Optional.empty();
        }
        Table table = modelType.getAnnotation(Table.class);
        if (table == null || table.name().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(table.name());
    }

    /**
     * Whether values of {@code type} can be introspected as records. Primitives, arrays, enums,
     * interfaces and JDK types cannot.
     */
    public static boolean isRecordType(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isInterface()) {
            return false;
        }
        String name = type.getName();
        return !name.startsWith("java.") && !name.startsWith("javax.") && !name.startsWith("jdk.");
    }

    private ModelMeta buildMeta(Class<?> modelType) {
        ModelMeta.Builder builder = ModelMeta.builder(modelType);
        Table table = modelType.getAnnotation(Table.class);
        if (table != null) {
            builder.table(table.name());
        }
        collectFields(modelType, builder, new ArrayList<>(), "", new HashSet<>());
        ModelMeta meta = builder.build();
        LOGGER.debug(
            "Built model metadata for {}: table={}, columns={}, id={}",
            modelType.getName(),
            meta.table().orElse("<convention>"),
            meta.fields().size(),
            meta.idMeta().map(IdMeta::columnName).orElse("<none>")
        );
        return meta;
    }

    private void collectFields(
        Class<?> type,
        ModelMeta.Builder builder,
        List<Field> holders,
        String prefix,
        Set<Class<?>> visiting
    ) {
        if (!visiting.add(type)) {
            throw new IllegalArgumentException("Cyclic @Embedded reference through " + type.getName());
        }
        List<Class<?>> types = hierarchy(type);
        for (int level = 0; level < types.size(); level++) {
            Class<?> current = types.get(level);
            Set<String> hidden = instanceFieldNames(types.subList(level + 1, types.size()));
            for (Field field : current.getDeclaredFields()) {
                if (!isInstanceField(field)) {
                    continue;
                }
                if (hidden.contains(field.getName())) {
                    LOGGER.debug("Field {}.{} is hidden by a subclass field", current.getName(), field.getName());
                    continue;
                }
                int modifiers = field.getModifiers();
                String fieldName = prefix + field.getName();
                boolean skipped = Modifier.isTransient(modifiers)
                    || field.isAnnotationPresent(Ignore.class)
                    || field.isAnnotationPresent(Association.class);

                if (field.isAnnotationPresent(Embedded.class) && !skipped) {
                    if (field.getType().isAnnotationPresent(Association.class)) {
                        continue;
                    }
                    List<Field> nested = new ArrayList<>(holders);
                    nested.add(field);
                    collectFields(field.getType(), builder, nested, fieldName + ".", visiting);
                    continue;
                }

                FieldAccessor accessor = holders.isEmpty()
                    ? FieldAccessors.direct(field)
                    : FieldAccessors.path(holders, field);
                if (skipped) {
                    if (holders.isEmpty()) {
                        builder.field(FieldMeta.property(fieldName, field.getType(), accessor));
                    }
                    continue;
                }
                builder.field(toFieldMeta(fieldName, field, accessor));

                Id id = field.getAnnotation(Id.class);
                if (id != null && holders.isEmpty()) {
                    builder.id(fieldName, !"true".equals(id.noAutoIncrement()));
                }
            }
        }
        visiting.remove(type);
    }

    private FieldMeta toFieldMeta(String fieldName, Field field, FieldAccessor accessor) {
        Column column = field.getAnnotation(Column.class);
        String columnName = column != null && !column.name().isBlank()
            ? column.name()
            : inflector.underscore(field.getName());
        if (columnName.isBlank()) {
            throw new IllegalArgumentException(
                "Column name must not be blank: " + field.getDeclaringClass().getName() + "." + field.getName()
            );
        }
        boolean readable = column == null || column.readable();
        boolean writeable = column == null || column.writeable();
        String select = column != null && !column.select().isBlank() ? column.select() : null;
        return new FieldMeta(fieldName, columnName, field.getType(), true, readable, writeable, select, accessor);
    }

    private static boolean isInstanceField(Field field) {
        return !Modifier.isStatic(field.getModifiers()) && !field.isSynthetic();
    }

    private static Set<String> instanceFieldNames(List<Class<?>> types) {
        Set<String> names = new HashSet<>();
        for (Class<?> type : types) {
            for (Field field : type.getDeclaredFields()) {
                if (isInstanceField(field)) {
                    names.add(field.getName());
                }
            }
        }
        return names;
    }

    private static List<Class<?>> hierarchy(Class<?> type) {
        Deque<Class<?>> types = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            types.addFirst(current);
        }
        return new ArrayList<>(types);
    }
}
