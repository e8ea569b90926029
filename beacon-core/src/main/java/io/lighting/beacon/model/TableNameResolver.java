package io.lighting.beacon.model;

import io.lighting.beacon.ModelException;
import io.lighting.beacon.meta.ModelMetaRegistry;
import io.lighting.beacon.meta.ReflectionModelMetaRegistry;
import io.lighting.beacon.naming.Inflector;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the table name of a model type.
 * <p>
 * Precedence: {@link HasTableName}, {@link HasContextualTableName},
 * {@link io.lighting.beacon.meta.Table}, then the tableized simple name. Only results whose
 * {@link TableNameSource#cacheable()} is true are kept per type.
 */
public final class TableNameResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TableNameResolver.class);

    private final ConcurrentMap<Class<?>, ResolvedTableName> cache = new ConcurrentHashMap<>();
    private final ModelMetaRegistry metaRegistry;
    private final Inflector inflector;

    public TableNameResolver(ModelMetaRegistry metaRegistry, Inflector inflector) {
        this.metaRegistry = Objects.requireNonNull(metaRegistry, "metaRegistry");
        this.inflector = Objects.requireNonNull(inflector, "inflector");
    }

    /**
     * @param type     model type, the element type for collections
     * @param instance an instance to ask for its name, or {@code null} to create one when a
     *                 capability has to be invoked
     * @param context  context handed to {@link HasContextualTableName}
     */
    public ResolvedTableName resolve(Class<?> type, Object instance, ModelContext context) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(context, "context");
        ResolvedTableName cached = cache.get(type);
        if (cached != null) {
            return cached;
        }
        ResolvedTableName resolved = compute(type, instance, context);
        if (resolved.source().cacheable()) {
            ResolvedTableName previous = cache.putIfAbsent(type, resolved);
            if (previous != null) {
                return previous;
            }
            LOGGER.debug("Resolved table {} for {} from {}", resolved.name(), type.getName(), resolved.source());
        }
        return resolved;
    }

    private ResolvedTableName compute(Class<?> type, Object instance, ModelContext context) {
        if (HasTableName.class.isAssignableFrom(type)) {
            HasTableName named = (HasTableName) instanceOf(type, instance);
            return new ResolvedTableName(named.tableName(), TableNameSource.STATIC);
        }
        if (HasContextualTableName.class.isAssignableFrom(type)) {
            HasContextualTableName named = (HasContextualTableName) instanceOf(type, instance);
            return new ResolvedTableName(named.tableName(context), TableNameSource.CONTEXTUAL);
        }
        Optional<String> declared = ReflectionModelMetaRegistry.isRecordType(type)
            ? metaRegistry.declaredTable(type)
            : Optional.empty();
        if (declared.isPresent()) {
            return new ResolvedTableName(declared.get(), TableNameSource.ANNOTATION);
        }
        return new ResolvedTableName(inflector.tableize(type.getSimpleName()), TableNameSource.CONVENTION);
    }

    private static Object instanceOf(Class<?> type, Object instance) {
        if (instance != null) {
            return instance;
        }
        try {
            var constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException ex) {
            throw new ModelException("Cannot instantiate " + type.getName() + " to resolve its table name", ex);
        }
    }
}
