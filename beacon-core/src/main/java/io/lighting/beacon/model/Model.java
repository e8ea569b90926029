package io.lighting.beacon.model;

import io.lighting.beacon.MissingFieldException;
import io.lighting.beacon.ModelException;
import io.lighting.beacon.NotARecordException;
import io.lighting.beacon.columns.Column;
import io.lighting.beacon.columns.ColumnSet;
import io.lighting.beacon.columns.IdField;
import io.lighting.beacon.id.IdGenerator;
import io.lighting.beacon.meta.FieldMeta;
import io.lighting.beacon.meta.IdMeta;
import io.lighting.beacon.meta.ModelMeta;
import io.lighting.beacon.meta.PrimaryKeyKind;
import io.lighting.beacon.meta.ReflectionModelMetaRegistry;
import java.lang.reflect.Array;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Wraps the value handed to a persistence operation: one record, a collection of records, or a
 * plain table name.
 * <p>
 * Resolves the table name, the columns and the primary key of the wrapped type, and applies the
 * audit and key mutations persistence code needs before a write. Mutations change the wrapped
 * objects in place, so a model must not be shared between threads while it is being written.
 */
public final class Model {
    private final Object value;
    private final ModelContext context;
    private final String as;
    private final ModelConfig config;
    private final Class<?> elementType;

    private Model(Object value, ModelContext context, String as, ModelConfig config, Class<?> elementType) {
        this.value = Objects.requireNonNull(value, "value");
        this.context = context;
        this.as = as == null || as.isBlank() ? null : as;
        this.config = Objects.requireNonNull(config, "config");
        this.elementType = elementType;
    }

    public static Model of(Object value) {
        return new Model(value, null, null, ModelConfig.defaults(), null);
    }

    public static Model of(Object value, ModelContext context) {
        return new Model(value, context, null, ModelConfig.defaults(), null);
    }

    /**
     * Model over a collection whose element type is known up front, so that table name and
     * columns resolve even when the collection is empty.
     */
    public static <T> Model ofCollection(Class<T> elementType, Collection<? extends T> values) {
        Objects.requireNonNull(elementType, "elementType");
        return new Model(values, null, null, ModelConfig.defaults(), elementType);
    }

    public Model as(String alias) {
        return new Model(value, context, alias, config, elementType);
    }

    public Model withContext(ModelContext context) {
        return new Model(value, context, as, config, elementType);
    }

    public Model withConfig(ModelConfig config) {
        return new Model(value, context, as, config, elementType);
    }

    public Object value() {
        return value;
    }

    /**
     * The context given at construction, or {@link ModelContext#background()}.
     */
    public ModelContext context() {
        return context != null ? context : ModelContext.background();
    }

    public Optional<String> as() {
        return Optional.ofNullable(as);
    }

    public ModelConfig config() {
        return config;
    }

    public boolean isCollection() {
        return value.getClass().isArray() || value instanceof Iterable<?>;
    }

    public int size() {
        if (value.getClass().isArray()) {
            return Array.getLength(value);
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Iterable<?> iterable) {
            int count = 0;
            for (Iterator<?> it = iterable.iterator(); it.hasNext(); it.next()) {
                count++;
            }
            return count;
        }
        return 1;
    }

    /**
     * The record type: the wrapped value's class, or the element type of a collection. Empty for a
     * collection whose element type cannot be determined.
     */
    public Optional<Class<?>> modelType() {
        if (!isCollection()) {
            return Optional.of(value.getClass());
        }
        if (elementType != null) {
            return Optional.of(elementType);
        }
        if (value.getClass().isArray()) {
            return Optional.of(value.getClass().getComponentType());
        }
        return Optional.ofNullable(firstElement()).map(Object::getClass);
    }

    public String tableName() {
        return resolveTableName().name();
    }

    public ResolvedTableName resolveTableName() {
        if (value instanceof String literal) {
            return new ResolvedTableName(literal, TableNameSource.LITERAL);
        }
        Class<?> type = modelType().orElseThrow(
            () -> new ModelException("Cannot resolve the element type of an empty collection; use Model.ofCollection")
        );
        Object instance = isCollection() ? firstElement() : value;
        if (instance != null && !type.isInstance(instance)) {
            instance = null;
        }
        return config.tableNameResolver().resolve(type, instance, context());
    }

    /**
     * Table alias: the explicit alias, otherwise the table name with dots replaced by underscores.
     */
    public String alias() {
        if (as != null) {
            return as;
        }
        return tableName().replace('.', '_');
    }

    public String whereId() {
        return alias() + "." + idField() + " = ?";
    }

    public String whereNamedId() {
        String idField = idField();
        return alias() + "." + idField + " = :" + idField;
    }

    /**
     * Foreign key column other tables use to reference this one, {@code user_id} for {@code users}.
     */
    public String associationName() {
        return config.inflector().singularize(tableName()) + "_id";
    }

    public ColumnSet columns() {
        IdField idField = new IdField(idField(), !usingAutoIncrement());
        Optional<ModelMeta> meta = findMeta();
        if (meta.isEmpty()) {
            return ColumnSet.builder(tableName()).alias(as).idField(idField).build();
        }
        return ColumnSet.forModel(meta.get(), tableName(), as, idField);
    }

    /**
     * Current primary key value. UUID keys are returned in their canonical string form.
     *
     * @throws MissingFieldException if the type has no key field
     * @throws NotARecordException   if the model wraps a table name or a non-record value
     */
    public Object id() {
        requireSingle("id");
        IdMeta idMeta = requireId();
        return idMeta.kind().format(idMeta.field().read(value));
    }

    /**
     * Column name of the primary key, {@code "id"} when no key field can be found.
     */
    public String idField() {
        return findMeta()
            .flatMap(ModelMeta::idMeta)
            .map(IdMeta::columnName)
            .orElse(IdField.DEFAULT_NAME);
    }

    /**
     * Simple name of the declared key type, for example {@code long} or {@code UUID}.
     */
    public String primaryKeyType() {
        return requireId().javaType().getSimpleName();
    }

    public PrimaryKeyKind primaryKeyKind() {
        return requireId().kind();
    }

    /**
     * Whether the database generates keys for this type. Only {@code @Id(noAutoIncrement = "true")}
     * turns this off.
     */
    public boolean usingAutoIncrement() {
        return findMeta()
            .flatMap(ModelMeta::idMeta)
            .map(IdMeta::autoIncrement)
            .orElse(true);
    }

    /**
     * Sets {@code createdAt} to the clock's current time if it is still unset.
     */
    public void touchCreatedAt() {
        touchCreatedAt(clock().instant());
    }

    /**
     * Sets {@code createdAt} to {@code now} if it still holds its zero value. Does nothing when the
     * type has no such field.
     */
    public void touchCreatedAt(Instant now) {
        Objects.requireNonNull(now, "now");
        if (isCollection()) {
            forEachElement(child -> child.touchCreatedAt(now));
            return;
        }
        findMeta().flatMap(ModelMeta::createdAt).ifPresent(field -> {
            if (Timestamps.isZero(field.read(value))) {
                field.write(value, Timestamps.convert(now, clock().getZone(), field));
            }
        });
    }

    public void touchUpdatedAt() {
        touchUpdatedAt(clock().instant());
    }

    /**
     * Sets {@code updatedAt} to {@code now}, whatever it held before. Does nothing when the type
     * has no such field.
     */
    public void touchUpdatedAt(Instant now) {
        Objects.requireNonNull(now, "now");
        if (isCollection()) {
            forEachElement(child -> child.touchUpdatedAt(now));
            return;
        }
        findMeta().flatMap(ModelMeta::updatedAt).ifPresent(
            field -> field.write(value, Timestamps.convert(now, clock().getZone(), field))
        );
    }

    /**
     * Writes {@code id} into the key field, converted to the field's kind. Does nothing when the
     * type has no key field.
     */
    public void assignId(Object id) {
        requireSingle("assignId");
        findMeta().flatMap(ModelMeta::idMeta).ifPresent(idMeta -> writeId(idMeta, id));
    }

    /**
     * Fills an empty caller-side key from the configured generator. Database generated numeric
     * keys are left alone.
     *
     * @return whether a key was assigned; for collections, whether any element received one
     */
    public boolean assignGeneratedId() {
        if (isCollection()) {
            boolean[] assigned = {false};
            forEachElement(child -> assigned[0] |= child.assignGeneratedId());
            return assigned[0];
        }
        Optional<IdMeta> found = findMeta().flatMap(ModelMeta::idMeta);
        if (found.isEmpty()) {
            return false;
        }
        IdMeta idMeta = found.get();
        PrimaryKeyKind kind = idMeta.kind();
        if (idMeta.autoIncrement() && kind.isNumeric()) {
            return false;
        }
        if (!kind.isEmpty(idMeta.field().read(value))) {
            return false;
        }
        IdGenerator<?> generator = config.idGeneratorProvider().generator(kind);
        if (generator == null) {
            return false;
        }
        writeId(idMeta, generator.nextId());
        return true;
    }

    /**
     * Current value of every mapped column, in column order.
     */
    public Map<String, Object> values() {
        requireSingle("values");
        Map<String, Object> values = new LinkedHashMap<>();
        findMeta().ifPresent(meta -> {
            for (FieldMeta field : meta.fields()) {
                values.put(field.columnName(), field.read(value));
            }
        });
        return values;
    }

    public Object valueOf(Column column) {
        return valueOf(Objects.requireNonNull(column, "column").name());
    }

    public Object valueOf(String columnName) {
        Objects.requireNonNull(columnName, "columnName");
        requireSingle("valueOf");
        ModelMeta meta = requireMeta();
        for (FieldMeta field : meta.fields()) {
            if (field.columnName().equals(columnName)) {
                return field.read(value);
            }
        }
        throw new MissingFieldException(meta.type(), columnName);
    }

    /**
     * Runs {@code visitor} once per element of a collection, in order, each element wrapped in a
     * new model sharing this model's context and no alias. A single record is visited once as
     * this model. The first exception stops the iteration and is rethrown as is.
     */
    public <E extends Exception> void forEach(ModelVisitor<E> visitor) throws E {
        Objects.requireNonNull(visitor, "visitor");
        if (!isCollection()) {
            visitor.visit(this);
            return;
        }
        int index = 0;
        for (Object element : elements()) {
            if (element == null) {
                throw new ModelException("Collection element " + index + " is null");
            }
            visitor.visit(new Model(element, context, null, config, null));
            index++;
        }
    }

    private void forEachElement(ModelVisitor<RuntimeException> visitor) {
        forEach(visitor);
    }

    private void writeId(IdMeta idMeta, Object id) {
        idMeta.field().write(value, idMeta.kind().coerce(id, idMeta.javaType()));
    }

    private Clock clock() {
        return config.clock();
    }

    private Optional<ModelMeta> findMeta() {
        if (value instanceof String) {
            return Optional.empty();
        }
        return modelType()
            .filter(ReflectionModelMetaRegistry::isRecordType)
            .map(type -> config.metaRegistry().metaOf(type));
    }

    private ModelMeta requireMeta() {
        Class<?> type = modelType().orElseThrow(
            () -> new ModelException("Cannot resolve the element type of an empty collection; use Model.ofCollection")
        );
        if (value instanceof String || !ReflectionModelMetaRegistry.isRecordType(type)) {
            throw new NotARecordException(type);
        }
        return config.metaRegistry().metaOf(type);
    }

    private IdMeta requireId() {
        ModelMeta meta = requireMeta();
        return meta.idMeta().orElseThrow(() -> new MissingFieldException(meta.type(), ModelMeta.ID_FIELD));
    }

    private void requireSingle(String operation) {
        if (isCollection()) {
            throw new ModelException(operation + " is not supported on a collection model; use forEach");
        }
    }

    private Object firstElement() {
        for (Object element : elements()) {
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    private Iterable<?> elements() {
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return (Iterable<?>) value;
    }

    @Override
    public String toString() {
        return "Model[" + modelType().map(Class::getName).orElse("?") + (as != null ? " as " + as : "") + "]";
    }
}
