package io.lighting.beacon.meta;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-type mapping metadata: declared table, mapped columns, primary key and audit fields.
 * <p>
 * Built once per type, either from annotations by {@link ReflectionModelMetaRegistry} or
 * explicitly through {@link #builder(Class)} and {@link ModelMetaRegistry#register(ModelMeta)}.
 */
public final class ModelMeta {
    public static final String ID_FIELD = "id";
    public static final String CREATED_AT_FIELD = "createdAt";
    public static final String UPDATED_AT_FIELD = "updatedAt";

    private final Class<?> type;
    private final String table;
    private final Map<String, FieldMeta> properties;
    private final List<FieldMeta> fields;
    private final IdMeta idMeta;
    private final FieldMeta createdAt;
    private final FieldMeta updatedAt;

    private ModelMeta(Builder builder) {
        this.type = builder.type;
        this.table = builder.table;
        this.properties = Map.copyOf(builder.properties);
        List<FieldMeta> persistent = new ArrayList<>();
        for (FieldMeta field : builder.properties.values()) {
            if (field.persistent()) {
                persistent.add(field);
            }
        }
        this.fields = List.copyOf(persistent);
        this.idMeta = resolveId(builder);
        this.createdAt = properties.get(builder.createdAtField);
        this.updatedAt = properties.get(builder.updatedAtField);
    }

    public static Builder builder(Class<?> type) {
        return new Builder(type);
    }

    public Class<?> type() {
        return type;
    }

    /**
     * Table declared for the type, empty when the name is left to convention.
     */
    public Optional<String> table() {
        return Optional.ofNullable(table);
    }

    /**
     * Mapped columns in declaration order.
     */
    public List<FieldMeta> fields() {
        return fields;
    }

    public Optional<FieldMeta> property(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName");
        return Optional.ofNullable(properties.get(fieldName));
    }

    public Optional<IdMeta> idMeta() {
        return Optional.ofNullable(idMeta);
    }

    public Optional<FieldMeta> createdAt() {
        return Optional.ofNullable(createdAt);
    }

    public Optional<FieldMeta> updatedAt() {
        return Optional.ofNullable(updatedAt);
    }

    public String columnForField(String fieldName) {
        FieldMeta field = properties.get(Objects.requireNonNull(fieldName, "fieldName"));
        if (field == null || !field.persistent()) {
            throw new IllegalArgumentException("Unknown field: " + fieldName);
        }
        return field.columnName();
    }

    private IdMeta resolveId(Builder builder) {
        String idField = builder.idField != null ? builder.idField : ID_FIELD;
        FieldMeta field = properties.get(idField);
        if (field == null) {
            if (builder.idField != null) {
                throw new IllegalArgumentException("Unknown id field " + idField + " on " + type.getName());
            }
            return null;
        }
        return IdMeta.of(field, builder.autoIncrement);
    }

    public static final class Builder {
        private final Class<?> type;
        private String table;
        private final Map<String, FieldMeta> properties = new LinkedHashMap<>();
        private final Map<String, String> columnOwners = new LinkedHashMap<>();
        private String idField;
        private boolean autoIncrement = true;
        private String createdAtField = CREATED_AT_FIELD;
        private String updatedAtField = UPDATED_AT_FIELD;

        private Builder(Class<?> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder table(String table) {
            if (table != null && table.isBlank()) {
                throw new IllegalArgumentException("Table name must not be blank: " + type.getName());
            }
            this.table = table;
            return this;
        }

        public Builder field(FieldMeta field) {
            Objects.requireNonNull(field, "field");
            if (properties.containsKey(field.fieldName())) {
                throw new IllegalArgumentException("Duplicate field mapping: " + field.fieldName());
            }
            if (field.persistent()) {
                String owner = columnOwners.putIfAbsent(field.columnName(), field.fieldName());
                if (owner != null) {
                    throw new IllegalArgumentException(
                        "Duplicate column mapping: " + field.columnName() + " on " + type.getName()
                    );
                }
            }
            properties.put(field.fieldName(), field);
            return this;
        }

        public Builder id(String fieldName, boolean autoIncrement) {
            Objects.requireNonNull(fieldName, "fieldName");
            if (idField != null && !idField.equals(fieldName)) {
                throw new IllegalArgumentException("Multiple id fields in " + type.getName());
            }
            this.idField = fieldName;
            this.autoIncrement = autoIncrement;
            return this;
        }

        public Builder createdAt(String fieldName) {
            this.createdAtField = Objects.requireNonNull(fieldName, "fieldName");
            return this;
        }

        public Builder updatedAt(String fieldName) {
            this.updatedAtField = Objects.requireNonNull(fieldName, "fieldName");
            return this;
        }

        public ModelMeta build() {
            return new ModelMeta(this);
        }
    }
}
