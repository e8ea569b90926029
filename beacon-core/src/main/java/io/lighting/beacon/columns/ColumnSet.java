package io.lighting.beacon.columns;

import io.lighting.beacon.meta.FieldMeta;
import io.lighting.beacon.meta.ModelMeta;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Ordered, duplicate-free set of the columns a model maps to.
 * <p>
 * Instances are immutable. Column order is field declaration order, superclass fields first.
 * Every column is qualified with the table alias when one is given, otherwise with the table
 * name itself.
 */
public final class ColumnSet {
    private final String tableName;
    private final String tableAlias;
    private final IdField idField;
    private final Map<String, Column> columns;

    private ColumnSet(String tableName, String tableAlias, IdField idField, Map<String, Column> columns) {
        this.tableName = tableName;
        this.tableAlias = tableAlias;
        this.idField = idField;
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static Builder builder(String tableName) {
        return new Builder(tableName);
    }

    /**
     * Builds the column set for a model type from its metadata.
     */
    public static ColumnSet forModel(ModelMeta meta, String tableName, String tableAlias, IdField idField) {
        Objects.requireNonNull(meta, "meta");
        Builder builder = builder(tableName).alias(tableAlias).idField(idField);
        for (FieldMeta field : meta.fields()) {
            builder.add(field.columnName(), field.readable(), field.writeable(), field.selectExpression());
        }
        return builder.build();
    }

    public String tableName() {
        return tableName;
    }

    public String tableAlias() {
        return tableAlias;
    }

    public IdField idField() {
        return idField;
    }

    public List<Column> columns() {
        return List.copyOf(columns.values());
    }

    public List<String> names() {
        return List.copyOf(columns.keySet());
    }

    public Optional<Column> get(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public boolean contains(String name) {
        return columns.containsKey(name);
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Columns that may appear in an INSERT or UPDATE. A primary key that the database generates is left out.
     */
    public ColumnSet writeable() {
        return filter(column -> column.writeable() && !isGeneratedKey(column));
    }

    public ColumnSet readable() {
        return filter(Column::readable);
    }

    public ColumnSet without(String... names) {
        Set<String> excluded = Set.copyOf(Arrays.asList(names));
        return filter(column -> !excluded.contains(column.name()));
    }

    public ColumnSet only(String... names) {
        Set<String> included = Set.copyOf(Arrays.asList(names));
        return filter(column -> included.contains(column.name()));
    }

    /**
     * {@code a, b, c}
     */
    public String string() {
        return join(Column::name);
    }

    /**
     * {@code :a, :b, :c}
     */
    public String symbolizedString() {
        return join(column -> ":" + column.name());
    }

    /**
     * {@code a = :a, b = :b}
     */
    public String updateString() {
        return join(Column::updateString);
    }

    public String selectString() {
        return join(Column::selectString);
    }

    public String quotedString(UnaryOperator<String> quoter) {
        Objects.requireNonNull(quoter, "quoter");
        return join(column -> quoter.apply(column.name()));
    }

    public String quotedUpdateString(UnaryOperator<String> quoter) {
        Objects.requireNonNull(quoter, "quoter");
        return join(column -> quoter.apply(column.name()) + " = :" + column.name());
    }

    private boolean isGeneratedKey(Column column) {
        return idField != null && !idField.writeable() && idField.name().equals(column.name());
    }

    private ColumnSet filter(Predicate<Column> predicate) {
        Map<String, Column> filtered = new LinkedHashMap<>();
        for (Column column : columns.values()) {
            if (predicate.test(column)) {
                filtered.put(column.name(), column);
            }
        }
        return new ColumnSet(tableName, tableAlias, idField, filtered);
    }

    private String join(Function<Column, String> fragment) {
        return columns.values().stream().map(fragment).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return string();
    }

    public static final class Builder {
        private final String tableName;
        private String tableAlias;
        private IdField idField;
        private final List<Column> columns = new ArrayList<>();

        private Builder(String tableName) {
            this.tableName = Objects.requireNonNull(tableName, "tableName");
        }

        public Builder alias(String tableAlias) {
            this.tableAlias = tableAlias == null || tableAlias.isBlank() ? null : tableAlias;
            return this;
        }

        public Builder idField(IdField idField) {
            this.idField = idField;
            return this;
        }

        public Builder add(String... names) {
            for (String name : names) {
                add(name, true, true, null);
            }
            return this;
        }

        public Builder add(String name, boolean readable, boolean writeable, String selectExpression) {
            columns.add(new Column(name, null, readable, writeable, selectExpression));
            return this;
        }

        public ColumnSet build() {
            String qualifier = tableAlias != null ? tableAlias : tableName;
            Map<String, Column> byName = new LinkedHashMap<>();
            for (Column column : columns) {
                Column previous = byName.putIfAbsent(column.name(), column.withAlias(qualifier));
                if (previous != null) {
                    throw new IllegalArgumentException("Duplicate column: " + column.name() + " in " + tableName);
                }
            }
            return new ColumnSet(tableName, tableAlias, idField, byName);
        }
    }
}
