package io.lighting.beacon.columns;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One mapped column of a model.
 * <p>
 * Generates the identifier fragments a query layer needs: the bare name, the named placeholder
 * assignment used by updates, and the alias-qualified reference used by selects.
 */
public record Column(String name, String alias, boolean readable, boolean writeable, String selectExpression) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    public Column {
        Objects.requireNonNull(name, "name");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid column name: '" + name + "'");
        }
        if (alias != null && alias.isBlank()) {
            alias = null;
        }
        if (selectExpression != null && selectExpression.isBlank()) {
            selectExpression = null;
        }
    }

    public static Column of(String name) {
        return new Column(name, null, true, true, null);
    }

    public static Column of(String name, String alias) {
        return new Column(name, alias, true, true, null);
    }

    public Column withAlias(String alias) {
        return new Column(name, alias, readable, writeable, selectExpression);
    }

    /**
     * Named placeholder assignment, {@code name = :name}.
     */
    public String updateString() {
        return name + " = :" + name;
    }

    /**
     * {@code alias.name}, or the bare name when the column has no alias.
     */
    public String qualifiedName() {
        if (alias == null) {
            return name;
        }
        return alias + "." + name;
    }

    public String selectString() {
        if (selectExpression != null) {
            return selectExpression + " AS " + name;
        }
        return qualifiedName();
    }

    @Override
    public String toString() {
        return name;
    }
}
