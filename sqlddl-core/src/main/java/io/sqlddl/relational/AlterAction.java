/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.sqlddl.annotation.Immutable;

/**
 * One action of an {@code ALTER TABLE} statement. Each action knows how to apply itself to the editor of the table it
 * targets.
 */
@Immutable
public abstract class AlterAction {

    public enum Kind {
        ADD_COLUMN,
        ADD_CONSTRAINT,
        SET_DEFAULT,
        RENAME_COLUMN,
        DROP_COLUMN,
        DROP_CONSTRAINT,
        MODIFY_COLUMN
    }

    public abstract Kind kind();

    /**
     * Apply this action to the table being edited.
     *
     * @param editor the editor of the target table; may not be null
     * @throws IllegalArgumentException if the action names a column the table does not have
     */
    public abstract void applyTo(TableEditor editor);

    /**
     * {@code ADD [COLUMN] definition}.
     */
    public static final class AddColumn extends AlterAction {
        private final Column column;

        public AddColumn(Column column) {
            this.column = Objects.requireNonNull(column, "column");
        }

        public Column column() {
            return column;
        }

        @Override
        public Kind kind() {
            return Kind.ADD_COLUMN;
        }

        @Override
        public void applyTo(TableEditor editor) {
            if (editor.columnWithName(column.name()) != null) {
                editor.updateColumn(column);
            }
            else {
                editor.addColumn(column);
            }
        }

        @Override
        public String toString() {
            return "ADD COLUMN " + column;
        }
    }

    /**
     * {@code ADD [CONSTRAINT name] constraint}.
     */
    public static final class AddConstraint extends AlterAction {
        private final Constraint constraint;

        public AddConstraint(Constraint constraint) {
            this.constraint = Objects.requireNonNull(constraint, "constraint");
        }

        public Constraint constraint() {
            return constraint;
        }

        @Override
        public Kind kind() {
            return Kind.ADD_CONSTRAINT;
        }

        @Override
        public void applyTo(TableEditor editor) {
            editor.addConstraint(constraint);
        }

        @Override
        public String toString() {
            return "ADD " + constraint;
        }
    }

    /**
     * {@code ALTER [COLUMN] c SET DEFAULT v}, or SQL Server's {@code ADD [CONSTRAINT n] DEFAULT v FOR c}.
     */
    public static final class SetDefault extends AlterAction {
        private final String constraintName;
        private final List<String> columns;
        private final String value;

        public SetDefault(String constraintName, List<String> columns, String value) {
            this.constraintName = constraintName;
            this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
            this.value = value;
        }

        public String constraintName() {
            return constraintName;
        }

        public List<String> columns() {
            return columns;
        }

        public String value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.SET_DEFAULT;
        }

        @Override
        public void applyTo(TableEditor editor) {
            for (String name : columns) {
                Column existing = editor.columnWithName(name);
                if (existing == null) {
                    throw new IllegalArgumentException("No column with name '" + name + "'");
                }
                editor.updateColumn(existing.edit().defaultValueExpression(value).create());
            }
        }

        @Override
        public String toString() {
            return "SET DEFAULT " + value + " FOR " + columns;
        }
    }

    /**
     * {@code RENAME COLUMN a TO b}, or the renaming part of MySQL's {@code CHANGE a b type}.
     */
    public static final class RenameColumn extends AlterAction {
        private final String from;
        private final String to;

        public RenameColumn(String from, String to) {
            this.from = Objects.requireNonNull(from, "from");
            this.to = Objects.requireNonNull(to, "to");
        }

        public String from() {
            return from;
        }

        public String to() {
            return to;
        }

        @Override
        public Kind kind() {
            return Kind.RENAME_COLUMN;
        }

        @Override
        public void applyTo(TableEditor editor) {
            editor.renameColumn(from, to);
        }

        @Override
        public String toString() {
            return "RENAME COLUMN " + from + " TO " + to;
        }
    }

    /**
     * {@code DROP [COLUMN] [IF EXISTS] c}.
     */
    public static final class DropColumn extends AlterAction {
        private final String name;

        public DropColumn(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.DROP_COLUMN;
        }

        @Override
        public void applyTo(TableEditor editor) {
            editor.removeColumn(name);
        }

        @Override
        public String toString() {
            return "DROP COLUMN " + name;
        }
    }

    /**
     * {@code DROP CONSTRAINT [IF EXISTS] name}.
     */
    public static final class DropConstraint extends AlterAction {
        private final String name;

        public DropConstraint(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.DROP_CONSTRAINT;
        }

        @Override
        public void applyTo(TableEditor editor) {
            editor.removeConstraint(name);
        }

        @Override
        public String toString() {
            return "DROP CONSTRAINT " + name;
        }
    }

    /**
     * Changes the definition of an existing column: MySQL's {@code MODIFY [COLUMN] definition}, or
     * {@code ALTER [COLUMN] c [SET DATA] TYPE t} and {@code ALTER [COLUMN] c SET|DROP NOT NULL}.
     */
    public static final class ModifyColumn extends AlterAction {
        private final String columnName;
        private final Column definition;
        private final DataType dataType;
        private final Boolean optional;

        /**
         * Replace the whole definition of a column.
         *
         * @param definition the new definition; may not be null
         */
        public ModifyColumn(Column definition) {
            this(definition.name(), definition, definition.dataType(), null);
        }

        /**
         * Change the type or the nullability of a column.
         *
         * @param columnName the name of the column
         * @param dataType the new type, or null to keep the type
         * @param optional the new nullability, or null to keep it
         */
        public ModifyColumn(String columnName, DataType dataType, Boolean optional) {
            this(columnName, null, dataType, optional);
        }

        private ModifyColumn(String columnName, Column definition, DataType dataType, Boolean optional) {
            this.columnName = Objects.requireNonNull(columnName, "columnName");
            this.definition = definition;
            this.dataType = dataType;
            this.optional = optional;
        }

        public String columnName() {
            return columnName;
        }

        /**
         * @return the complete new definition, or null if only the type or nullability changes
         */
        public Column definition() {
            return definition;
        }

        public DataType dataType() {
            return dataType;
        }

        public Boolean optional() {
            return optional;
        }

        @Override
        public Kind kind() {
            return Kind.MODIFY_COLUMN;
        }

        @Override
        public void applyTo(TableEditor editor) {
            Column existing = editor.columnWithName(columnName);
            if (existing == null) {
                throw new IllegalArgumentException("No column with name '" + columnName + "'");
            }
            if (definition != null) {
                editor.updateColumn(definition);
                return;
            }
            ColumnEditor columnEditor = existing.edit();
            if (dataType != null) {
                columnEditor.dataType(dataType);
            }
            if (optional != null) {
                columnEditor.optional(optional);
            }
            editor.updateColumn(columnEditor.create());
        }

        @Override
        public String toString() {
            return "MODIFY COLUMN " + columnName + (dataType != null ? " " + dataType : "");
        }
    }
}
