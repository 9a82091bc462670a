/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.Objects;

final class ColumnImpl implements Column {
    private final String name;
    private final int position;
    private final DataType dataType;
    private final boolean optional;
    private final boolean primaryKey;
    private final String defaultValueExpression;
    private final String checkExpression;
    private final boolean unique;
    private final ForeignKeyReference references;
    private final boolean autoIncremented;
    private final String generatedAs;
    private final String comment;
    private final String collation;
    private final String charsetName;
    private final String onUpdate;

    ColumnImpl(ColumnEditorImpl editor) {
        this.name = editor.name();
        this.position = editor.position();
        this.dataType = editor.dataType();
        this.primaryKey = editor.isPrimaryKey();
        this.optional = editor.isOptional() && !primaryKey;
        this.defaultValueExpression = editor.defaultValueExpression();
        this.checkExpression = editor.checkExpression();
        this.unique = editor.isUnique();
        this.references = editor.references();
        this.autoIncremented = editor.isAutoIncremented();
        this.generatedAs = editor.generatedAs();
        this.comment = editor.comment();
        this.collation = editor.collation();
        this.charsetName = editor.charsetName();
        this.onUpdate = editor.onUpdate();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int position() {
        return position;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    @Override
    public boolean isPrimaryKey() {
        return primaryKey;
    }

    @Override
    public String defaultValueExpression() {
        return defaultValueExpression;
    }

    @Override
    public String checkExpression() {
        return checkExpression;
    }

    @Override
    public boolean isUnique() {
        return unique;
    }

    @Override
    public ForeignKeyReference references() {
        return references;
    }

    @Override
    public boolean isAutoIncremented() {
        return autoIncremented;
    }

    @Override
    public String generatedAs() {
        return generatedAs;
    }

    @Override
    public String comment() {
        return comment;
    }

    @Override
    public String collation() {
        return collation;
    }

    @Override
    public String charsetName() {
        return charsetName;
    }

    @Override
    public String onUpdate() {
        return onUpdate;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Column) {
            Column that = (Column) obj;
            return this.name().equalsIgnoreCase(that.name())
                    && this.position() == that.position()
                    && this.dataType().equals(that.dataType())
                    && this.isOptional() == that.isOptional()
                    && this.isPrimaryKey() == that.isPrimaryKey()
                    && this.isUnique() == that.isUnique()
                    && this.isAutoIncremented() == that.isAutoIncremented()
                    && Objects.equals(this.defaultValueExpression(), that.defaultValueExpression())
                    && Objects.equals(this.checkExpression(), that.checkExpression())
                    && Objects.equals(this.references(), that.references())
                    && Objects.equals(this.generatedAs(), that.generatedAs())
                    && Objects.equals(this.comment(), that.comment())
                    && Objects.equals(this.collation(), that.collation())
                    && Objects.equals(this.charsetName(), that.charsetName())
                    && Objects.equals(this.onUpdate(), that.onUpdate());
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        sb.append(" ").append(dataType.expression());
        if (!optional) {
            sb.append(" NOT NULL");
        }
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        }
        if (unique) {
            sb.append(" UNIQUE");
        }
        if (defaultValueExpression != null) {
            sb.append(" DEFAULT ").append(defaultValueExpression);
        }
        if (references != null) {
            sb.append(' ').append(references);
        }
        if (autoIncremented) {
            sb.append(" AUTO_INCREMENT");
        }
        return sb.toString();
    }

    @Override
    public ColumnEditor edit() {
        return Column.editor()
                .name(name())
                .dataType(dataType())
                .position(position())
                .optional(isOptional())
                .primaryKey(isPrimaryKey())
                .defaultValueExpression(defaultValueExpression())
                .checkExpression(checkExpression())
                .unique(isUnique())
                .references(references())
                .autoIncremented(isAutoIncremented())
                .generatedAs(generatedAs())
                .comment(comment())
                .collation(collation())
                .charsetName(charsetName())
                .onUpdate(onUpdate());
    }
}
