/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

final class ColumnEditorImpl implements ColumnEditor {

    private String name;
    private DataType dataType;
    private int position = 1;
    private boolean optional = true;
    private boolean primaryKey;
    private String defaultValueExpression;
    private String checkExpression;
    private boolean unique;
    private ForeignKeyReference references;
    private boolean autoIncremented;
    private String generatedAs;
    private String comment;
    private String collation;
    private String charsetName;
    private String onUpdate;

    protected ColumnEditorImpl() {
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    public int position() {
        return position;
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

    public String checkExpression() {
        return checkExpression;
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public ForeignKeyReference references() {
        return references;
    }

    public boolean isAutoIncremented() {
        return autoIncremented;
    }

    public String generatedAs() {
        return generatedAs;
    }

    public String comment() {
        return comment;
    }

    public String collation() {
        return collation;
    }

    public String charsetName() {
        return charsetName;
    }

    public String onUpdate() {
        return onUpdate;
    }

    @Override
    public ColumnEditor name(String name) {
        this.name = name;
        return this;
    }

    @Override
    public ColumnEditor dataType(DataType type) {
        this.dataType = type;
        return this;
    }

    @Override
    public ColumnEditor position(int position) {
        this.position = position;
        return this;
    }

    @Override
    public ColumnEditor optional(boolean optional) {
        this.optional = optional;
        return this;
    }

    @Override
    public ColumnEditor defaultValueExpression(String expression) {
        this.defaultValueExpression = expression;
        return this;
    }

    @Override
    public ColumnEditor checkExpression(String expression) {
        this.checkExpression = expression;
        return this;
    }

    @Override
    public ColumnEditor unique(boolean unique) {
        this.unique = unique;
        return this;
    }

    @Override
    public ColumnEditor primaryKey(boolean primaryKey) {
        this.primaryKey = primaryKey;
        if (primaryKey) {
            this.optional = false;
        }
        return this;
    }

    @Override
    public ColumnEditor references(ForeignKeyReference reference) {
        this.references = reference;
        return this;
    }

    @Override
    public ColumnEditor autoIncremented(boolean autoIncremented) {
        this.autoIncremented = autoIncremented;
        return this;
    }

    @Override
    public ColumnEditor generatedAs(String expression) {
        this.generatedAs = expression;
        return this;
    }

    @Override
    public ColumnEditor comment(String comment) {
        this.comment = comment;
        return this;
    }

    @Override
    public ColumnEditor collation(String collation) {
        this.collation = collation;
        return this;
    }

    @Override
    public ColumnEditor charsetName(String charsetName) {
        this.charsetName = charsetName;
        return this;
    }

    @Override
    public ColumnEditor onUpdate(String expression) {
        this.onUpdate = expression;
        return this;
    }

    @Override
    public Column create() {
        if (name == null) {
            throw new IllegalStateException("Unable to create a column without a name");
        }
        if (dataType == null) {
            throw new IllegalStateException("Unable to create column '" + name + "' without a data type");
        }
        return new ColumnImpl(this);
    }

    @Override
    public String toString() {
        return name + " " + dataType;
    }
}
