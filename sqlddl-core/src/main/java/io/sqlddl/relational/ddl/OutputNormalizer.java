/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import io.sqlddl.annotation.ThreadSafe;
import io.sqlddl.config.OutputMode;
import io.sqlddl.relational.AlterAction;
import io.sqlddl.relational.AlterTable;
import io.sqlddl.relational.Column;
import io.sqlddl.relational.Constraint;
import io.sqlddl.relational.ForeignKeyReference;
import io.sqlddl.relational.HqlProperties;
import io.sqlddl.relational.Index;
import io.sqlddl.relational.SchemaDefinition;
import io.sqlddl.relational.Sequence;
import io.sqlddl.relational.Statement;
import io.sqlddl.relational.Table;
import io.sqlddl.relational.TableId;

/**
 * Turns statements into records: ordered maps with a stable key set per statement kind. The {@link OutputMode} decides
 * whether the Hive-only keys appear. This is pure post-processing; nothing here looks at tokens.
 * <p>
 * Keys that every record of a kind carries are always present, with null or empty values when the clause did not appear.
 * Other keys appear only when the clause did.
 */
@ThreadSafe
public class OutputNormalizer {

    private final OutputMode outputMode;

    public OutputNormalizer(OutputMode outputMode) {
        this.outputMode = Objects.requireNonNull(outputMode, "outputMode");
    }

    public OutputMode outputMode() {
        return outputMode;
    }

    private boolean hql() {
        return outputMode == OutputMode.HQL;
    }

    public List<Map<String, Object>> normalize(List<Statement> statements) {
        return statements.stream().map(this::normalize).collect(Collectors.toList());
    }

    public Map<String, Object> normalize(Statement statement) {
        switch (statement.kind()) {
            case CREATE_TABLE:
                return table((Table) statement);
            case ALTER_TABLE:
                return unresolvedAlter((AlterTable) statement);
            case CREATE_INDEX:
                return unresolvedIndex((Index) statement);
            case CREATE_SEQUENCE:
                return sequence((Sequence) statement);
            case CREATE_SCHEMA:
                return schema((SchemaDefinition) statement);
            default:
                throw new IllegalArgumentException("Unknown statement kind " + statement.kind());
        }
    }

    protected Map<String, Object> table(Table table) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("table_name", table.id().table());
        record.put("schema", table.id().schema());
        record.put("primary_key", new ArrayList<>(table.primaryKeyColumnNames()));
        record.put("columns", table.columns().stream().map(this::column).collect(Collectors.toList()));
        record.put("alter", alterations(table.alterations()));
        record.put("checks", table.checks().stream().map(OutputNormalizer::check).collect(Collectors.toList()));
        record.put("index", table.indexes().stream().map(OutputNormalizer::index).collect(Collectors.toList()));
        record.put("partitioned_by", table.partitionedBy().stream().map(this::column).collect(Collectors.toList()));
        record.put("tablespace", table.tablespace());
        if (hql()) {
            hqlProperties(table.hql(), record);
        }
        if (table.ifNotExists()) {
            record.put("if_not_exists", true);
        }
        if (table.replace()) {
            record.put("replace", true);
        }
        if (table.temporary()) {
            record.put("temp", true);
        }
        if (table.comment() != null) {
            record.put("comment", table.comment());
        }
        if (table.like() != null) {
            record.put("like", tableRef(table.like()));
        }
        if (!table.tableOptions().isEmpty()) {
            record.put("table_properties", new LinkedHashMap<>(table.tableOptions()));
        }
        Map<String, Object> constraints = constraints(table.constraints());
        if (!constraints.isEmpty()) {
            record.put("constraints", constraints);
        }
        if (table.partitionBy() != null) {
            Map<String, Object> partitionBy = new LinkedHashMap<>();
            partitionBy.put("type", table.partitionBy().type());
            partitionBy.put("columns", new ArrayList<>(table.partitionBy().columns()));
            record.put("partition_by", partitionBy);
        }
        return record;
    }

    private static void hqlProperties(HqlProperties hql, Map<String, Object> record) {
        record.put("external", hql.isExternal());
        record.put("stored_as", hql.storedAs());
        record.put("location", hql.location());
        record.put("row_format", hql.rowFormat());
        record.put("fields_terminated_by", hql.fieldsTerminatedBy());
        record.put("collection_items_terminated_by", hql.collectionItemsTerminatedBy());
        record.put("map_keys_terminated_by", hql.mapKeysTerminatedBy());
        record.put("lines_terminated_by", hql.linesTerminatedBy());
        record.put("tblproperties", hql.tblProperties().isEmpty() ? null : new LinkedHashMap<>(hql.tblProperties()));
        record.put("clustered_by", hql.clusteredBy().isEmpty() ? null : new ArrayList<>(hql.clusteredBy()));
        if (hql.serde() != null) {
            record.put("serde", hql.serde());
        }
        if (hql.buckets() != null) {
            record.put("into_buckets", hql.buckets());
        }
    }

    protected Map<String, Object> column(Column column) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", column.name());
        record.put("type", column.typeName());
        record.put("size", size(column));
        record.put("references", column.references() != null ? reference(column.references()) : null);
        record.put("unique", column.isUnique());
        record.put("nullable", column.isOptional());
        record.put("default", column.defaultValueExpression());
        record.put("check", column.checkExpression());
        if (column.isAutoIncremented()) {
            record.put("autoincrement", true);
        }
        if (column.generatedAs() != null) {
            record.put("generated_as", column.generatedAs());
        }
        if (column.comment() != null) {
            record.put("comment", column.comment());
        }
        if (column.collation() != null) {
            record.put("collate", column.collation());
        }
        if (column.charsetName() != null) {
            record.put("character_set", column.charsetName());
        }
        if (column.onUpdate() != null) {
            record.put("on_update", column.onUpdate());
        }
        return record;
    }

    private static Object size(Column column) {
        if (column.length() == null) {
            return null;
        }
        if (column.scale() == null) {
            return column.length();
        }
        return Arrays.asList(column.length(), column.scale());
    }

    protected Map<String, Object> reference(ForeignKeyReference reference) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("table", reference.table().table());
        record.put("schema", reference.table().schema());
        record.put("column", reference.column());
        record.put("on_delete", reference.onDelete());
        record.put("on_update", reference.onUpdate());
        if (hql() || reference.deferrableInitially() != null) {
            record.put("deferrable_initially", reference.deferrableInitially());
        }
        return record;
    }

    private static Map<String, Object> check(Constraint.Check check) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("constraint_name", check.name());
        record.put("statement", check.expression());
        return record;
    }

    private static Map<String, Object> columnsConstraint(String name, List<String> columns) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("constraint_name", name);
        record.put("columns", new ArrayList<>(columns));
        return record;
    }

    private static Map<String, Object> index(Index index) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("index_name", index.name());
        record.put("columns", index.columnNames());
        record.put("unique", index.isUnique());
        List<Map<String, Object>> detailed = new ArrayList<>();
        for (Index.IndexColumn column : index.columns()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("name", column.name());
            detail.put("order", column.order());
            detail.put("nulls", column.nulls());
            detailed.add(detail);
        }
        record.put("detailed_columns", detailed);
        return record;
    }

    private static Map<String, Object> tableRef(TableId id) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("schema", id.schema());
        record.put("table_name", id.table());
        return record;
    }

    /**
     * Named checks and primary keys, and all unique and foreign key constraints, grouped by kind.
     */
    private Map<String, Object> constraints(List<Constraint> constraints) {
        List<Map<String, Object>> checks = new ArrayList<>();
        List<Map<String, Object>> primaryKeys = new ArrayList<>();
        List<Map<String, Object>> uniques = new ArrayList<>();
        List<Map<String, Object>> references = new ArrayList<>();
        for (Constraint constraint : constraints) {
            switch (constraint.kind()) {
                case CHECK:
                    if (constraint.name() != null) {
                        checks.add(check((Constraint.Check) constraint));
                    }
                    break;
                case PRIMARY_KEY:
                    if (constraint.name() != null) {
                        primaryKeys.add(columnsConstraint(constraint.name(), ((Constraint.PrimaryKey) constraint).columns()));
                    }
                    break;
                case UNIQUE:
                    uniques.add(columnsConstraint(constraint.name(), ((Constraint.Unique) constraint).columns()));
                    break;
                case FOREIGN_KEY:
                    references.add(foreignKey((Constraint.ForeignKey) constraint));
                    break;
                default:
                    break;
            }
        }
        Map<String, Object> record = new LinkedHashMap<>();
        putIfNotEmpty(record, "checks", checks);
        putIfNotEmpty(record, "primary_keys", primaryKeys);
        putIfNotEmpty(record, "uniques", uniques);
        putIfNotEmpty(record, "references", references);
        return record;
    }

    private Map<String, Object> foreignKey(Constraint.ForeignKey foreignKey) {
        ForeignKeyReference reference = foreignKey.reference();
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("constraint_name", foreignKey.name());
        record.put("columns", new ArrayList<>(foreignKey.columns()));
        record.put("table", reference.table().table());
        record.put("schema", reference.table().schema());
        record.put("referenced_columns", new ArrayList<>(foreignKey.referencedColumns()));
        record.put("on_delete", reference.onDelete());
        record.put("on_update", reference.onUpdate());
        if (hql() || reference.deferrableInitially() != null) {
            record.put("deferrable_initially", reference.deferrableInitially());
        }
        return record;
    }

    private static void putIfNotEmpty(Map<String, Object> record, String key, List<?> values) {
        if (!values.isEmpty()) {
            record.put(key, values);
        }
    }

    /**
     * Group alter actions by kind, in the order they were applied.
     */
    protected Map<String, Object> alterations(List<AlterAction> actions) {
        List<Map<String, Object>> columns = new ArrayList<>();
        List<Map<String, Object>> checks = new ArrayList<>();
        List<Map<String, Object>> uniques = new ArrayList<>();
        List<Map<String, Object>> primaryKeys = new ArrayList<>();
        List<Map<String, Object>> defaults = new ArrayList<>();
        List<Map<String, Object>> renamed = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        List<String> droppedConstraints = new ArrayList<>();
        List<Map<String, Object>> modified = new ArrayList<>();
        for (AlterAction action : actions) {
            switch (action.kind()) {
                case ADD_COLUMN:
                    columns.add(column(((AlterAction.AddColumn) action).column()));
                    break;
                case ADD_CONSTRAINT:
                    Constraint constraint = ((AlterAction.AddConstraint) action).constraint();
                    switch (constraint.kind()) {
                        case FOREIGN_KEY:
                            Constraint.ForeignKey foreignKey = (Constraint.ForeignKey) constraint;
                            for (int i = 0; i != foreignKey.columns().size(); ++i) {
                                Map<String, Object> entry = new LinkedHashMap<>();
                                entry.put("name", foreignKey.columns().get(i));
                                entry.put("constraint_name", foreignKey.name());
                                entry.put("references", reference(foreignKey.referenceFor(i)));
                                columns.add(entry);
                            }
                            break;
                        case CHECK:
                            checks.add(check((Constraint.Check) constraint));
                            break;
                        case UNIQUE:
                            uniques.add(columnsConstraint(constraint.name(), ((Constraint.Unique) constraint).columns()));
                            break;
                        case PRIMARY_KEY:
                            primaryKeys.add(columnsConstraint(constraint.name(), ((Constraint.PrimaryKey) constraint).columns()));
                            break;
                        default:
                            break;
                    }
                    break;
                case SET_DEFAULT:
                    AlterAction.SetDefault setDefault = (AlterAction.SetDefault) action;
                    Map<String, Object> defaultEntry = columnsConstraint(setDefault.constraintName(), setDefault.columns());
                    defaultEntry.put("value", setDefault.value());
                    defaults.add(defaultEntry);
                    break;
                case RENAME_COLUMN:
                    AlterAction.RenameColumn rename = (AlterAction.RenameColumn) action;
                    Map<String, Object> renaming = new LinkedHashMap<>();
                    renaming.put("from", rename.from());
                    renaming.put("to", rename.to());
                    renamed.add(renaming);
                    break;
                case DROP_COLUMN:
                    dropped.add(((AlterAction.DropColumn) action).name());
                    break;
                case DROP_CONSTRAINT:
                    droppedConstraints.add(((AlterAction.DropConstraint) action).name());
                    break;
                case MODIFY_COLUMN:
                    modified.add(modifiedColumn((AlterAction.ModifyColumn) action));
                    break;
                default:
                    break;
            }
        }
        Map<String, Object> record = new LinkedHashMap<>();
        putIfNotEmpty(record, "columns", columns);
        putIfNotEmpty(record, "checks", checks);
        putIfNotEmpty(record, "uniques", uniques);
        putIfNotEmpty(record, "primary_keys", primaryKeys);
        putIfNotEmpty(record, "defaults", defaults);
        putIfNotEmpty(record, "renamed_columns", renamed);
        putIfNotEmpty(record, "dropped_columns", dropped);
        putIfNotEmpty(record, "dropped_constraints", droppedConstraints);
        putIfNotEmpty(record, "modified_columns", modified);
        return record;
    }

    private Map<String, Object> modifiedColumn(AlterAction.ModifyColumn modify) {
        if (modify.definition() != null) {
            return column(modify.definition());
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", modify.columnName());
        if (modify.dataType() != null) {
            record.put("type", modify.dataType().typeName());
            Integer length = modify.dataType().length();
            Integer scale = modify.dataType().scale();
            record.put("size", length == null ? null : scale == null ? (Object) length : Arrays.asList(length, scale));
        }
        if (modify.optional() != null) {
            record.put("nullable", modify.optional());
        }
        return record;
    }

    protected Map<String, Object> unresolvedAlter(AlterTable alter) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("table_name", alter.tableId().table());
        record.put("schema", alter.tableId().schema());
        record.put("alter", alterations(alter.actions()));
        record.put("unresolved", true);
        return record;
    }

    protected Map<String, Object> unresolvedIndex(Index index) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("table_name", index.tableId().table());
        record.put("schema", index.tableId().schema());
        record.putAll(index(index));
        record.put("unresolved", true);
        return record;
    }

    protected Map<String, Object> sequence(Sequence sequence) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("schema", sequence.schema());
        record.put("sequence_name", sequence.name());
        putIfPresent(record, "increment", sequence.increment());
        putIfPresent(record, "start", sequence.start());
        putIfPresent(record, "minvalue", sequence.minValue());
        putIfPresent(record, "maxvalue", sequence.maxValue());
        putIfPresent(record, "cache", sequence.cache());
        putIfPresent(record, "cycle", sequence.cycle());
        if (sequence.noMinValue()) {
            record.put("no_minvalue", true);
        }
        if (sequence.noMaxValue()) {
            record.put("no_maxvalue", true);
        }
        putIfPresent(record, "as", sequence.dataType());
        putIfPresent(record, "owned_by", sequence.ownedBy());
        if (sequence.ifNotExists()) {
            record.put("if_not_exists", true);
        }
        return record;
    }

    private static void putIfPresent(Map<String, Object> record, String key, Object value) {
        if (value != null) {
            record.put(key, value);
        }
    }

    protected Map<String, Object> schema(SchemaDefinition schema) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(schema.isDatabase() ? "database_name" : "schema_name", schema.name());
        putIfPresent(record, "authorization", schema.authorization());
        if (!schema.properties().isEmpty()) {
            record.put("properties", new LinkedHashMap<>(schema.properties()));
        }
        if (schema.ifNotExists()) {
            record.put("if_not_exists", true);
        }
        return record;
    }
}
