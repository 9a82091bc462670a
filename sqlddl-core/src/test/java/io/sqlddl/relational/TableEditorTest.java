/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

public class TableEditorTest {

    private final TableId id = new TableId("schema", "table");
    private TableEditor editor;
    private Table table;
    private Column c1;
    private Column c2;
    private Column c3;

    @Before
    public void beforeEach() {
        editor = Table.editor();
        table = null;
        c1 = Column.editor().name("C1").dataType(DataType.named("VARCHAR")).create();
        c2 = Column.editor().name("C2").dataType(DataType.named("NUMBER")).create();
        c3 = Column.editor().name("C3").dataType(DataType.named("DATE")).create();
    }

    @Test
    public void shouldNotHaveColumnsIfEmpty() {
        assertThat(editor.columnWithName("any")).isNull();
        assertThat(editor.columns()).isEmpty();
        assertThat(editor.primaryKeyColumnNames()).isEmpty();
    }

    @Test(expected = IllegalStateException.class)
    public void shouldFailToCreateTableWhenEditorIsMissingTableId() {
        editor.create();
    }

    @Test
    public void shouldCreateTableWhenEditorHasIdButNoColumns() {
        table = editor.tableId(id).create();
        assertThat(table.columnWithName("any")).isNull();
        assertThat(table.columns()).isEmpty();
        assertThat(table.primaryKeyColumnNames()).isEmpty();
    }

    @Test
    public void shouldAssignPositionsInOrderOfAddition() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2, c3));
        assertThat(editor.columnWithName("c1").position()).isEqualTo(1);
        assertThat(editor.columnWithName("C2").position()).isEqualTo(2);
        assertThat(editor.columnWithName("C3").position()).isEqualTo(3);
        table = editor.create();
        assertThat(table.columnNames()).containsExactly("C1", "C2", "C3");
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldNotAllowPrimaryKeyColumnThatIsNotFound() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2));
        editor.setPrimaryKeyNames(Arrays.asList("C1", "WOOPS"));
    }

    @Test
    public void shouldMakePrimaryKeyColumnsRequired() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2));
        editor.setPrimaryKeyNames(Collections.singletonList("C2"));
        table = editor.create();
        assertThat(table.primaryKeyColumnNames()).containsExactly("C2");
        assertThat(table.columnWithName("C2").isPrimaryKey()).isTrue();
        assertThat(table.columnWithName("C2").isOptional()).isFalse();
        assertThat(table.columnWithName("C1").isOptional()).isTrue();
    }

    @Test
    public void shouldRenameColumnKeepingPositionAndKeyMembership() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2, c3));
        editor.setPrimaryKeyNames(Collections.singletonList("C2"));
        editor.renameColumn("c2", "KEY2");
        table = editor.create();
        assertThat(table.columnNames()).containsExactly("C1", "KEY2", "C3");
        assertThat(table.primaryKeyColumnNames()).containsExactly("KEY2");
        assertThat(table.columnWithName("KEY2").position()).isEqualTo(2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldNotRenameUnknownColumn() {
        editor.tableId(id).addColumn(c1);
        editor.renameColumn("nope", "other");
    }

    @Test
    public void shouldRemoveColumnAndItsKeyMembership() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2, c3));
        editor.setPrimaryKeyNames(Arrays.asList("C1", "C2"));
        editor.removeColumn("C1");
        table = editor.create();
        assertThat(table.columnNames()).containsExactly("C2", "C3");
        assertThat(table.primaryKeyColumnNames()).containsExactly("C2");
        assertThat(table.columnWithName("C3").position()).isEqualTo(2);
    }

    @Test
    public void shouldApplyConstraintsToColumns() {
        editor.tableId(id).addColumns(Arrays.asList(c1, c2, c3));
        ForeignKeyReference reference = new ForeignKeyReference(new TableId(null, "other"), null, "CASCADE", null, null);
        editor.addConstraint(new Constraint.ForeignKey("fk", Collections.singletonList("C3"), Collections.singletonList("ID"), reference));
        editor.addConstraint(new Constraint.Unique(null, Collections.singletonList("C1")));
        editor.addConstraint(new Constraint.Check("positive", "C2 > 0"));
        table = editor.create();

        assertThat(table.columnWithName("C3").references().table().table()).isEqualTo("other");
        assertThat(table.columnWithName("C3").references().column()).isEqualTo("ID");
        assertThat(table.columnWithName("C3").references().onDelete()).isEqualTo("CASCADE");
        assertThat(table.columnWithName("C1").isUnique()).isTrue();
        assertThat(table.checks()).extracting(Constraint.Check::expression).containsExactly("C2 > 0");
        assertThat(table.constraints()).hasSize(3);

        table = table.edit().removeConstraint("positive").create();
        assertThat(table.constraints()).hasSize(2);
        assertThat(table.checks()).isEmpty();
    }

    @Test
    public void shouldUpdateStoredTableOnlyWhenChangeSucceeds() {
        Tables tables = new Tables();
        tables.overwriteTable(editor.tableId(id).addColumn(c1).create());

        assertThat(tables.updateTable(new TableId("other", "table"), e -> e.addColumn(c2))).isNull();

        Table updated = tables.updateTable(new TableId("SCHEMA", "TABLE"), e -> e.addColumn(c2));
        assertThat(updated.columnNames()).containsExactly("C1", "C2");
        assertThat(tables.forTable(id)).isEqualTo(updated);

        try {
            tables.updateTable(id, e -> e.addColumn(c3).renameColumn("missing", "x"));
            fail("Expected the rename of a missing column to fail");
        }
        catch (IllegalArgumentException e) {
            assertThat(e.getMessage()).contains("missing");
        }
        assertThat(tables.forTable(id).columnNames()).containsExactly("C1", "C2");
    }
}
