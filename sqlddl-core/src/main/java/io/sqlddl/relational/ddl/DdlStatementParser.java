/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sqlddl.annotation.NotThreadSafe;
import io.sqlddl.relational.AlterAction;
import io.sqlddl.relational.AlterTable;
import io.sqlddl.relational.Column;
import io.sqlddl.relational.ColumnEditor;
import io.sqlddl.relational.Constraint;
import io.sqlddl.relational.DataType;
import io.sqlddl.relational.ForeignKeyReference;
import io.sqlddl.relational.Index;
import io.sqlddl.relational.PartitionSpec;
import io.sqlddl.relational.SchemaDefinition;
import io.sqlddl.relational.Sequence;
import io.sqlddl.relational.Table;
import io.sqlddl.relational.TableEditor;
import io.sqlddl.relational.TableId;
import io.sqlddl.text.ParsingException;
import io.sqlddl.text.Position;
import io.sqlddl.text.TokenStream;
import io.sqlddl.text.TokenStream.Marker;
import io.sqlddl.text.TokenStream.Token;
import io.sqlddl.util.Strings;

/**
 * The grammar reducer for a single statement span. Clauses are dispatched on the keyword that introduces them, so column
 * attributes and table clauses may appear in any order. A clause that is not recognized is skipped up to the next
 * recognized boundary and reported as a warning; a statement that cannot be classified or lacks a required clause is
 * reported as an error and contributes nothing.
 */
@NotThreadSafe
class DdlStatementParser {

    private static final Set<String> COLUMN_ATTRIBUTE_STARTS = words("NOT", "NULL", "DEFAULT", "CHECK", "UNIQUE", "PRIMARY", "KEY",
            "REFERENCES", "CONSTRAINT", "AUTO_INCREMENT", "AUTOINCREMENT", "IDENTITY", "GENERATED", "COMMENT", "COLLATE",
            "CHARACTER", "CHARSET", "ON", "DEFERRABLE", "INITIALLY", "AS", "STORED", "VIRTUAL");

    private static final Set<String> TABLE_CLAUSE_STARTS = words("PARTITION", "LIKE", "COMMENT", "TABLESPACE", "WITH", "DEFAULT",
            "CHARACTER", "COLLATE");

    private static final Set<String> SEQUENCE_CLAUSE_STARTS = words("INCREMENT", "START", "MINVALUE", "MAXVALUE", "NO", "CACHE",
            "CYCLE", "NOCYCLE", "NOMINVALUE", "NOMAXVALUE", "AS", "OWNED");

    private static final Set<String> SCHEMA_CLAUSE_STARTS = words("AUTHORIZATION", "DEFAULT", "CHARACTER", "CHARSET", "COLLATE",
            "LOCATION", "COMMENT", "WITH");

    private static final Set<String> ALTER_ACTION_STARTS = words("ADD", "ALTER", "DROP", "RENAME", "MODIFY", "CHANGE");

    private static final Set<String> REFERENTIAL_ACTIONS = words("CASCADE", "RESTRICT", "SET", "NO");

    private static Set<String> words(String... words) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(words)));
    }

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final ParseContext context;
    private final TokenStream tokens;
    private final int statementIndex;
    private final DataTypeParser dataTypeParser = new DataTypeParser();

    DdlStatementParser(ParseContext context, TokenStream tokens, int statementIndex) {
        this.context = context;
        this.tokens = tokens;
        this.statementIndex = statementIndex;
    }

    /**
     * Parse the statement, recording its result and any problems in the context.
     */
    void parse() {
        Marker start = tokens.mark();
        try {
            parseNextStatement(start);
        }
        catch (ParsingException e) {
            context.structuralError(statementIndex, e.getPosition(), e.getMessage(), statementText());
            debugSkipped(start);
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            context.structuralError(statementIndex, start.position(), e.getMessage(), statementText());
            debugSkipped(start);
        }
    }

    protected void parseNextStatement(Marker start) {
        if (tokens.matches("CREATE")) {
            parseCreate(start);
        }
        else if (tokens.matches("ALTER")) {
            parseAlter(start);
        }
        else {
            parseUnknownStatement(start);
        }
    }

    protected void parseUnknownStatement(Marker start) {
        throw new ParsingException(start.position(), "Unable to classify the statement starting with '" + tokens.peek() + "'");
    }

    protected void parseCreate(Marker start) {
        tokens.consume("CREATE");
        boolean replace = tokens.canConsume("OR", "REPLACE");
        boolean temporary = tokens.canConsume("GLOBAL", "TEMPORARY") || tokens.canConsume("LOCAL", "TEMPORARY")
                || tokens.canConsumeAnyOf("TEMPORARY", "TEMP");
        boolean external = tokens.canConsume("EXTERNAL");
        if (tokens.matches("TABLE")) {
            parseCreateTable(start, replace, temporary, external);
        }
        else if (tokens.matches("INDEX") || tokens.matches("UNIQUE") || tokens.matchesAnyOf("CLUSTERED", "NONCLUSTERED")) {
            parseCreateIndex(start);
        }
        else if (tokens.matches("SEQUENCE")) {
            parseCreateSequence(start);
        }
        else if (tokens.matchesAnyOf("SCHEMA", "DATABASE")) {
            parseCreateSchema(start);
        }
        else {
            throw new ParsingException(tokens.hasNext() ? tokens.nextPosition() : start.position(),
                    "Unsupported CREATE statement" + (tokens.hasNext() ? " of '" + tokens.peek() + "'" : ""));
        }
    }

    // ------------------------------------------------------------------------------------------------------------------
    // CREATE TABLE
    // ------------------------------------------------------------------------------------------------------------------

    protected void parseCreateTable(Marker start, boolean replace, boolean temporary, boolean external) {
        tokens.consume("TABLE");
        boolean ifNotExists = tokens.canConsume("IF", "NOT", "EXISTS");
        TableId tableId = parseQualifiedTableName();
        TableEditor table = Table.editor().tableId(tableId).ifNotExists(ifNotExists).replace(replace).temporary(temporary);
        table.hql().external(external);

        if (tokens.canConsume("LIKE")) {
            table.like(parseQualifiedTableName());
        }
        else if (tokens.matches("(")) {
            parseTableElementList(start, table);
        }
        parseTableClauses(start, table);
        if (table.like() == null && table.columns().isEmpty()) {
            throw new ParsingException(start.position(), "CREATE TABLE " + tableId + " has neither a column list nor a LIKE clause");
        }
        context.addTable(table.create());
        debugParsed(start);
    }

    protected void parseTableElementList(Marker start, TableEditor table) {
        List<String> columnLevelKey = new ArrayList<>();
        List<Constraint> tableConstraints = new ArrayList<>();
        tokens.consume("(");
        do {
            parseTableElement(start, table, columnLevelKey, tableConstraints);
        } while (tokens.canConsume(","));
        tokens.consume(")");

        // Constraints may name columns declared after them, so they are applied once every column is known
        for (Constraint constraint : tableConstraints) {
            table.addConstraint(constraint);
        }
        if (!columnLevelKey.isEmpty()) {
            List<String> pkNames = new ArrayList<>(table.primaryKeyColumnNames());
            for (String name : columnLevelKey) {
                if (pkNames.stream().noneMatch(name::equalsIgnoreCase)) {
                    pkNames.add(name);
                }
            }
            table.setPrimaryKeyNames(pkNames);
        }
    }

    protected void parseTableElement(Marker start, TableEditor table, List<String> columnLevelKey, List<Constraint> tableConstraints) {
        if (tokens.matchesAnyOf("CONSTRAINT", "PRIMARY", "FOREIGN", "CHECK") || tokens.matches("UNIQUE", "(")
                || tokens.matches("UNIQUE", "KEY") || tokens.matches("UNIQUE", "INDEX")) {
            tableConstraints.add(parseTableConstraint(start));
        }
        else if (isIndexElement()) {
            table.addIndex(parseIndexElement(table.tableId()));
        }
        else if (tokens.canConsume("LIKE")) {
            table.like(parseQualifiedTableName());
            while (tokens.canConsumeAnyOf("INCLUDING", "EXCLUDING")) {
                tokens.consume();
            }
        }
        else {
            Column column = parseColumnDefinition(start);
            if (table.columnWithName(column.name()) != null) {
                throw new ParsingException(start.position(), "Column '" + column.name() + "' is defined more than once in table "
                        + table.tableId());
            }
            table.addColumn(column);
            if (column.isPrimaryKey()) {
                columnLevelKey.add(column.name());
            }
        }
    }

    /**
     * A MySQL {@code KEY|INDEX [name] (...)} element, as opposed to a column that happens to be named {@code key}: the
     * index name is followed by a column list, while a column name is followed by a type.
     */
    private boolean isIndexElement() {
        if (tokens.matchesAnyOf("FULLTEXT", "SPATIAL")) {
            return true;
        }
        if (!tokens.matchesAnyOf("KEY", "INDEX")) {
            return false;
        }
        Token next = tokens.peekToken(1);
        if (next == null) {
            return false;
        }
        if (next.matches("(") || next.matches("USING")) {
            return true;
        }
        // key ENUM('a','b') is a column; an index name is never an unquoted type name
        if (!next.matches(DdlTokenizer.QUOTED_IDENTIFIER) && DialectKeywords.isTypeName(next.normalizedValue())) {
            return false;
        }
        Token afterName = tokens.peekToken(2);
        Token firstInList = tokens.peekToken(3);
        return afterName != null && afterName.matches("(") && firstInList != null
                && !firstInList.matches(DdlTokenizer.NUMBER_LITERAL | DdlTokenizer.STRING_LITERAL);
    }

    protected Index parseIndexElement(TableId tableId) {
        tokens.canConsumeAnyOf("FULLTEXT", "SPATIAL");
        tokens.consumeAnyOf("KEY", "INDEX");
        String name = tokens.matches("(") || tokens.matches("USING") ? null : parseName();
        String method = tokens.canConsume("USING") ? tokens.consume() : null;
        List<Index.IndexColumn> columns = parseIndexColumns();
        if (tokens.canConsume("USING")) {
            method = tokens.consume();
        }
        return new Index(tableId, name, false, columns, method);
    }

    protected Constraint parseTableConstraint(Marker start) {
        String name = null;
        if (tokens.canConsume("CONSTRAINT")) {
            if (!tokens.matchesAnyOf("PRIMARY", "UNIQUE", "FOREIGN", "CHECK")) {
                name = parseName();
            }
        }
        return parseConstraintBody(name);
    }

    protected Constraint parseConstraintBody(String name) {
        Constraint constraint;
        if (tokens.canConsume("PRIMARY", "KEY")) {
            tokens.canConsumeAnyOf("CLUSTERED", "NONCLUSTERED");
            skipIndexMethod();
            constraint = new Constraint.PrimaryKey(name, names(parseIndexColumns()));
        }
        else if (tokens.canConsume("UNIQUE")) {
            tokens.canConsumeAnyOf("KEY", "INDEX");
            tokens.canConsumeAnyOf("CLUSTERED", "NONCLUSTERED");
            if (!tokens.matches("(") && !tokens.matches("USING")) {
                String indexName = parseName();
                name = name != null ? name : indexName;
            }
            skipIndexMethod();
            constraint = new Constraint.Unique(name, names(parseIndexColumns()));
        }
        else if (tokens.canConsume("FOREIGN", "KEY")) {
            if (!tokens.matches("(")) {
                parseName();
            }
            List<String> columns = parseColumnNameList();
            tokens.consume("REFERENCES");
            List<String> referencedColumns = new ArrayList<>();
            ForeignKeyReference reference = parseReference(referencedColumns);
            constraint = new Constraint.ForeignKey(name, columns, referencedColumns, reference.withColumn(null));
        }
        else if (tokens.canConsume("CHECK")) {
            constraint = new Constraint.Check(name, parseParenthesizedExpression());
        }
        else {
            throw new ParsingException(tokens.hasNext() ? tokens.nextPosition() : tokens.previousPosition(), "Expected a constraint");
        }
        skipIndexMethod();
        parseConstraintCharacteristics();
        return constraint;
    }

    private void skipIndexMethod() {
        if (tokens.canConsume("USING")) {
            tokens.consume();
        }
    }

    /**
     * Parse {@code [NOT] DEFERRABLE} and {@code INITIALLY DEFERRED|IMMEDIATE} in either order.
     *
     * @return the {@code INITIALLY} mode, or null if there was none
     */
    protected String parseConstraintCharacteristics() {
        String initially = null;
        while (true) {
            if (tokens.canConsume("NOT", "DEFERRABLE") || tokens.canConsume("DEFERRABLE")) {
                continue;
            }
            if (tokens.canConsume("INITIALLY")) {
                initially = tokens.consumeAnyOf("DEFERRED", "IMMEDIATE").toUpperCase(Locale.ROOT);
                continue;
            }
            return initially;
        }
    }

    /**
     * Parse the target of {@code REFERENCES} with its referential actions and characteristics.
     *
     * @param referencedColumns receives the referenced columns, if any were listed
     * @return the reference, whose column is the first referenced column or null
     */
    protected ForeignKeyReference parseReference(List<String> referencedColumns) {
        TableId target = parseQualifiedTableName();
        if (tokens.matches("(")) {
            referencedColumns.addAll(parseColumnNameList());
        }
        String onDelete = null;
        String onUpdate = null;
        String initially = null;
        while (tokens.hasNext()) {
            if (isReferentialAction("DELETE")) {
                tokens.consume("ON", "DELETE");
                onDelete = parseReferentialAction();
            }
            else if (isReferentialAction("UPDATE")) {
                tokens.consume("ON", "UPDATE");
                onUpdate = parseReferentialAction();
            }
            else if (tokens.canConsume("MATCH")) {
                tokens.consumeAnyOf("FULL", "PARTIAL", "SIMPLE");
            }
            else if (tokens.matchesAnyOf("DEFERRABLE", "INITIALLY") || tokens.matches("NOT", "DEFERRABLE")) {
                String mode = parseConstraintCharacteristics();
                initially = mode != null ? mode : initially;
            }
            else {
                break;
            }
        }
        return new ForeignKeyReference(target, referencedColumns.isEmpty() ? null : referencedColumns.get(0), onDelete, onUpdate, initially);
    }

    /**
     * {@code ON UPDATE} is also MySQL's column attribute {@code ON UPDATE CURRENT_TIMESTAMP}, so it is a referential action
     * only when an action word follows.
     */
    private boolean isReferentialAction(String event) {
        Token action = tokens.peekToken(2);
        return tokens.matches("ON", event) && action != null && !action.isQuoted()
                && REFERENTIAL_ACTIONS.contains(action.normalizedValue());
    }

    protected String parseReferentialAction() {
        if (tokens.canConsume("CASCADE")) {
            return "CASCADE";
        }
        if (tokens.canConsume("RESTRICT")) {
            return "RESTRICT";
        }
        if (tokens.canConsume("SET", "NULL")) {
            return "SET NULL";
        }
        if (tokens.canConsume("SET", "DEFAULT")) {
            return "SET DEFAULT";
        }
        tokens.consume("NO", "ACTION");
        return "NO ACTION";
    }

    // ------------------------------------------------------------------------------------------------------------------
    // Columns
    // ------------------------------------------------------------------------------------------------------------------

    protected Column parseColumnDefinition(Marker start) {
        String columnName = parseName();
        DataType dataType = dataTypeParser.parse(tokens);
        ColumnEditor column = Column.editor().name(columnName).dataType(dataType);
        parseColumnAttributes(column);
        return column.create();
    }

    /**
     * Dispatch column attributes, in any order, until the end of the column definition.
     */
    protected void parseColumnAttributes(ColumnEditor column) {
        while (tokens.hasNext() && !tokens.matchesAnyOf(",", ")")) {
            if (tokens.canConsume("NOT", "NULL")) {
                column.optional(false);
            }
            else if (tokens.canConsume("NULL")) {
                column.optional(true);
            }
            else if (tokens.canConsume("DEFAULT")) {
                column.defaultValueExpression(parseExpression());
            }
            else if (tokens.canConsume("CHECK")) {
                column.checkExpression(parseParenthesizedExpression());
            }
            else if (tokens.canConsume("UNIQUE")) {
                tokens.canConsume("KEY");
                column.unique(true);
            }
            else if (tokens.canConsume("PRIMARY", "KEY") || tokens.canConsume("KEY")) {
                tokens.canConsumeAnyOf("ASC", "DESC");
                column.primaryKey(true);
            }
            else if (tokens.canConsume("REFERENCES")) {
                column.references(parseReference(new ArrayList<>()));
            }
            else if (tokens.matchesAnyOf("DEFERRABLE", "INITIALLY") || tokens.matches("NOT", "DEFERRABLE")) {
                String initially = parseConstraintCharacteristics();
                if (column.references() != null && initially != null) {
                    column.references(column.references().withDeferrableInitially(initially));
                }
            }
            else if (tokens.canConsume("CONSTRAINT")) {
                parseName();
            }
            else if (tokens.canConsumeAnyOf("AUTO_INCREMENT", "AUTOINCREMENT")) {
                column.autoIncremented(true);
            }
            else if (tokens.canConsume("IDENTITY")) {
                column.autoIncremented(true);
                if (tokens.matches("(")) {
                    parseParenthesizedExpression();
                }
            }
            else if (tokens.matches("GENERATED") || tokens.matches("AS", "(")) {
                parseGeneratedColumn(column);
            }
            else if (tokens.canConsume("COMMENT")) {
                column.comment(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("COLLATE")) {
                column.collation(tokens.consume());
            }
            else if (tokens.canConsume("CHARACTER", "SET") || tokens.canConsume("CHARSET")) {
                column.charsetName(tokens.consume());
            }
            else if (tokens.canConsume("ON", "UPDATE")) {
                column.onUpdate(parseExpression());
            }
            else {
                skipUnknownClause(COLUMN_ATTRIBUTE_STARTS);
            }
        }
    }

    protected void parseGeneratedColumn(ColumnEditor column) {
        if (tokens.canConsume("GENERATED")) {
            if (tokens.canConsume("BY", "DEFAULT")) {
                tokens.canConsume("ON", "NULL");
            }
            else {
                tokens.consume("ALWAYS");
            }
        }
        tokens.consume("AS");
        if (tokens.canConsume("IDENTITY")) {
            column.autoIncremented(true);
            column.optional(false);
            if (tokens.matches("(")) {
                parseParenthesizedExpression();
            }
            return;
        }
        column.generatedAs(parseParenthesizedExpression());
        tokens.canConsumeAnyOf("STORED", "VIRTUAL", "PERSISTED");
    }

    // ------------------------------------------------------------------------------------------------------------------
    // Table clauses
    // ------------------------------------------------------------------------------------------------------------------

    /**
     * Dispatch the clauses that follow the column list, in any order.
     */
    protected void parseTableClauses(Marker start, TableEditor table) {
        while (tokens.hasNext()) {
            if (tokens.canConsume(",")) {
                // MySQL table options may be separated by commas
                continue;
            }
            if (tokens.canConsume("PARTITIONED", "BY")) {
                parsePartitionedBy(table);
            }
            else if (tokens.canConsume("PARTITION", "BY")) {
                parsePartitionBy(table);
            }
            else if (tokens.canConsume("LOCATION")) {
                table.hql().location(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("ROW", "FORMAT")) {
                parseRowFormat(table);
            }
            else if (tokens.canConsume("STORED", "AS")) {
                parseStoredAs(table);
            }
            else if (tokens.canConsume("LIKE")) {
                table.like(parseQualifiedTableName());
            }
            else if (tokens.canConsume("COMMENT")) {
                tokens.canConsume("=");
                table.comment(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("TBLPROPERTIES")) {
                parseProperties().forEach((k, v) -> table.hql().tblProperty(k, v));
            }
            else if (tokens.canConsume("TABLESPACE")) {
                table.tablespace(parseName());
            }
            else if (tokens.canConsume("CLUSTERED", "BY")) {
                parseClusteredBy(table);
            }
            else if (tokens.matches("WITH", "(")) {
                tokens.consume("WITH");
                parseProperties().forEach(table::tableOption);
            }
            else if (isTableOption()) {
                parseTableOption(table);
            }
            else {
                skipUnknownClause(TABLE_CLAUSE_STARTS);
            }
        }
    }

    protected void parsePartitionedBy(TableEditor table) {
        tokens.consume("(");
        do {
            String name = parseName();
            if (tokens.matchesAnyOf(",", ")")) {
                // Only a name: the partition column is one of the declared columns
                Column existing = table.columnWithName(name);
                if (existing == null) {
                    throw new ParsingException(tokens.previousPosition(), "Unknown partition column '" + name + "'");
                }
                table.addPartitionedByColumn(existing);
                continue;
            }
            ColumnEditor column = Column.editor().name(name).dataType(dataTypeParser.parse(tokens));
            if (tokens.canConsume("COMMENT")) {
                column.comment(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            table.addPartitionedByColumn(column.create());
        } while (tokens.canConsume(","));
        tokens.consume(")");
    }

    protected void parsePartitionBy(TableEditor table) {
        String type = null;
        if (!tokens.matches("(")) {
            type = tokens.consume().toUpperCase(Locale.ROOT);
            if (tokens.matches("COLUMNS")) {
                type = type + " " + tokens.consume().toUpperCase(Locale.ROOT);
            }
        }
        List<String> columns = new ArrayList<>();
        tokens.consume("(");
        do {
            int expressionStart = tokens.index();
            skipExpression();
            columns.add(ExpressionText.from(tokens, expressionStart));
        } while (tokens.canConsume(","));
        tokens.consume(")");
        table.partitionBy(new PartitionSpec(type, columns));
        if (tokens.canConsume("PARTITIONS")) {
            tokens.consume(DdlTokenizer.NUMBER_LITERAL);
        }
        if (tokens.matches("(")) {
            // Partition definitions
            parseParenthesizedExpression();
        }
    }

    protected void parseRowFormat(TableEditor table) {
        if (tokens.canConsume("SERDE")) {
            table.hql().rowFormat("SERDE").serde(tokens.consume(DdlTokenizer.STRING_LITERAL));
            if (tokens.canConsume("WITH", "SERDEPROPERTIES")) {
                parseProperties();
            }
            return;
        }
        tokens.consume("DELIMITED");
        table.hql().rowFormat("DELIMITED");
        while (true) {
            if (tokens.canConsume("FIELDS", "TERMINATED", "BY")) {
                table.hql().fieldsTerminatedBy(tokens.consume(DdlTokenizer.STRING_LITERAL));
                if (tokens.canConsume("ESCAPED", "BY")) {
                    tokens.consume(DdlTokenizer.STRING_LITERAL);
                }
            }
            else if (tokens.canConsume("COLLECTION", "ITEMS", "TERMINATED", "BY")) {
                table.hql().collectionItemsTerminatedBy(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("MAP", "KEYS", "TERMINATED", "BY")) {
                table.hql().mapKeysTerminatedBy(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("LINES", "TERMINATED", "BY")) {
                table.hql().linesTerminatedBy(tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("NULL", "DEFINED", "AS")) {
                tokens.consume(DdlTokenizer.STRING_LITERAL);
            }
            else {
                return;
            }
        }
    }

    protected void parseStoredAs(TableEditor table) {
        if (tokens.canConsume("INPUTFORMAT")) {
            String input = tokens.consume(DdlTokenizer.STRING_LITERAL);
            tokens.consume("OUTPUTFORMAT");
            String output = tokens.consume(DdlTokenizer.STRING_LITERAL);
            table.hql().storedAs("INPUTFORMAT '" + input + "' OUTPUTFORMAT '" + output + "'");
        }
        else {
            table.hql().storedAs(tokens.consume());
        }
    }

    protected void parseClusteredBy(TableEditor table) {
        table.hql().clusteredBy(parseColumnNameList());
        if (tokens.canConsume("SORTED", "BY")) {
            parseIndexColumns();
        }
        if (tokens.canConsume("INTO")) {
            Position position = tokens.nextPosition();
            long buckets = parseLong();
            if (buckets < 0 || buckets > Integer.MAX_VALUE) {
                throw new ParsingException(position, "Bucket count " + buckets + " is out of range");
            }
            table.hql().buckets((int) buckets);
            tokens.consume("BUCKETS");
        }
    }

    /**
     * Parse {@code ('key' = 'value', ...)}, as in Hive's {@code TBLPROPERTIES} or PostgreSQL's {@code WITH (...)}.
     */
    protected Map<String, String> parseProperties() {
        Map<String, String> properties = new LinkedHashMap<>();
        tokens.consume("(");
        if (tokens.canConsume(")")) {
            return properties;
        }
        do {
            String key = tokens.consume();
            String value = null;
            if (tokens.canConsume("=")) {
                value = tokens.consume();
            }
            properties.put(key, value);
        } while (tokens.canConsume(","));
        tokens.consume(")");
        return properties;
    }

    /**
     * MySQL table options: {@code ENGINE=InnoDB}, {@code DEFAULT CHARSET=utf8}, {@code CHARACTER SET utf8},
     * {@code AUTO_INCREMENT=10} and any other {@code name = value} pair.
     */
    private boolean isTableOption() {
        if (tokens.matches("DEFAULT")) {
            return true;
        }
        if (tokens.matches("CHARACTER", "SET") || tokens.matchesAnyOf("CHARSET", "COLLATE", "ENGINE")) {
            return true;
        }
        Token next = tokens.peekToken(1);
        return tokens.matches(DdlTokenizer.IDENTIFIER | DdlTokenizer.KEYWORD) && next != null && next.matches("=");
    }

    protected void parseTableOption(TableEditor table) {
        String prefix = tokens.canConsume("DEFAULT") ? "DEFAULT " : "";
        String name;
        if (tokens.canConsume("CHARACTER", "SET")) {
            name = "CHARACTER SET";
        }
        else {
            name = tokens.consume().toUpperCase(Locale.ROOT);
        }
        tokens.canConsume("=");
        table.tableOption(prefix + name, tokens.consume());
    }

    // ------------------------------------------------------------------------------------------------------------------
    // ALTER TABLE
    // ------------------------------------------------------------------------------------------------------------------

    protected void parseAlter(Marker start) {
        tokens.consume("ALTER");
        if (!tokens.canConsume("TABLE")) {
            throw new ParsingException(tokens.hasNext() ? tokens.nextPosition() : start.position(), "Unsupported ALTER statement");
        }
        boolean ifExists = tokens.canConsume("IF", "EXISTS");
        tokens.canConsume("ONLY");
        ifExists = tokens.canConsume("IF", "EXISTS") || ifExists;
        TableId tableId = parseQualifiedTableName();
        tokens.canConsume("*");
        List<AlterAction> actions = new ArrayList<>();
        do {
            parseAlterAction(actions);
        } while (tokens.canConsume(","));
        while (tokens.hasNext()) {
            skipUnknownClause(ALTER_ACTION_STARTS);
        }
        context.alterTable(new AlterTable(tableId, ifExists, actions), statementIndex, start.position());
        debugParsed(start);
    }

    protected void parseAlterAction(List<AlterAction> actions) {
        if (tokens.canConsume("ADD")) {
            parseAlterAdd(actions);
        }
        else if (tokens.canConsume("ALTER")) {
            tokens.canConsume("COLUMN");
            parseAlterColumn(actions, parseName());
        }
        else if (tokens.canConsume("RENAME")) {
            if (tokens.canConsume("COLUMN") || tokens.matches(TokenStream.ANY_VALUE, "TO")) {
                String from = parseName();
                tokens.consume("TO");
                actions.add(new AlterAction.RenameColumn(from, parseName()));
            }
            else {
                skipUnknownClause(ALTER_ACTION_STARTS);
            }
        }
        else if (tokens.canConsume("DROP")) {
            if (tokens.canConsume("CONSTRAINT")) {
                tokens.canConsume("IF", "EXISTS");
                actions.add(new AlterAction.DropConstraint(parseName()));
            }
            else {
                tokens.canConsume("COLUMN");
                tokens.canConsume("IF", "EXISTS");
                actions.add(new AlterAction.DropColumn(parseName()));
            }
            tokens.canConsumeAnyOf("CASCADE", "RESTRICT");
        }
        else if (tokens.canConsume("MODIFY")) {
            tokens.canConsume("COLUMN");
            actions.add(new AlterAction.ModifyColumn(parseColumnDefinition(tokens.mark())));
        }
        else if (tokens.canConsume("CHANGE")) {
            tokens.canConsume("COLUMN");
            String existing = parseName();
            Column column = parseColumnDefinition(tokens.mark());
            if (!existing.equalsIgnoreCase(column.name())) {
                actions.add(new AlterAction.RenameColumn(existing, column.name()));
            }
            actions.add(new AlterAction.ModifyColumn(column));
        }
        else {
            skipUnknownClause(ALTER_ACTION_STARTS);
        }
    }

    protected void parseAlterAdd(List<AlterAction> actions) {
        if (tokens.matchesAnyOf("CONSTRAINT", "PRIMARY", "UNIQUE", "FOREIGN", "CHECK")) {
            String name = null;
            if (tokens.canConsume("CONSTRAINT")) {
                name = parseName();
            }
            if (tokens.canConsume("DEFAULT")) {
                String value = parseExpression();
                tokens.consume("FOR");
                actions.add(new AlterAction.SetDefault(name, Collections.singletonList(parseName()), value));
                return;
            }
            actions.add(new AlterAction.AddConstraint(parseConstraintBody(name)));
            return;
        }
        if (isIndexElement()) {
            skipUnknownClause(ALTER_ACTION_STARTS);
            return;
        }
        tokens.canConsume("COLUMN");
        tokens.canConsume("IF", "NOT", "EXISTS");
        actions.add(new AlterAction.AddColumn(parseColumnDefinition(tokens.mark())));
    }

    protected void parseAlterColumn(List<AlterAction> actions, String columnName) {
        if (tokens.canConsume("SET", "DEFAULT")) {
            actions.add(new AlterAction.SetDefault(null, Collections.singletonList(columnName), parseExpression()));
        }
        else if (tokens.canConsume("DROP", "DEFAULT")) {
            actions.add(new AlterAction.SetDefault(null, Collections.singletonList(columnName), null));
        }
        else if (tokens.canConsume("SET", "NOT", "NULL")) {
            actions.add(new AlterAction.ModifyColumn(columnName, null, false));
        }
        else if (tokens.canConsume("DROP", "NOT", "NULL")) {
            actions.add(new AlterAction.ModifyColumn(columnName, null, true));
        }
        else if (tokens.canConsume("SET", "DATA", "TYPE") || tokens.canConsume("TYPE")) {
            DataType dataType = dataTypeParser.parse(tokens);
            if (tokens.canConsume("USING")) {
                skipExpression();
            }
            actions.add(new AlterAction.ModifyColumn(columnName, dataType, null));
        }
        else {
            skipUnknownClause(ALTER_ACTION_STARTS);
        }
    }

    // ------------------------------------------------------------------------------------------------------------------
    // CREATE INDEX
    // ------------------------------------------------------------------------------------------------------------------

    protected void parseCreateIndex(Marker start) {
        boolean unique = tokens.canConsume("UNIQUE");
        tokens.canConsumeAnyOf("CLUSTERED", "NONCLUSTERED");
        tokens.consume("INDEX");
        tokens.canConsume("CONCURRENTLY");
        tokens.canConsume("IF", "NOT", "EXISTS");
        String name = null;
        if (!tokens.matches("ON")) {
            name = parseQualifiedTableName().table();
        }
        if (!tokens.canConsume("ON")) {
            throw new ParsingException(tokens.hasNext() ? tokens.nextPosition() : tokens.previousPosition(),
                    "CREATE INDEX " + (name != null ? name + " " : "") + "has no ON clause");
        }
        tokens.canConsume("ONLY");
        TableId tableId = parseQualifiedTableName();
        String method = tokens.canConsume("USING") ? tokens.consume() : null;
        List<Index.IndexColumn> columns = parseIndexColumns();
        while (tokens.hasNext()) {
            if (tokens.canConsume("INCLUDE")) {
                parseColumnNameList();
            }
            else if (tokens.canConsume("WHERE")) {
                skipExpression();
            }
            else if (tokens.matches("WITH", "(")) {
                tokens.consume("WITH");
                parseProperties();
            }
            else if (tokens.canConsume("TABLESPACE")) {
                parseName();
            }
            else {
                skipUnknownClause(words("INCLUDE", "WHERE", "WITH", "TABLESPACE"));
            }
        }
        context.addIndex(new Index(tableId, name, unique, columns, method), statementIndex, start.position());
        debugParsed(start);
    }

    /**
     * Parse {@code (col [(length)] [COLLATE c] [ASC|DESC] [NULLS FIRST|LAST], ...)}. A column may also be an expression
     * such as {@code lower(email)}, whose text becomes the name.
     */
    protected List<Index.IndexColumn> parseIndexColumns() {
        List<Index.IndexColumn> columns = new ArrayList<>();
        tokens.consume("(");
        do {
            int nameStart = tokens.index();
            String name;
            if (tokens.matches("(")) {
                parseParenthesizedExpression();
                name = ExpressionText.from(tokens, nameStart);
            }
            else {
                name = parseName();
                if (tokens.matches("(")) {
                    boolean prefixLength = isNumber(tokens.peekToken(1)) && isClose(tokens.peekToken(2));
                    parseParenthesizedExpression();
                    if (!prefixLength) {
                        name = ExpressionText.from(tokens, nameStart);
                    }
                }
            }
            if (tokens.canConsume("COLLATE")) {
                tokens.consume();
            }
            String order = null;
            if (tokens.matchesAnyOf("ASC", "DESC")) {
                order = tokens.consume().toUpperCase(Locale.ROOT);
            }
            String nulls = null;
            if (tokens.canConsume("NULLS")) {
                nulls = tokens.consumeAnyOf("FIRST", "LAST").toUpperCase(Locale.ROOT);
            }
            columns.add(new Index.IndexColumn(name, order, nulls));
        } while (tokens.canConsume(","));
        tokens.consume(")");
        return columns;
    }

    private static boolean isNumber(Token token) {
        return token != null && token.matches(DdlTokenizer.NUMBER_LITERAL);
    }

    private static boolean isClose(Token token) {
        return token != null && token.matches(")");
    }

    private static List<String> names(List<Index.IndexColumn> columns) {
        return columns.stream().map(Index.IndexColumn::name).collect(Collectors.toList());
    }

    // ------------------------------------------------------------------------------------------------------------------
    // CREATE SEQUENCE
    // ------------------------------------------------------------------------------------------------------------------

    protected void parseCreateSequence(Marker start) {
        tokens.consume("SEQUENCE");
        boolean ifNotExists = tokens.canConsume("IF", "NOT", "EXISTS");
        TableId id = parseQualifiedTableName();
        Sequence.Builder sequence = Sequence.builder().schema(id.schema()).name(id.table()).ifNotExists(ifNotExists);
        while (tokens.hasNext()) {
            if (tokens.canConsume("INCREMENT")) {
                tokens.canConsume("BY");
                sequence.increment(parseLong());
            }
            else if (tokens.canConsume("START")) {
                tokens.canConsume("WITH");
                sequence.start(parseLong());
            }
            else if (tokens.canConsume("MINVALUE")) {
                sequence.minValue(parseLong());
            }
            else if (tokens.canConsume("MAXVALUE")) {
                sequence.maxValue(parseLong());
            }
            else if (tokens.canConsume("NO", "MINVALUE") || tokens.canConsume("NOMINVALUE")) {
                sequence.noMinValue();
            }
            else if (tokens.canConsume("NO", "MAXVALUE") || tokens.canConsume("NOMAXVALUE")) {
                sequence.noMaxValue();
            }
            else if (tokens.canConsume("CACHE")) {
                sequence.cache(parseLong());
            }
            else if (tokens.canConsume("NO", "CYCLE") || tokens.canConsume("NOCYCLE")) {
                sequence.cycle(false);
            }
            else if (tokens.canConsume("CYCLE")) {
                sequence.cycle(true);
            }
            else if (tokens.canConsume("AS")) {
                sequence.dataType(dataTypeParser.parse(tokens).expression());
            }
            else if (tokens.canConsume("OWNED", "BY")) {
                int ownerStart = tokens.index();
                parseQualifiedName();
                sequence.ownedBy(ExpressionText.from(tokens, ownerStart));
            }
            else {
                skipUnknownClause(SEQUENCE_CLAUSE_STARTS);
            }
        }
        context.addStatement(sequence.build());
        debugParsed(start);
    }

    protected long parseLong() {
        Token token = tokens.consumeToken();
        Long value = token.matches(DdlTokenizer.NUMBER_LITERAL) ? Strings.asLong(token.value()) : null;
        if (value == null) {
            throw new ParsingException(token.position(), "Expected an integer but found '" + token.value() + "'");
        }
        return value;
    }

    // ------------------------------------------------------------------------------------------------------------------
    // CREATE SCHEMA / DATABASE
    // ------------------------------------------------------------------------------------------------------------------

    protected void parseCreateSchema(Marker start) {
        boolean database = tokens.consumeAnyOf("SCHEMA", "DATABASE").equalsIgnoreCase("DATABASE");
        boolean ifNotExists = tokens.canConsume("IF", "NOT", "EXISTS");
        String name = tokens.matches("AUTHORIZATION") ? null : parseName();
        String authorization = null;
        Map<String, String> properties = new LinkedHashMap<>();
        while (tokens.hasNext()) {
            if (tokens.canConsume("AUTHORIZATION")) {
                authorization = parseName();
            }
            else if (tokens.canConsume("DEFAULT")) {
                continue;
            }
            else if (tokens.canConsume("CHARACTER", "SET") || tokens.canConsume("CHARSET")) {
                tokens.canConsume("=");
                properties.put("CHARACTER SET", tokens.consume());
            }
            else if (tokens.canConsume("COLLATE")) {
                tokens.canConsume("=");
                properties.put("COLLATE", tokens.consume());
            }
            else if (tokens.canConsume("LOCATION")) {
                properties.put("LOCATION", tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("COMMENT")) {
                properties.put("COMMENT", tokens.consume(DdlTokenizer.STRING_LITERAL));
            }
            else if (tokens.canConsume("WITH", "DBPROPERTIES")) {
                properties.putAll(parseProperties());
            }
            else {
                skipUnknownClause(SCHEMA_CLAUSE_STARTS);
            }
        }
        if (name == null) {
            if (authorization == null) {
                throw new ParsingException(start.position(), "CREATE SCHEMA has neither a name nor an AUTHORIZATION clause");
            }
            name = authorization;
        }
        context.addStatement(new SchemaDefinition(name, database, ifNotExists, authorization, properties));
        debugParsed(start);
    }

    // ------------------------------------------------------------------------------------------------------------------
    // Names and expressions
    // ------------------------------------------------------------------------------------------------------------------

    /**
     * Parse a name: an unquoted word or a quoted identifier.
     */
    protected String parseName() {
        if (!tokens.hasNext()) {
            throw new ParsingException(tokens.previousPosition(), "Expected a name but found the end of the statement");
        }
        Token token = tokens.consumeToken();
        if (!token.matches(DdlTokenizer.IDENTIFIER | DdlTokenizer.KEYWORD | DdlTokenizer.QUOTED_IDENTIFIER | DdlTokenizer.STRING_LITERAL)) {
            throw new ParsingException(token.position(), "Expected a name but found '" + token.value() + "'");
        }
        return token.value();
    }

    /**
     * Parse {@code [catalog.][schema.]table}; a catalog is accepted but not kept.
     */
    protected TableId parseQualifiedTableName() {
        List<String> parts = parseQualifiedName();
        if (parts.size() == 1) {
            return new TableId(null, parts.get(0));
        }
        return new TableId(parts.get(parts.size() - 2), parts.get(parts.size() - 1));
    }

    protected List<String> parseQualifiedName() {
        List<String> parts = new ArrayList<>();
        parts.add(parseName());
        while (tokens.canConsume(".")) {
            parts.add(parseName());
        }
        return parts;
    }

    protected List<String> parseColumnNameList() {
        List<String> names = new ArrayList<>();
        tokens.consume("(");
        do {
            names.add(parseName());
        } while (tokens.canConsume(","));
        tokens.consume(")");
        return names;
    }

    /**
     * Parse {@code ( expression )} and return the text of the expression inside the parentheses.
     */
    protected String parseParenthesizedExpression() {
        tokens.consume("(");
        int expressionStart = tokens.index();
        tokens.consumeUntil(")", "(");
        String expression = ExpressionText.from(tokens, expressionStart);
        tokens.consume(")");
        return expression;
    }

    /**
     * Parse a value expression, as after {@code DEFAULT}: operands joined by operators, where an operand is a literal, a
     * name, a function call or a parenthesized expression, and {@code ::} is followed by a type.
     *
     * @return the text of the expression; never null
     */
    protected String parseExpression() {
        int expressionStart = tokens.index();
        parseOperand();
        while (tokens.matches(DdlTokenizer.OPERATOR)) {
            if (tokens.canConsume("::")) {
                dataTypeParser.parse(tokens);
            }
            else {
                tokens.consume();
                parseOperand();
            }
        }
        return ExpressionText.from(tokens, expressionStart);
    }

    private void parseOperand() {
        if (tokens.matches("(")) {
            parseParenthesizedExpression();
            return;
        }
        if (tokens.matches(DdlTokenizer.OPERATOR)) {
            // unary operator
            tokens.consume();
        }
        Token token = tokens.consumeToken();
        if (token.matches(DdlTokenizer.PUNCTUATION)) {
            throw new ParsingException(token.position(), "Expected an expression but found '" + token.value() + "'");
        }
        while (tokens.matches(".") && tokens.peekToken(1) != null && !tokens.peekToken(1).matches(DdlTokenizer.PUNCTUATION)) {
            tokens.consume(".");
            tokens.consume();
        }
        if (tokens.matches("(")) {
            parseParenthesizedExpression();
        }
    }

    /**
     * Skip an expression up to a comma or closing parenthesis at the same depth.
     */
    private void skipExpression() {
        int depth = 0;
        while (tokens.hasNext()) {
            if (depth == 0 && tokens.matchesAnyOf(",", ")")) {
                return;
            }
            if (tokens.matches("(")) {
                depth++;
            }
            else if (tokens.matches(")")) {
                depth--;
            }
            tokens.consume();
        }
    }

    /**
     * Skip an unrecognized clause: at least one token, then everything up to a comma or closing parenthesis at the same
     * depth, or up to a word that starts a recognized clause.
     */
    protected void skipUnknownClause(Set<String> boundaries) {
        int clauseStart = tokens.index();
        Position position = tokens.nextPosition();
        int depth = 0;
        do {
            if (tokens.matches("(")) {
                depth++;
            }
            else if (tokens.matches(")")) {
                depth--;
            }
            tokens.consume();
        } while (tokens.hasNext() && !(depth <= 0 && isBoundary(boundaries)));
        context.unknownClause(statementIndex, position, ExpressionText.from(tokens, clauseStart));
    }

    private boolean isBoundary(Set<String> boundaries) {
        Token token = tokens.peekToken(0);
        if (token.matches(",") || token.matches(")")) {
            return true;
        }
        if (token.isQuoted() || !token.matches(DdlTokenizer.IDENTIFIER | DdlTokenizer.KEYWORD)) {
            return false;
        }
        return boundaries.contains(token.normalizedValue()) || DialectKeywords.isDialectClauseWord(token.value());
    }

    private String statementText() {
        List<Token> all = tokens.tokens();
        if (all.isEmpty()) {
            return "";
        }
        return tokens.getInputString().substring(all.get(0).startIndex(), all.get(all.size() - 1).endIndex());
    }

    protected void debugParsed(Marker start) {
        if (logger.isTraceEnabled()) {
            logger.trace("PARSED:  {}", statementText());
        }
    }

    protected void debugSkipped(Marker start) {
        if (logger.isTraceEnabled()) {
            logger.trace("SKIPPED: {}", statementText());
        }
    }
}
