package org.carball.dbml.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.ReferentialAction.Type;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.table.ColDataType;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import org.carball.dbml.model.schema.Column;
import org.carball.dbml.model.schema.Index;
import org.carball.dbml.model.schema.Project;
import org.carball.dbml.model.schema.Ref;
import org.carball.dbml.model.schema.ReferentialAction;
import org.carball.dbml.model.schema.RelationshipType;
import org.carball.dbml.model.schema.SchemaNames;
import org.carball.dbml.model.schema.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a schema graph from SQL DDL ({@code CREATE TABLE} and {@code CREATE INDEX}).
 */
@Slf4j
public class DdlSchemaParser {

    private static final Set<String> SERIAL_TYPES = Set.of("serial", "smallserial", "bigserial");

    private DdlSchemaParser() {
        // Utility class - prevent instantiation
    }

    public static Project parseDdl(Path ddlFile, String projectName) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDdl(content, projectName);
    }

    public static Project parseDdl(String ddlContent, String projectName) {
        Project project = new Project(projectName);

        try {
            String processedDdl = preprocessDdl(ddlContent);
            Statements statements = CCJSqlParserUtil.parseStatements(processedDdl);

            // First pass: tables and their columns, so foreign keys can see every target
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    Table table = convertTable(createTable);
                    project.addTable(table);
                    log.debug("Parsed table: {}.{}", table.getSchema(), table.getName());
                }
            }

            // Second pass: foreign keys and standalone indexes
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    extractForeignKeys(createTable, project);
                } else if (statement instanceof CreateIndex createIndex) {
                    processCreateIndex(createIndex, project);
                }
            }

        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        log.info("Parsed {} tables and {} relationships from DDL", project.getTables().size(), project.getRefs().size());
        return project;
    }

    private static String preprocessDdl(String ddlContent) {
        // SQL Server bracket identifiers: [Order] -> Order
        String processed = ddlContent.replaceAll("\\[([^]]+)]", "$1");

        // CLUSTERED / NONCLUSTERED are not understood by JSqlParser
        processed = processed.replaceAll("(?i)\\bNONCLUSTERED\\b", "");
        processed = processed.replaceAll("(?i)\\bCLUSTERED\\b", "");

        return processed;
    }

    private static Table convertTable(CreateTable createTable) {
        net.sf.jsqlparser.schema.Table sqlTable = createTable.getTable();
        Table table = new Table(cleanIdentifier(sqlTable.getName()))
                .withSchema(schemaOf(sqlTable));

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                table.addColumn(convertColumn(colDef));
            }
        }

        if (createTable.getIndexes() != null) {
            for (net.sf.jsqlparser.statement.create.table.Index index : createTable.getIndexes()) {
                if (index instanceof ForeignKeyIndex) {
                    continue;
                }
                String type = index.getType() == null ? "" : index.getType().toUpperCase(Locale.ROOT);
                if (type.equals("PRIMARY KEY")) {
                    processPrimaryKey(index, table);
                } else if (!type.equals("CHECK")) {
                    processIndex(index, type, table);
                }
            }
        }

        return table;
    }

    private static Column convertColumn(ColumnDefinition colDef) {
        Column column = new Column(cleanIdentifier(colDef.getColumnName()), formatType(colDef.getColDataType()))
                .withNull();

        if (SERIAL_TYPES.contains(colDef.getColDataType().getDataType().toLowerCase(Locale.ROOT))) {
            column.withIncrement();
        }

        List<String> specs = colDef.getColumnSpecs();
        if (specs == null) {
            return column;
        }

        for (int i = 0; i < specs.size(); i++) {
            String upperSpec = specs.get(i).toUpperCase(Locale.ROOT);

            if (upperSpec.equals("NOT NULL")) {
                column.getSettings().setNullable(false);
            } else if (upperSpec.equals("NOT") && i + 1 < specs.size()
                    && specs.get(i + 1).equalsIgnoreCase("NULL")) {
                // "NOT" "NULL" as separate specs
                column.getSettings().setNullable(false);
                i++;
            } else if (upperSpec.equals("PRIMARY") || upperSpec.contains("PRIMARY KEY")) {
                column.withPrimaryKey();
                column.getSettings().setNullable(false);
            } else if (upperSpec.equals("UNIQUE")) {
                column.withUnique();
            } else if (upperSpec.equals("AUTO_INCREMENT") || upperSpec.equals("AUTOINCREMENT")
                    || upperSpec.startsWith("IDENTITY")) {
                column.withIncrement();
            } else if (upperSpec.equals("DEFAULT") && i + 1 < specs.size()) {
                String value = specs.get(++i);
                // Function call split into name and argument list: now ()
                if (i + 1 < specs.size() && specs.get(i + 1).startsWith("(")) {
                    value += specs.get(++i);
                }
                column.withDefault(value);
            } else if (upperSpec.equals("REFERENCES") && i + 1 < specs.size()) {
                String target = specs.get(++i);
                String referencedColumn = "id";
                if (i + 1 < specs.size() && specs.get(i + 1).startsWith("(")) {
                    referencedColumn = cleanIdentifier(specs.get(++i).replaceAll("[()\\s]", ""));
                }
                applyInlineReference(column, target, referencedColumn);
            }
        }

        return column;
    }

    private static void applyInlineReference(Column column, String target, String referencedColumn) {
        String cleaned = cleanIdentifier(target);
        String schema = SchemaNames.DEFAULT_SCHEMA;
        String tableName = cleaned;
        int dot = cleaned.lastIndexOf('.');
        if (dot > 0) {
            schema = cleaned.substring(0, dot);
            tableName = cleaned.substring(dot + 1);
        }

        RelationshipType type = column.getSettings().isUnique() || column.getSettings().isPrimaryKey()
                ? RelationshipType.ONE_TO_ONE
                : RelationshipType.MANY_TO_ONE;
        column.withRef(type, schema, tableName, referencedColumn);
    }

    private static void processPrimaryKey(net.sf.jsqlparser.statement.create.table.Index index, Table table) {
        List<String> pkColumns = columnNames(index);

        if (pkColumns.size() == 1) {
            Column column = table.findColumn(pkColumns.get(0));
            if (column != null) {
                column.withPrimaryKey();
                column.getSettings().setNullable(false);
            }
        } else if (!pkColumns.isEmpty()) {
            Index compositeIndex = Index.on(pkColumns.toArray(String[]::new)).withPrimaryKey();
            table.addIndex(compositeIndex);
        }
    }

    private static void processIndex(net.sf.jsqlparser.statement.create.table.Index index, String type, Table table) {
        List<String> indexColumns = columnNames(index);
        if (indexColumns.isEmpty()) {
            return;
        }

        Index tableIndex = Index.on(indexColumns.toArray(String[]::new));
        if (index.getName() != null) {
            tableIndex.withName(cleanIdentifier(index.getName()));
        }
        if (type.contains("UNIQUE")) {
            tableIndex.withUnique();
        }
        table.addIndex(tableIndex);
    }

    private static void processCreateIndex(CreateIndex createIndex, Project project) {
        net.sf.jsqlparser.schema.Table sqlTable = createIndex.getTable();
        Table table = project.findTable(schemaOf(sqlTable), cleanIdentifier(sqlTable.getName()));
        if (table == null) {
            log.warn("Skipping index on unknown table {}", sqlTable.getFullyQualifiedName());
            return;
        }

        net.sf.jsqlparser.statement.create.table.Index index = createIndex.getIndex();
        List<String> indexColumns = columnNames(index);
        if (indexColumns.isEmpty()) {
            return;
        }

        Index tableIndex = Index.on(indexColumns.toArray(String[]::new));
        if (index.getName() != null) {
            tableIndex.withName(cleanIdentifier(index.getName()));
        }
        if (index.getType() != null && index.getType().toUpperCase(Locale.ROOT).contains("UNIQUE")) {
            tableIndex.withUnique();
        }
        if (index.getUsing() != null) {
            tableIndex.withType(index.getUsing().toLowerCase(Locale.ROOT));
        }
        table.addIndex(tableIndex);
    }

    private static void extractForeignKeys(CreateTable createTable, Project project) {
        if (createTable.getIndexes() == null) {
            return;
        }

        net.sf.jsqlparser.schema.Table sqlTable = createTable.getTable();
        String schema = schemaOf(sqlTable);
        String tableName = cleanIdentifier(sqlTable.getName());

        for (net.sf.jsqlparser.statement.create.table.Index index : createTable.getIndexes()) {
            if (index instanceof ForeignKeyIndex fkIndex) {
                processForeignKey(schema, tableName, fkIndex, project);
            }
        }
    }

    private static void processForeignKey(String schema, String tableName, ForeignKeyIndex fkIndex, Project project) {
        net.sf.jsqlparser.schema.Table referencedTable = fkIndex.getTable();
        List<String> fromColumns = columnNames(fkIndex);
        if (referencedTable == null || fromColumns.isEmpty()) {
            return;
        }

        List<String> toColumns = fkIndex.getReferencedColumnNames() == null
                ? List.of("id")
                : fkIndex.getReferencedColumnNames().stream().map(DdlSchemaParser::cleanIdentifier).toList();

        String toSchema = schemaOf(referencedTable);
        String toTableName = cleanIdentifier(referencedTable.getName());

        Ref ref = new Ref(determineRelationshipType(project.findTable(schema, tableName), fromColumns))
                .from(schema, tableName, fromColumns.toArray(String[]::new))
                .to(toSchema, toTableName, toColumns.toArray(String[]::new));

        if (fkIndex.getName() != null) {
            ref.withName(cleanIdentifier(fkIndex.getName()));
        }
        ReferentialAction onDelete = toAction(fkIndex.getReferentialAction(Type.DELETE));
        if (onDelete != null) {
            ref.withOnDelete(onDelete);
        }
        ReferentialAction onUpdate = toAction(fkIndex.getReferentialAction(Type.UPDATE));
        if (onUpdate != null) {
            ref.withOnUpdate(onUpdate);
        }

        project.addRef(ref);
    }

    /**
     * A foreign key on a single unique (or primary key) column is one-to-one; anything else
     * is many-to-one.
     */
    private static RelationshipType determineRelationshipType(Table fromTable, List<String> fromColumns) {
        if (fromTable == null || fromColumns.size() != 1) {
            return RelationshipType.MANY_TO_ONE;
        }

        String columnName = fromColumns.get(0);
        Column column = fromTable.findColumn(columnName);
        if (column != null && (column.getSettings().isPrimaryKey() || column.getSettings().isUnique())) {
            return RelationshipType.ONE_TO_ONE;
        }

        boolean uniqueIndex = fromTable.getIndexes().stream()
                .anyMatch(idx -> idx.isUnique()
                        && idx.getColumns().size() == 1
                        && columnName.equalsIgnoreCase(idx.getColumns().get(0).getName()));
        return uniqueIndex ? RelationshipType.ONE_TO_ONE : RelationshipType.MANY_TO_ONE;
    }

    private static ReferentialAction toAction(net.sf.jsqlparser.statement.ReferentialAction action) {
        if (action == null || action.getAction() == null) {
            return null;
        }
        try {
            return ReferentialAction.fromKeyword(action.getAction().name());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unsupported referential action: {}", action.getAction());
            return null;
        }
    }

    private static String formatType(ColDataType dataType) {
        List<String> arguments = dataType.getArgumentsStringList();
        if (arguments == null || arguments.isEmpty()) {
            return dataType.getDataType();
        }
        return dataType.getDataType() + "(" + String.join(",", arguments) + ")";
    }

    private static List<String> columnNames(net.sf.jsqlparser.statement.create.table.Index index) {
        if (index.getColumnsNames() == null) {
            return List.of();
        }
        return index.getColumnsNames().stream()
                .map(DdlSchemaParser::cleanIdentifier)
                .toList();
    }

    private static String schemaOf(net.sf.jsqlparser.schema.Table table) {
        String schema = cleanIdentifier(table.getSchemaName());
        return schema == null || schema.isEmpty() ? SchemaNames.DEFAULT_SCHEMA : schema;
    }

    private static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;

        return identifier.replaceAll("[\\[\\]`\"]", "");
    }
}
