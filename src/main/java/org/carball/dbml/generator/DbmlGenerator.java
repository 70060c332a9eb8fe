package org.carball.dbml.generator;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbml.model.schema.Column;
import org.carball.dbml.model.schema.ColumnSettings;
import org.carball.dbml.model.schema.Index;
import org.carball.dbml.model.schema.IndexColumn;
import org.carball.dbml.model.schema.InlineRef;
import org.carball.dbml.model.schema.Project;
import org.carball.dbml.model.schema.Ref;
import org.carball.dbml.model.schema.RefEndpoint;
import org.carball.dbml.model.schema.RelationshipType;
import org.carball.dbml.model.schema.SchemaEnum;
import org.carball.dbml.model.schema.SchemaNames;
import org.carball.dbml.model.schema.Table;
import org.carball.dbml.model.schema.TableGroup;
import org.carball.dbml.model.schema.TableRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a schema graph as a DBML document.
 *
 * <p>Output order is fixed: project header, enums, tables, refs, table groups, one blank line
 * after each block. The generator does not validate; incomplete fragments (a ref without an
 * endpoint, a column without settings) render as much as they can instead of failing.
 */
@Slf4j
public class DbmlGenerator {

    public String generate(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        StringBuilder dbml = new StringBuilder();

        if (!isEmpty(project.getName())) {
            dbml.append(generateProjectHeader(project));
            dbml.append("\n");
        }

        for (SchemaEnum schemaEnum : valuesOf(project.getEnums())) {
            dbml.append(generateEnum(schemaEnum));
            dbml.append("\n");
        }

        for (Table table : valuesOf(project.getTables())) {
            dbml.append(generateTable(table));
            dbml.append("\n");
        }

        for (Ref ref : nonNull(project.getRefs())) {
            dbml.append(generateRef(ref));
            dbml.append("\n");
        }

        for (TableGroup group : nonNull(project.getTableGroups())) {
            dbml.append(generateTableGroup(group));
            dbml.append("\n");
        }

        log.debug("Generated DBML for project '{}': {} tables, {} enums, {} refs, {} table groups",
                project.getName(), sizeOf(project.getTables()), sizeOf(project.getEnums()),
                sizeOf(project.getRefs()), sizeOf(project.getTableGroups()));
        return dbml.toString();
    }

    public String generateProjectHeader(Project project) {
        StringBuilder header = new StringBuilder();
        header.append(String.format(DbmlTemplate.PROJECT_HEADER, project.getName()));
        if (project.getDatabaseType() != null) {
            header.append(String.format(DbmlTemplate.PROJECT_DATABASE_TYPE, project.getDatabaseType()));
        }
        if (project.getNote() != null) {
            header.append(String.format(DbmlTemplate.PROJECT_NOTE, escape(project.getNote())));
        }
        header.append(DbmlTemplate.BLOCK_CLOSE);
        return header.toString();
    }

    public String generateTable(Table table) {
        StringBuilder block = new StringBuilder();

        String tableName = SchemaNames.qualify(table.getSchema(), table.getName());
        if (table.getAlias() != null) {
            tableName += String.format(DbmlTemplate.TABLE_ALIAS, table.getAlias());
        }
        block.append(String.format(DbmlTemplate.TABLE_HEADER, tableName));

        if (table.getSettings() != null && !table.getSettings().isEmpty()) {
            List<String> settings = new ArrayList<>();
            for (Map.Entry<String, String> setting : table.getSettings().entrySet()) {
                settings.add(String.format(DbmlTemplate.SETTING, setting.getKey(), setting.getValue()));
            }
            block.append(settingsList(settings));
        }
        block.append(DbmlTemplate.BLOCK_OPEN);

        for (Column column : nonNull(table.getColumns())) {
            block.append(DbmlTemplate.INDENT).append(generateColumn(column)).append("\n");
        }

        List<Index> indexes = nonNull(table.getIndexes());
        if (!indexes.isEmpty()) {
            block.append(DbmlTemplate.INDEXES_OPEN);
            for (Index index : indexes) {
                block.append(DbmlTemplate.INDENT).append(DbmlTemplate.INDENT)
                        .append(generateIndex(index)).append("\n");
            }
            block.append(DbmlTemplate.INDEXES_CLOSE);
        }

        if (table.getNote() != null) {
            block.append(String.format(DbmlTemplate.BLOCK_NOTE, escape(table.getNote())));
        }

        block.append(DbmlTemplate.BLOCK_CLOSE);
        return block.toString();
    }

    public String generateColumn(Column column) {
        StringBuilder line = new StringBuilder();
        line.append(text(column.getName())).append(" ").append(text(column.getType()));

        List<String> settings = new ArrayList<>();
        ColumnSettings columnSettings = column.getSettings();
        if (columnSettings != null) {
            if (columnSettings.isPrimaryKey()) {
                settings.add("pk");
            }
            if (columnSettings.isUnique()) {
                settings.add("unique");
            }
            if (!columnSettings.isNullable()) {
                settings.add("not null");
            }
            if (columnSettings.isIncrement()) {
                settings.add("increment");
            }
            if (columnSettings.getDefaultValue() != null) {
                settings.add(String.format(DbmlTemplate.SETTING, "default", columnSettings.getDefaultValue()));
            }
            if (columnSettings.getCheck() != null) {
                settings.add(String.format(DbmlTemplate.QUOTED_SETTING, "check", escape(columnSettings.getCheck())));
            }
        }

        InlineRef inlineRef = column.getInlineRef();
        if (inlineRef != null) {
            String target = text(inlineRef.getSchema()) + "." + text(inlineRef.getTable()) + "." + text(inlineRef.getColumn());
            settings.add(String.format(DbmlTemplate.SETTING, "ref", symbol(inlineRef.getType()) + " " + target));
        }

        if (column.getNote() != null) {
            settings.add(String.format(DbmlTemplate.QUOTED_SETTING, "note", escape(column.getNote())));
        }

        if (!settings.isEmpty()) {
            line.append(settingsList(settings));
        }
        return line.toString();
    }

    public String generateIndex(Index index) {
        StringBuilder line = new StringBuilder();

        List<String> columns = new ArrayList<>();
        for (IndexColumn column : nonNull(index.getColumns())) {
            if (column.getName() != null) {
                columns.add(column.getName());
            } else if (column.getExpression() != null) {
                columns.add("`" + column.getExpression() + "`");
            }
        }
        line.append("(").append(String.join(", ", columns)).append(")");

        List<String> settings = new ArrayList<>();
        if (index.isPrimaryKey()) {
            settings.add("pk");
        }
        if (index.isUnique()) {
            settings.add("unique");
        }
        if (index.getType() != null) {
            settings.add(String.format(DbmlTemplate.SETTING, "type", index.getType()));
        }
        if (index.getName() != null) {
            settings.add(String.format(DbmlTemplate.QUOTED_SETTING, "name", escape(index.getName())));
        }
        if (index.getNote() != null) {
            settings.add(String.format(DbmlTemplate.QUOTED_SETTING, "note", escape(index.getNote())));
        }

        if (!settings.isEmpty()) {
            line.append(settingsList(settings));
        }
        return line.toString();
    }

    public String generateRef(Ref ref) {
        StringBuilder block = new StringBuilder();

        if (ref.getName() != null) {
            block.append(String.format(DbmlTemplate.NAMED_REF, ref.getName()));
        } else {
            block.append(DbmlTemplate.REF);
        }

        List<String> settings = new ArrayList<>();
        if (ref.getOnDelete() != null) {
            settings.add(String.format(DbmlTemplate.SETTING, "delete", ref.getOnDelete().getKeyword()));
        }
        if (ref.getOnUpdate() != null) {
            settings.add(String.format(DbmlTemplate.SETTING, "update", ref.getOnUpdate().getKeyword()));
        }
        if (ref.getColor() != null) {
            settings.add(String.format(DbmlTemplate.SETTING, "color", ref.getColor()));
        }
        if (!settings.isEmpty()) {
            block.append(settingsList(settings));
        }

        block.append(DbmlTemplate.BLOCK_OPEN);
        block.append(String.format(DbmlTemplate.REF_LINE,
                formatEndpoint(ref.getLeft()), symbol(ref.getType()), formatEndpoint(ref.getRight())));
        block.append(DbmlTemplate.BLOCK_CLOSE);
        return block.toString();
    }

    public String generateEnum(SchemaEnum schemaEnum) {
        StringBuilder block = new StringBuilder();
        block.append(String.format(DbmlTemplate.ENUM_HEADER,
                SchemaNames.qualify(schemaEnum.getSchema(), schemaEnum.getName())));

        for (String value : nonNull(schemaEnum.getValues())) {
            block.append(DbmlTemplate.INDENT).append(formatEnumValue(value)).append("\n");
        }

        if (schemaEnum.getNote() != null) {
            block.append(String.format(DbmlTemplate.BLOCK_NOTE, escape(schemaEnum.getNote())));
        }

        block.append(DbmlTemplate.BLOCK_CLOSE);
        return block.toString();
    }

    public String generateTableGroup(TableGroup group) {
        StringBuilder block = new StringBuilder();
        block.append(String.format(DbmlTemplate.TABLE_GROUP_HEADER, text(group.getName())));

        for (TableRef tableRef : nonNull(group.getTables())) {
            block.append(DbmlTemplate.INDENT)
                    .append(SchemaNames.qualify(tableRef.getSchema(), tableRef.getName()))
                    .append("\n");
        }

        block.append(DbmlTemplate.BLOCK_CLOSE);
        return block.toString();
    }

    /**
     * Backslash-escapes single quotes for use inside a single-quoted DBML string.
     */
    public static String escape(String value) {
        return value.replace("'", "\\'");
    }

    private String formatEndpoint(RefEndpoint endpoint) {
        if (endpoint == null) {
            return "";
        }

        String tableName = SchemaNames.qualify(endpoint.getSchema(), endpoint.getTable());
        List<String> columns = endpoint.getColumns() == null ? List.of()
                : endpoint.getColumns().stream().map(DbmlGenerator::text).toList();
        if (columns.size() == 1) {
            return tableName + "." + columns.get(0);
        }
        // Composite key
        return tableName + ".(" + String.join(", ", columns) + ")";
    }

    private String formatEnumValue(String value) {
        if (value == null) {
            return "";
        }
        if (!value.contains(" ")) {
            return value;
        }
        StringBuilder quoted = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private String settingsList(List<String> settings) {
        return " [" + String.join(", ", settings) + "]";
    }

    private static String symbol(RelationshipType type) {
        return type == null ? "" : type.getSymbol();
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static <T> List<T> valuesOf(Map<String, T> map) {
        if (map == null) {
            return List.of();
        }
        return nonNull(map.values());
    }

    private static <T> List<T> nonNull(Collection<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    private static int sizeOf(Collection<?> values) {
        return values == null ? 0 : values.size();
    }

    private static int sizeOf(Map<?, ?> values) {
        return values == null ? 0 : values.size();
    }
}
