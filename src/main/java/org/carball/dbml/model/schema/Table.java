package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class Table {
    public static final String HEADER_COLOR_SETTING = "headercolor";

    private String schema = SchemaNames.DEFAULT_SCHEMA;
    private String name;
    private String alias;
    private String note;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, String> settings = new LinkedHashMap<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Column> columns = new ArrayList<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Index> indexes = new ArrayList<>();

    public Table(String name) {
        this.name = name;
    }

    public Table withSchema(String schema) {
        this.schema = schema;
        return this;
    }

    public Table withAlias(String alias) {
        this.alias = alias;
        return this;
    }

    public Table withNote(String note) {
        this.note = note;
        return this;
    }

    /**
     * Adds a header setting; settings render in the order they were added.
     */
    public Table withSetting(String key, String value) {
        settings.put(key, value);
        return this;
    }

    public Table withHeaderColor(String color) {
        return withSetting(HEADER_COLOR_SETTING, color);
    }

    public Table addColumn(Column column) {
        columns.add(column);
        return this;
    }

    public Table addIndex(Index index) {
        indexes.add(index);
        return this;
    }

    public Column findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c != null && c.getName() != null && c.getName().equalsIgnoreCase(columnName))
                .findFirst()
                .orElse(null);
    }

    public void validate() throws ValidationException {
        if (Fields.isEmpty(name)) {
            throw new ValidationException("Table.Name", "name is required");
        }
        if (Fields.isEmpty(schema)) {
            throw new ValidationException("Table.Schema", "schema is required");
        }
        if (Fields.isEmpty(columns)) {
            throw new ValidationException("Table.Columns", "at least one column is required");
        }

        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            try {
                if (column == null) {
                    throw new ValidationException("Column", "column definition is missing");
                }
                column.validate();
            } catch (ValidationException e) {
                throw e.within("column " + i);
            }
        }

        if (indexes == null) {
            return;
        }
        for (int i = 0; i < indexes.size(); i++) {
            Index index = indexes.get(i);
            try {
                if (index == null) {
                    throw new ValidationException("Index", "index definition is missing");
                }
                index.validate();
            } catch (ValidationException e) {
                throw e.within("index " + i);
            }
        }
    }
}
