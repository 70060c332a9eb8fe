package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbml.generator.DbmlGenerator;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the schema graph.
 *
 * <p>Tables and enums are keyed by {@code schema.name} and kept in insertion order, which is
 * also the order in which they are generated. {@link #validate()} and {@link #generate()} only
 * read the graph; neither may run while another thread mutates it.
 */
@Data
@NoArgsConstructor
@Slf4j
public class Project {
    private String name;
    private String databaseType;
    private String note;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, Table> tables = new LinkedHashMap<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, SchemaEnum> enums = new LinkedHashMap<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Ref> refs = new ArrayList<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TableGroup> tableGroups = new ArrayList<>();

    public Project(String name) {
        this.name = name;
    }

    public Project withDatabaseType(String databaseType) {
        this.databaseType = databaseType;
        return this;
    }

    public Project withNote(String note) {
        this.note = note;
        return this;
    }

    /**
     * Adds a table under {@code schema.name}, replacing any table already stored under that key.
     *
     * <p>The key is taken when the table is added. Renaming the table or changing its schema
     * afterwards does not re-key it: {@link #findTable} and validation locations keep using the
     * original key. Set schema and name before adding, or add the table again under its new key.
     */
    public Project addTable(Table table) {
        tables.put(SchemaNames.key(table.getSchema(), table.getName()), table);
        return this;
    }

    /**
     * Adds an enum under {@code schema.name}; keyed once, like {@link #addTable}.
     */
    public Project addEnum(SchemaEnum schemaEnum) {
        enums.put(SchemaNames.key(schemaEnum.getSchema(), schemaEnum.getName()), schemaEnum);
        return this;
    }

    public Project addRef(Ref ref) {
        refs.add(ref);
        return this;
    }

    public Project addTableGroup(TableGroup group) {
        tableGroups.add(group);
        return this;
    }

    public Table findTable(String schema, String tableName) {
        return tables.get(SchemaNames.key(schema, tableName));
    }

    /**
     * Checks the whole graph and stops at the first problem.
     *
     * <p>Order: project fields, tables (columns, then indexes), enums, refs, table groups.
     */
    public void validate() throws ValidationException {
        try {
            validateGraph();
        } catch (ValidationException e) {
            log.debug("Project '{}' failed validation at {}", name, e.getPath());
            throw e;
        }
        log.debug("Project '{}' is valid: {} tables, {} enums, {} refs, {} table groups",
                name, tables.size(), enums.size(), refs.size(), tableGroups.size());
    }

    private void validateGraph() throws ValidationException {
        if (Fields.isEmpty(name)) {
            throw new ValidationException("Project.Name", "name is required");
        }

        for (Map.Entry<String, Table> entry : tables.entrySet()) {
            try {
                if (entry.getValue() == null) {
                    throw new ValidationException("Table", "table definition is missing");
                }
                entry.getValue().validate();
            } catch (ValidationException e) {
                throw e.within("table " + entry.getKey());
            }
        }

        for (Map.Entry<String, SchemaEnum> entry : enums.entrySet()) {
            try {
                if (entry.getValue() == null) {
                    throw new ValidationException("Enum", "enum definition is missing");
                }
                entry.getValue().validate();
            } catch (ValidationException e) {
                throw e.within("enum " + entry.getKey());
            }
        }

        for (int i = 0; i < refs.size(); i++) {
            try {
                if (refs.get(i) == null) {
                    throw new ValidationException("Ref", "ref definition is missing");
                }
                refs.get(i).validate();
            } catch (ValidationException e) {
                throw e.within("ref " + i);
            }
        }

        for (int i = 0; i < tableGroups.size(); i++) {
            try {
                if (tableGroups.get(i) == null) {
                    throw new ValidationException("TableGroup", "table group definition is missing");
                }
                tableGroups.get(i).validate();
            } catch (ValidationException e) {
                throw e.within("table_group " + i);
            }
        }
    }

    /**
     * Renders this project as a DBML document.
     */
    public String generate() {
        return new DbmlGenerator().generate(this);
    }
}
