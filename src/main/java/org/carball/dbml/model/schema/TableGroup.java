package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class TableGroup {
    private String name;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TableRef> tables = new ArrayList<>();

    public TableGroup(String name) {
        this.name = name;
    }

    public TableGroup addTable(String schema, String tableName) {
        tables.add(new TableRef(schema, tableName));
        return this;
    }

    public void validate() throws ValidationException {
        if (Fields.isEmpty(name)) {
            throw new ValidationException("TableGroup.Name", "name is required");
        }
        if (Fields.isEmpty(tables)) {
            throw new ValidationException("TableGroup.Tables", "at least one table is required");
        }

        for (int i = 0; i < tables.size(); i++) {
            TableRef tableRef = tables.get(i);
            if (tableRef == null || Fields.isEmpty(tableRef.getSchema())) {
                throw new ValidationException("TableGroup.Tables[" + i + "].Schema", "schema is required");
            }
            if (Fields.isEmpty(tableRef.getName())) {
                throw new ValidationException("TableGroup.Tables[" + i + "].Name", "name is required");
            }
        }
    }
}
