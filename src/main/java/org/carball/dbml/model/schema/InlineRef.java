package org.carball.dbml.model.schema;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

/**
 * Relationship declared as a setting of the referencing column.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InlineRef {
    private RelationshipType type;
    private String schema;
    private String table;
    private String column;

    public void validate() throws ValidationException {
        if (Fields.isEmpty(schema)) {
            throw new ValidationException("InlineRef.Schema", "schema is required");
        }
        if (Fields.isEmpty(table)) {
            throw new ValidationException("InlineRef.Table", "table is required");
        }
        if (Fields.isEmpty(column)) {
            throw new ValidationException("InlineRef.Column", "column is required");
        }
        if (type == null) {
            throw new ValidationException("InlineRef.Type", "relationship type is required");
        }
    }
}
