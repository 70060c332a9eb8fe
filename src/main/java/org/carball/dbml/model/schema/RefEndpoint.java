package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * One side of a relationship. More than one column makes it a composite key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefEndpoint {
    private String schema;
    private String table;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> columns = new ArrayList<>();

    public void validate() throws ValidationException {
        if (Fields.isEmpty(schema)) {
            throw new ValidationException("RefEndpoint.Schema", "schema is required");
        }
        if (Fields.isEmpty(table)) {
            throw new ValidationException("RefEndpoint.Table", "table is required");
        }
        if (Fields.isEmpty(columns)) {
            throw new ValidationException("RefEndpoint.Columns", "at least one column is required");
        }
    }
}
