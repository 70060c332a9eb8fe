package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Enumeration type. Values keep their declaration order.
 */
@Data
@NoArgsConstructor
public class SchemaEnum {
    private String schema = SchemaNames.DEFAULT_SCHEMA;
    private String name;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> values = new ArrayList<>();
    private String note;

    public SchemaEnum(String name, String... values) {
        this.name = name;
        this.values = new ArrayList<>(Arrays.asList(values));
    }

    public SchemaEnum withSchema(String schema) {
        this.schema = schema;
        return this;
    }

    public SchemaEnum withNote(String note) {
        this.note = note;
        return this;
    }

    public void validate() throws ValidationException {
        if (Fields.isEmpty(name)) {
            throw new ValidationException("Enum.Name", "name is required");
        }
        if (Fields.isEmpty(schema)) {
            throw new ValidationException("Enum.Schema", "schema is required");
        }
        if (Fields.isEmpty(values)) {
            throw new ValidationException("Enum.Values", "at least one value is required");
        }
    }
}
