package org.carball.dbml.model.schema;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

@Data
@NoArgsConstructor
public class Column {
    private String name;
    private String type;
    private ColumnSettings settings;
    private String note;
    private InlineRef inlineRef;

    public Column(String name, String type) {
        this.name = name;
        this.type = type;
        this.settings = new ColumnSettings();
    }

    public Column withPrimaryKey() {
        settings().setPrimaryKey(true);
        return this;
    }

    public Column withNull() {
        settings().setNullable(true);
        return this;
    }

    public Column withUnique() {
        settings().setUnique(true);
        return this;
    }

    public Column withIncrement() {
        settings().setIncrement(true);
        return this;
    }

    /**
     * Default expression, emitted verbatim: quote string literals yourself ({@code "'pending'"}).
     */
    public Column withDefault(String value) {
        settings().setDefaultValue(value);
        return this;
    }

    public Column withCheck(String constraint) {
        settings().setCheck(constraint);
        return this;
    }

    public Column withNote(String note) {
        this.note = note;
        return this;
    }

    public Column withRef(RelationshipType type, String schema, String table, String column) {
        this.inlineRef = new InlineRef(type, schema, table, column);
        return this;
    }

    public void validate() throws ValidationException {
        if (Fields.isEmpty(name)) {
            throw new ValidationException("Column.Name", "name is required");
        }
        if (Fields.isEmpty(type)) {
            throw new ValidationException("Column.Type", "type is required");
        }
        if (inlineRef != null) {
            try {
                inlineRef.validate();
            } catch (ValidationException e) {
                throw e.within("inline_ref");
            }
        }
    }

    private ColumnSettings settings() {
        if (settings == null) {
            settings = new ColumnSettings();
        }
        return settings;
    }
}
