package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
public class Index {
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<IndexColumn> columns = new ArrayList<>();
    private String type;
    private String name;
    private String note;
    private boolean unique;
    private boolean primaryKey;

    public static Index on(String... columns) {
        Index index = new Index();
        index.columns = Arrays.stream(columns)
                .map(IndexColumn::column)
                .collect(Collectors.toCollection(ArrayList::new));
        return index;
    }

    public static Index onExpressions(String... expressions) {
        Index index = new Index();
        index.columns = Arrays.stream(expressions)
                .map(IndexColumn::expression)
                .collect(Collectors.toCollection(ArrayList::new));
        return index;
    }

    public Index withType(String type) {
        this.type = type;
        return this;
    }

    public Index withName(String name) {
        this.name = name;
        return this;
    }

    public Index withUnique() {
        this.unique = true;
        return this;
    }

    public Index withPrimaryKey() {
        this.primaryKey = true;
        return this;
    }

    public Index withNote(String note) {
        this.note = note;
        return this;
    }

    public void validate() throws ValidationException {
        if (Fields.isEmpty(columns)) {
            throw new ValidationException("Index.Columns", "at least one column is required");
        }

        for (int i = 0; i < columns.size(); i++) {
            IndexColumn column = columns.get(i);
            String field = "Index.Columns[" + i + "]";
            if (column == null || (column.getName() == null && column.getExpression() == null)) {
                throw new ValidationException(field, "either name or expression is required");
            }
            if (column.getName() != null && column.getExpression() != null) {
                throw new ValidationException(field, "cannot have both name and expression");
            }
        }
    }
}
