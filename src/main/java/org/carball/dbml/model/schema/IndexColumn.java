package org.carball.dbml.model.schema;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One part of an index: either a plain column name or an expression, never both.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexColumn {
    private String name;
    private String expression;

    public static IndexColumn column(String name) {
        return new IndexColumn(name, null);
    }

    public static IndexColumn expression(String expression) {
        return new IndexColumn(null, expression);
    }
}
