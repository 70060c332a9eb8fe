package org.carball.dbml.model.schema;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.dbml.validation.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Standalone relationship between two tables.
 */
@Data
@NoArgsConstructor
public class Ref {
    private RelationshipType type;
    private RefEndpoint left;
    private RefEndpoint right;
    private String name;
    private ReferentialAction onDelete;
    private ReferentialAction onUpdate;
    private String color;

    public Ref(RelationshipType type) {
        this.type = type;
    }

    public Ref withName(String name) {
        this.name = name;
        return this;
    }

    public Ref from(String schema, String table, String... columns) {
        this.left = new RefEndpoint(schema, table, new ArrayList<>(Arrays.asList(columns)));
        return this;
    }

    public Ref to(String schema, String table, String... columns) {
        this.right = new RefEndpoint(schema, table, new ArrayList<>(Arrays.asList(columns)));
        return this;
    }

    public Ref withOnDelete(ReferentialAction action) {
        this.onDelete = action;
        return this;
    }

    public Ref withOnUpdate(ReferentialAction action) {
        this.onUpdate = action;
        return this;
    }

    public Ref withColor(String color) {
        this.color = color;
        return this;
    }

    public void validate() throws ValidationException {
        if (left == null) {
            throw new ValidationException("Ref.Left", "left endpoint is required");
        }
        if (right == null) {
            throw new ValidationException("Ref.Right", "right endpoint is required");
        }
        if (type == null) {
            throw new ValidationException("Ref.Type", "relationship type is required");
        }

        try {
            left.validate();
        } catch (ValidationException e) {
            throw e.within("left");
        }
        try {
            right.validate();
        } catch (ValidationException e) {
            throw e.within("right");
        }

        int leftCount = left.getColumns().size();
        int rightCount = right.getColumns().size();
        if (leftCount != rightCount) {
            throw new ValidationException("Ref.Columns",
                    String.format("left and right column counts must match (%d != %d)", leftCount, rightCount));
        }
    }
}
