package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Cardinality of a relationship, rendered in DBML by its symbol.
 */
public enum RelationshipType {
    ONE_TO_MANY("<"),
    MANY_TO_ONE(">"),
    ONE_TO_ONE("-"),
    MANY_TO_MANY("<>");

    private final String symbol;

    RelationshipType(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /**
     * Accepts either the DBML symbol ({@code >}) or the constant name ({@code many_to_one}).
     */
    @JsonCreator
    public static RelationshipType fromSymbol(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (RelationshipType type : values()) {
            if (type.symbol.equals(trimmed) || type.name().equalsIgnoreCase(trimmed.replace('-', '_'))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + value);
    }
}
