package org.carball.dbml.model.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action applied to dependent rows on delete or update of the referenced row.
 */
public enum ReferentialAction {
    CASCADE("cascade"),
    RESTRICT("restrict"),
    SET_NULL("set null"),
    SET_DEFAULT("set default"),
    NO_ACTION("no action");

    private final String keyword;

    ReferentialAction(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    @JsonCreator
    public static ReferentialAction fromKeyword(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('_', ' ').replaceAll("\\s+", " ");
        for (ReferentialAction action : values()) {
            if (action.keyword.equalsIgnoreCase(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown referential action: " + value);
    }
}
