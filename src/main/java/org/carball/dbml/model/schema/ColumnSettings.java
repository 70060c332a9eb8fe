package org.carball.dbml.model.schema;

import lombok.Data;

@Data
public class ColumnSettings {
    private boolean primaryKey;
    private boolean nullable;
    private boolean unique;
    private boolean increment;
    private String defaultValue;
    private String check;
}
