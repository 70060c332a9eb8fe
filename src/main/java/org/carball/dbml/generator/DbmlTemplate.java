package org.carball.dbml.generator;

public final class DbmlTemplate {

    private DbmlTemplate() {
    }

    public static final String INDENT = "  ";

    public static final String PROJECT_HEADER = "Project %s {\n";
    public static final String PROJECT_DATABASE_TYPE = "  database_type: '%s'\n";
    public static final String PROJECT_NOTE = "  Note: '%s'\n";

    public static final String TABLE_HEADER = "Table %s";
    public static final String TABLE_ALIAS = " as %s";
    public static final String INDEXES_OPEN = "\n  indexes {\n";
    public static final String INDEXES_CLOSE = "  }\n";

    // Notes that trail a body are separated from it by a blank line
    public static final String BLOCK_NOTE = "\n  Note: '%s'\n";

    public static final String BLOCK_OPEN = " {\n";
    public static final String BLOCK_CLOSE = "}\n";

    public static final String SETTING = "%s: %s";
    public static final String QUOTED_SETTING = "%s: '%s'";

    public static final String REF = "Ref";
    public static final String NAMED_REF = "Ref %s";
    public static final String REF_LINE = "  %s %s %s\n";

    public static final String ENUM_HEADER = "Enum %s {\n";
    public static final String TABLE_GROUP_HEADER = "TableGroup %s {\n";
}
