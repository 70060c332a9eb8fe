package org.carball.dbml.model.schema;

/**
 * Naming rules shared by the schema model and the DBML generator.
 */
public final class SchemaNames {

    /** Schema that is implied when a name carries no qualifier. */
    public static final String DEFAULT_SCHEMA = "public";

    private SchemaNames() {
    }

    /**
     * Map key under which a table or enum is stored in a {@link Project}.
     */
    public static String key(String schema, String name) {
        return schema + "." + name;
    }

    /**
     * Display name of a schema object, eliding the default schema. A missing name renders empty.
     */
    public static String qualify(String schema, String name) {
        String bareName = name == null ? "" : name;
        if (schema == null || schema.isEmpty() || DEFAULT_SCHEMA.equals(schema)) {
            return bareName;
        }
        return schema + "." + bareName;
    }
}
