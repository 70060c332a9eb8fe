package org.carball.dbml.model.schema;

import java.util.Collection;
import java.util.Map;

final class Fields {

    private Fields() {
    }

    static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    static boolean isEmpty(Map<?, ?> values) {
        return values == null || values.isEmpty();
    }
}
