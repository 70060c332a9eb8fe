package org.carball.dbml.validation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The first structural problem found in a schema graph.
 *
 * <p>The exception raised by a leaf check carries the offending field (e.g. {@code Column.Type})
 * and a human-readable reason. Each enclosing element re-throws it through {@link #within(String)},
 * which prepends a location segment such as {@code table public.users} or {@code column 1} and
 * keeps the original exception as the cause.
 */
@Getter
public class ValidationException extends Exception {

    private final String field;
    private final String reason;
    private final List<String> location;

    public ValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
        this.location = List.of();
    }

    private ValidationException(String segment, ValidationException cause) {
        super(segment + ": " + cause.getMessage(), cause);
        this.field = cause.field;
        this.reason = cause.reason;
        List<String> segments = new ArrayList<>(cause.location.size() + 1);
        segments.add(segment);
        segments.addAll(cause.location);
        this.location = Collections.unmodifiableList(segments);
    }

    /**
     * Wraps this exception with the location of the element that contains the failing one.
     */
    public ValidationException within(String segment) {
        return new ValidationException(segment, this);
    }

    /**
     * Full path to the failing field, outermost element first.
     */
    public String getPath() {
        if (location.isEmpty()) {
            return field;
        }
        return String.join(": ", location) + ": " + field;
    }
}
