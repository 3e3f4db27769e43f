package org.operaton.fedlink.exception;

import java.util.List;

/**
 * Exception thrown when a document matches none of the candidate types of a property.
 */
public class TypeMismatchException extends RuntimeException {

    private final List<String> attemptedTypes;

    public TypeMismatchException(List<String> attemptedTypes) {
        super("Expected an object of any type of: " + String.join(", ", attemptedTypes));
        this.attemptedTypes = List.copyOf(attemptedTypes);
    }

    public List<String> getAttemptedTypes() {
        return attemptedTypes;
    }
}
