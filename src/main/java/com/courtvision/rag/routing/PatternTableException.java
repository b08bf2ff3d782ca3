package com.courtvision.rag.routing;

/**
 * Raised while building the routing pattern table. Surfaces at application startup, never per request.
 */
public class PatternTableException extends IllegalStateException {

    private final String groupName;

    public PatternTableException(String groupName, String message) {
        super("Pattern group '" + groupName + "': " + message);
        this.groupName = groupName;
    }

    public PatternTableException(String groupName, String message, Throwable cause) {
        super("Pattern group '" + groupName + "': " + message, cause);
        this.groupName = groupName;
    }

    public String getGroupName() {
        return this.groupName;
    }
}
