package com.visprog.blueprint.model;

/**
 * What a node is. Adding a constant forces every {@code switch} over kinds to be revisited,
 * starting with {@link #category()}.
 */
public enum NodeKind {
    ENTRY,
    EXIT,
    OPERATION,
    VARIABLE,
    VARIABLE_GET,
    VARIABLE_ASSIGN,
    CUSTOM;

    public NodeCategory category() {
        return switch (this) {
            case ENTRY -> NodeCategory.ENTRY;
            case EXIT -> NodeCategory.EXIT;
            case OPERATION -> NodeCategory.FUNCTION;
            case VARIABLE, VARIABLE_GET, VARIABLE_ASSIGN -> NodeCategory.VARIABLE;
            case CUSTOM -> NodeCategory.CUSTOM;
        };
    }
}
