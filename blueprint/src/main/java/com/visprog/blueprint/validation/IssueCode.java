package com.visprog.blueprint.validation;

/** Stable identifiers for validation findings, so callers need not parse messages. */
public enum IssueCode {
    EMPTY_GRAPH,
    MISSING_ENTRY,
    MULTIPLE_ENTRY,
    MISSING_EXIT,
    DANGLING_EDGE,
    SELF_LOOP,
    CONTROL_FROM_EXIT,
    CONTROL_INTO_ENTRY,
    DATA_TOUCHES_ENTRY,
    DATA_FROM_EXIT,
    NO_CONTROL_FLOW,
    DUPLICATE_EDGE,
    ENTRY_HAS_INCOMING,
    ENTRY_HAS_NO_OUTGOING,
    EXIT_HAS_OUTGOING,
    EXIT_HAS_NO_INCOMING,
    UNREACHABLE_NODES,
    CONTROL_CYCLE,
    VARIABLE_TO_VARIABLE_DATA
}
