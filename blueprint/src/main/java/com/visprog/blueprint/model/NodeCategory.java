package com.visprog.blueprint.model;

/** Coarse grouping of node kinds used by the structural rules. */
public enum NodeCategory {
    ENTRY,
    EXIT,
    FUNCTION,
    VARIABLE,
    CUSTOM
}
