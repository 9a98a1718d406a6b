package com.mondayBi.biAgent.cleaning.model;

/**
 * Normalization class of a board column, resolved from its title.
 */
public enum ColumnType {
    DATE,
    CURRENCY,
    STATUS,
    TEXT,
    UNCLASSIFIED
}
