package com.orthosense.domain;

/**
 * Disjoint exercise families, one per pluggable classifier.
 */
public enum ExerciseFamily {
    LEGS,
    ARMS,
    NONE
}
