package dev.lexiglow.entity;

/**
 * CEFR proficiency levels, lowest first.
 */
public enum ProficiencyLevel {
    A1, A2, B1, B2, C1, C2
}
