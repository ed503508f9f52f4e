package dev.lexiglow.entity;

/**
 * Learning progress of a vocabulary item.
 */
public enum VocabularyItemStatus {
    NEW,
    LEARNING,
    KNOWN,
    MASTERED
}
