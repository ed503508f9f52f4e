package dev.lexiglow.entity;

/**
 * Link between a text and a tag.
 */
public record TextTagAssociation(String textId, String tagId) {
}
