package dev.lexiglow.exception;

import lombok.Getter;

@Getter
public class DuplicateResourceException extends ConflictException {

    private final String field;
    private final Object value;

    public DuplicateResourceException(String resource, String field, Object value) {
        super(resource, String.format("%s already exists with %s: '%s'", resource, field, value));
        this.field = field;
        this.value = value;
    }
}
