package com.di.ladder.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends LadderException {

    private final String entityKind;
    private final long entityId;

    public EntityNotFoundException(String entityKind, long entityId) {
        super(entityKind + " " + entityId + " not found");
        this.entityKind = entityKind;
        this.entityId = entityId;
    }
}
