package com.di.ladder.exception;

import com.di.ladder.model.Tier;
import lombok.Getter;

/**
 * The tier-scoped admission lock could not be taken, or the transaction holding it aborted.
 * Transient: retry the whole admission.
 */
@Getter
public class AssignmentContentionException extends LadderException {

    private final String entityKind;
    private final Tier tier;

    public AssignmentContentionException(String entityKind, Tier tier, String message) {
        super(message);
        this.entityKind = entityKind;
        this.tier = tier;
    }

    public AssignmentContentionException(String entityKind, Tier tier, String message, Throwable cause) {
        super(message, cause);
        this.entityKind = entityKind;
        this.tier = tier;
    }
}
