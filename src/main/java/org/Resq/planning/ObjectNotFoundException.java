package org.Resq.planning;

import lombok.Getter;

/**
 * Raised when a referenced scenario object id is absent from the supplied snapshot.
 *
 * <p>Domain construction aborts on this error; no partially built domain escapes.</p>
 */
@Getter
public final class ObjectNotFoundException extends PlanningException {
    public static final String REASON_OBJECT_NOT_FOUND = "OBJECT_NOT_FOUND";

    /** Kind of the missing object, e.g. {@code hospital}. */
    private final String objectKind;
    /** The id that could not be resolved. */
    private final String objectId;

    public ObjectNotFoundException(String objectKind, String objectId) {
        super(REASON_OBJECT_NOT_FOUND, objectKind + " not found: " + objectId);
        this.objectKind = objectKind;
        this.objectId = objectId;
    }
}
