package com.advocacypacket.service.store;

/**
 * Entity ids become file names under the state and cache directories, so they must stay a single path segment.
 */
public final class EntityIds {
    private EntityIds() {
    }

    public static String requireSafe(String entityId) {
        if (entityId == null || entityId.isBlank() || entityId.equals(".") || entityId.equals("..")) {
            throw new InvalidEntityIdException(entityId);
        }
        if (entityId.indexOf('/') >= 0 || entityId.indexOf('\\') >= 0 || entityId.indexOf('\0') >= 0) {
            throw new InvalidEntityIdException(entityId);
        }
        return entityId;
    }
}
