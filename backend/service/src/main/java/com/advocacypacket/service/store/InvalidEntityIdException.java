package com.advocacypacket.service.store;

public class InvalidEntityIdException extends IllegalArgumentException {
    public InvalidEntityIdException(String entityId) {
        super("Invalid entity id: '" + entityId + "'");
    }
}
