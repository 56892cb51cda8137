package com.tradesim.exception;

import java.util.Map;

/** Lookup of an unknown id, e.g. a session that was never created or has been deleted. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String id) {
        super(ErrorCode.NOT_FOUND, resourceType + " " + id + " not found", Map.of("resource", resourceType, "id", id));
    }
}
