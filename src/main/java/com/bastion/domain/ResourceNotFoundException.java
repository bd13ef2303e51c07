package com.bastion.domain;

/**
 * Thrown when an entity addressed by id does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final Object id;

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public ResourceNotFoundException(String message) {
        super(message);
        this.resource = null;
        this.id = null;
    }

    public String getResource() {
        return resource;
    }

    public Object getId() {
        return id;
    }
}
