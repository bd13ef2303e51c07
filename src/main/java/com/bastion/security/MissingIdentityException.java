package com.bastion.security;

/**
 * An operation that must be attributed to a user was called without a user id.
 */
public class MissingIdentityException extends RuntimeException {

    public MissingIdentityException() {
        super("Authenticated user required");
    }
}
