package com.bastion.whitelist;

public class DuplicateWhitelistEntryException extends RuntimeException {

    public DuplicateWhitelistEntryException(String value) {
        super("Value is already whitelisted: " + value);
    }
}
