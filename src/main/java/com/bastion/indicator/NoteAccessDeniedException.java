package com.bastion.indicator;

/**
 * The note does not exist or belongs to another user. Both cases are
 * reported the same way.
 */
public class NoteAccessDeniedException extends RuntimeException {

    public NoteAccessDeniedException() {
        super("Note not found or access denied");
    }
}
