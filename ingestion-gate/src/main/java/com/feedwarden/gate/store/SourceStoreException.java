package com.feedwarden.gate.store;

import org.springframework.dao.NonTransientDataAccessException;

/**
 * A persisted source row could not be read or written.
 */
public class SourceStoreException extends NonTransientDataAccessException {

    public SourceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
