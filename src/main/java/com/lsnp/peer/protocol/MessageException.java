package com.lsnp.peer.protocol;

/**
 * Thrown when a message cannot be decoded or a required field is missing or invalid.
 */
public class MessageException extends Exception {

    public MessageException(String message) {
        super(message);
    }

    public MessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
