package com.project.image.depix.exceptions;

/** Domain-specific exception for depixelization failures. */
public class DepixException extends RuntimeException {
    public DepixException(String message) { super(message); }
    public DepixException(String message, Throwable cause) { super(message, cause); }
}
