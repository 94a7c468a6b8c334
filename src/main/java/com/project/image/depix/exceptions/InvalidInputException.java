package com.project.image.depix.exceptions;

/**
 * Rejected input: unreadable image, malformed background color, unknown averaging mode.
 * Raised before the engine starts working on the images.
 */
public class InvalidInputException extends DepixException {
    public InvalidInputException(String message) { super(message); }
    public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
