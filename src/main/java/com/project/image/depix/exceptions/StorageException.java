package com.project.image.depix.exceptions;

/** Failure to create an output directory or write an image. */
public class StorageException extends DepixException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
