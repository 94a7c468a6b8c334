package com.project.image.depix.exceptions;

/** A pixel read or block extraction fell outside the image it was taken from. */
public class GeometryException extends DepixException {
    public GeometryException(String message) { super(message); }
}
