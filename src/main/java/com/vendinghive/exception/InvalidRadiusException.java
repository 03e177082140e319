package com.vendinghive.exception;

public class InvalidRadiusException extends InvalidRequestException {

    public InvalidRadiusException(Object value) {
        super("radius", "Invalid radius: " + value + ". Use one of 5, 10, 15, 20, 25, 30, 40 miles.");
    }
}
