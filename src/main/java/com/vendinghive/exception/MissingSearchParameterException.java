package com.vendinghive.exception;

public class MissingSearchParameterException extends InvalidRequestException {

    public MissingSearchParameterException(String field) {
        super(field, "Missing required search parameter: " + field);
    }
}
