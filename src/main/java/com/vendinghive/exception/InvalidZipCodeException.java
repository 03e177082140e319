package com.vendinghive.exception;

public class InvalidZipCodeException extends InvalidRequestException {

    public InvalidZipCodeException(String zipCode, String reason) {
        super("zip_code", reason + ": " + zipCode);
    }
}
