package com.vendinghive.exception;

public class InvalidMachineTypeException extends InvalidRequestException {

    public InvalidMachineTypeException(String value) {
        super("machine_type", "Invalid machine type: " + value);
    }
}
