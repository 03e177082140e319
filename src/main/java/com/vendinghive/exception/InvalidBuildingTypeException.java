package com.vendinghive.exception;

public class InvalidBuildingTypeException extends InvalidRequestException {

    public InvalidBuildingTypeException(String value) {
        super("building_types", "Invalid building type: " + value);
    }
}
