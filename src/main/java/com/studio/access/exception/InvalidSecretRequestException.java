package com.studio.access.exception;

public class InvalidSecretRequestException extends RuntimeException {

    public InvalidSecretRequestException(String message) {
        super(message);
    }
}
