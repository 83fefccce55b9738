package com.work.validator.core.exception;

public class UnauthorizedException extends ValidatorManagerException {

    private final String sender;

    public UnauthorizedException(String sender) {
        super(ErrorKind.AUTHORIZATION, "UnauthorizedOwner", "caller " + sender + " is not allowed");
        this.sender = sender;
    }

    public String getSender() {
        return sender;
    }
}
