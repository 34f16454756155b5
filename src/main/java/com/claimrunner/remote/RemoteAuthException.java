package com.claimrunner.remote;

public class RemoteAuthException extends RemoteCallException {

    public RemoteAuthException(String message) {
        super(message);
    }
}
