package com.practice.todoapi.shared.repository;

public class UnexpectedRepositoryException extends RepositoryException {

    public UnexpectedRepositoryException(String message, Throwable cause) {
        super("Unexpected Error: [" + message + "]", cause);
    }
}
