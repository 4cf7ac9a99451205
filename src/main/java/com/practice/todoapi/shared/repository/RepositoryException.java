package com.practice.todoapi.shared.repository;

public abstract class RepositoryException extends RuntimeException {

    protected RepositoryException(String message) {
        super(message);
    }

    protected RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
