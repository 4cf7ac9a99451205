package com.practice.todoapi.shared.repository;

import lombok.Getter;

/**
 * Reserved for a future uniqueness constraint. No repository operation throws it yet.
 */
@Getter
public class DuplicateEntityException extends RepositoryException {

    private final Long id;

    public DuplicateEntityException(Long id) {
        super("Duplicate data, id is " + id);
        this.id = id;
    }
}
