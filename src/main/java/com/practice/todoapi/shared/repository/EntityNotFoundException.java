package com.practice.todoapi.shared.repository;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RepositoryException {

    private final Long id;

    public EntityNotFoundException(Long id) {
        super("NotFound, id is " + id);
        this.id = id;
    }
}
