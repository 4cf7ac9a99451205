package com.practice.todoapi.shared.persistence;

import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;

import com.practice.todoapi.shared.repository.UnexpectedRepositoryException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class DataAccessTranslator {

    private DataAccessTranslator() {
    }

    public static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.debug("{} failed", operation, e);
            throw new UnexpectedRepositoryException(operation + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
