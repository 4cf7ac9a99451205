package com.practice.todoapi.shared.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.function.UnaryOperator;

import com.practice.todoapi.shared.repository.EntityNotFoundException;

/**
 * Id-keyed entity map behind a read/write lock. Ids start at 1 and are never reused;
 * callers only ever see copies.
 */
public class InMemoryStore<E> {

    private final Map<Long, E> entities = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final UnaryOperator<E> copier;
    private long lastId;

    public InMemoryStore(UnaryOperator<E> copier) {
        this.copier = copier;
    }

    public E insert(LongFunction<E> factory) {
        lock.writeLock().lock();
        try {
            long id = ++lastId;
            E entity = factory.apply(id);
            entities.put(id, entity);
            return copier.apply(entity);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<E> get(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entities.get(id)).map(copier);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<E> values() {
        lock.readLock().lock();
        try {
            List<E> snapshot = new ArrayList<>(entities.size());
            for (E entity : entities.values()) {
                snapshot.add(copier.apply(entity));
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public E modify(long id, Consumer<E> mutation) {
        lock.writeLock().lock();
        try {
            E entity = entities.get(id);
            if (entity == null) {
                throw new EntityNotFoundException(id);
            }
            mutation.accept(entity);
            return copier.apply(entity);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(long id) {
        lock.writeLock().lock();
        try {
            if (entities.remove(id) == null) {
                throw new EntityNotFoundException(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
