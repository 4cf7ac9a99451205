package com.practice.todoapi.todo.infrastructure.persistence.memory;

import java.util.List;
import java.util.Optional;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import com.practice.todoapi.shared.memory.InMemoryStore;
import com.practice.todoapi.todo.domain.model.CreateTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;
import com.practice.todoapi.todo.domain.repository.TodoRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@Profile("memory")
public class TodoRepositoryInMemory implements TodoRepository {

    private final InMemoryStore<Todo> store = new InMemoryStore<>(Todo::copy);

    @Override
    public Todo create(CreateTodo payload) {
        Todo todo = store.insert(id -> new Todo(id, payload.getText()));
        log.debug("Created todo {}", todo.getId());
        return todo;
    }

    @Override
    public Optional<Todo> find(Long id) {
        return store.get(id);
    }

    @Override
    public List<Todo> all() {
        return store.values();
    }

    @Override
    public Todo update(Long id, UpdateTodo payload) {
        Todo todo = store.modify(id, stored -> stored.apply(payload));
        log.debug("Updated todo {}", id);
        return todo;
    }

    @Override
    public void delete(Long id) {
        store.remove(id);
        log.debug("Deleted todo {}", id);
    }
}
