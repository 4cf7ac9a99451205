package com.practice.todoapi.todo.domain.repository;

import java.util.List;
import java.util.Optional;

import com.practice.todoapi.todo.domain.model.CreateTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;

public interface TodoRepository {
    Todo create(CreateTodo payload);
    Optional<Todo> find(Long id);
    List<Todo> all();
    Todo update(Long id, UpdateTodo payload);
    void delete(Long id);
}
