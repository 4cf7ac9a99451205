package com.practice.todoapi.todo.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.practice.todoapi.todo.domain.model.CreateTodo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;
import com.practice.todoapi.todo.domain.repository.TodoRepository;
import com.practice.todoapi.todo.web.dto.TodoResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/todos")
@RequiredArgsConstructor
public class TodoController {

    private final TodoRepository todoRepository;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TodoResponse create(@Valid @RequestBody CreateTodo payload) {
        return TodoResponse.from(todoRepository.create(payload));
    }

    @GetMapping
    public List<TodoResponse> all() {
        return todoRepository.all().stream().map(TodoResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<TodoResponse> find(@PathVariable Long id) {
        return todoRepository.find(id)
                .map(TodoResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}")
    public TodoResponse update(@PathVariable Long id, @Valid @RequestBody UpdateTodo payload) {
        return TodoResponse.from(todoRepository.update(id, payload));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        todoRepository.delete(id);
    }
}
