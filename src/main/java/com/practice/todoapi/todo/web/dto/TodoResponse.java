package com.practice.todoapi.todo.web.dto;

import com.practice.todoapi.todo.domain.model.Todo;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TodoResponse {
    Long id;
    String text;
    boolean completed;

    public static TodoResponse from(Todo todo) {
        return TodoResponse.builder()
                .id(todo.getId())
                .text(todo.getText())
                .completed(todo.isCompleted())
                .build();
    }
}
