package com.practice.todoapi.todo.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Todo {
    private Long id;
    private String text;
    private boolean completed;

    public Todo(Long id, String text) {
        this(id, text, false);
    }

    public void apply(UpdateTodo payload) {
        if (payload.getText() != null) {
            this.text = payload.getText();
        }
        if (payload.getCompleted() != null) {
            this.completed = payload.getCompleted();
        }
    }

    public Todo copy() {
        return new Todo(id, text, completed);
    }
}
