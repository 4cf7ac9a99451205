package com.practice.todoapi.todo.domain.model;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a {@link Todo}. A {@code null} field leaves the stored value as it is.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTodo {
    @Pattern(regexp = "(?s).*\\S.*", message = "Can not be empty")
    @Size(max = 100, message = "Over text length")
    private String text;
    private Boolean completed;

    public boolean isEmpty() {
        return text == null && completed == null;
    }
}
