package com.practice.todoapi.todo.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTodo {
    @NotBlank(message = "Can not be empty")
    @Size(max = 100, message = "Over text length")
    private String text;
}
