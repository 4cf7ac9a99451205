package com.practice.todoapi.label.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateLabel {
    @NotBlank(message = "Can not be empty")
    @Size(max = 100, message = "Over name length")
    private String name;
}
