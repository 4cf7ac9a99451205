package com.practice.todoapi.label.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Label {
    private Long id;
    private String name;

    public Label copy() {
        return new Label(id, name);
    }
}
