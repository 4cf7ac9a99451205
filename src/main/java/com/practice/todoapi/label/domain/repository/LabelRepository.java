package com.practice.todoapi.label.domain.repository;

import java.util.List;

import com.practice.todoapi.label.domain.model.CreateLabel;
import com.practice.todoapi.label.domain.model.Label;

public interface LabelRepository {
    Label create(CreateLabel payload);
    List<Label> all();
    void delete(Long id);
}
