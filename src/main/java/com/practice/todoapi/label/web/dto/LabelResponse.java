package com.practice.todoapi.label.web.dto;

import com.practice.todoapi.label.domain.model.Label;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LabelResponse {
    Long id;
    String name;

    public static LabelResponse from(Label label) {
        return LabelResponse.builder()
                .id(label.getId())
                .name(label.getName())
                .build();
    }
}
