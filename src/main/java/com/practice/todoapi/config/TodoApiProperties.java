package com.practice.todoapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "todo-api")
public record TodoApiProperties(@DefaultValue Cors cors) {

    public record Cors(@DefaultValue("http://localhost:3000") String allowedOrigin) {
    }
}
