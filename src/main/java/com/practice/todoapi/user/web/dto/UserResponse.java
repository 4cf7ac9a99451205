package com.practice.todoapi.user.web.dto;

import lombok.Value;

@Value
public class UserResponse {
    long id;
    String username;
}
