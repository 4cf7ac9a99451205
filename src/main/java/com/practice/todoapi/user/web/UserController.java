package com.practice.todoapi.user.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.practice.todoapi.user.web.dto.CreateUserRequest;
import com.practice.todoapi.user.web.dto.UserResponse;

import jakarta.validation.Valid;

/**
 * Sample endpoint: echoes the username back under a fixed id. Nothing is stored.
 */
@RestController
public class UserController {

    static final long SAMPLE_USER_ID = 1337;

    @PostMapping("/users")
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse create(@Valid @RequestBody CreateUserRequest req) {
        return new UserResponse(SAMPLE_USER_ID, req.getUsername());
    }
}
