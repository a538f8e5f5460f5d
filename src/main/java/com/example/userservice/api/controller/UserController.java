package com.example.userservice.api.controller;

import com.example.userservice.api.request.CreateUserRequest;
import com.example.userservice.api.request.UpdateUserRequest;
import com.example.userservice.api.response.ApiResponse;
import com.example.userservice.api.response.UserResponse;
import com.example.userservice.application.service.UserService;
import com.example.userservice.domain.model.User;
import java.net.URI;
import javax.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Users over HTTP. Failures surface as {@link com.example.userservice.domain.error.UserDomainException}
 * and are rendered by {@link com.example.userservice.common.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<UserResponse>> createUser(@Valid @RequestBody CreateUserRequest request) {
        User user = userService.createUser(request.toDomain());
        return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
                .body(ApiResponse.success(HttpStatus.CREATED, UserResponse.from(user)));
    }

    @GetMapping("/{id}")
    public ApiResponse<UserResponse> getUser(@PathVariable("id") String id) {
        return ApiResponse.success(HttpStatus.OK, UserResponse.from(userService.getUser(id)));
    }

    @PutMapping("/{id}")
    public ApiResponse<UserResponse> updateUser(@PathVariable("id") String id,
                                                @Valid @RequestBody UpdateUserRequest request) {
        return ApiResponse.success(HttpStatus.OK, UserResponse.from(userService.updateUser(request.toDomain(id))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteUser(@PathVariable("id") String id) {
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
