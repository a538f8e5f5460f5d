package com.example.userservice.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class UserEntity {
    private String id;
    private String name;
    private String email;
    private Integer age;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
