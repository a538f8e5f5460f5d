package com.example.userservice.api.request;

import com.example.userservice.domain.model.CreateUser;
import com.example.userservice.domain.model.UserConstraints;
import javax.validation.constraints.Email;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateUserRequest {

    @NotBlank
    @Size(max = UserConstraints.NAME_MAX_LENGTH)
    private String name;

    @NotBlank
    @Email
    @Size(max = UserConstraints.EMAIL_MAX_LENGTH)
    private String email;

    @NotNull
    @Min(UserConstraints.AGE_MIN)
    @Max(UserConstraints.AGE_MAX)
    private Integer age;

    public CreateUser toDomain() {
        return CreateUser.of(name, email, age);
    }
}
