package com.example.userservice.api.request;

import com.example.userservice.domain.model.UpdateUser;
import com.example.userservice.domain.model.UserConstraints;
import javax.validation.constraints.Email;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import lombok.Data;

/**
 * Omitted fields are left unchanged.
 */
@Data
public class UpdateUserRequest {

    @Size(min = 1, max = UserConstraints.NAME_MAX_LENGTH)
    @Pattern(regexp = "(?s).*\\S.*")
    private String name;

    @Email
    @Size(min = 3, max = UserConstraints.EMAIL_MAX_LENGTH)
    private String email;

    @Min(UserConstraints.AGE_MIN)
    @Max(UserConstraints.AGE_MAX)
    private Integer age;

    public UpdateUser toDomain(String id) {
        return UpdateUser.of(id, name, email, age);
    }
}
