package com.example.userservice.infrastructure.persistence.adapter;

import com.example.userservice.domain.error.UserDomainError;
import com.example.userservice.domain.error.UserDomainException;
import com.example.userservice.domain.model.CreateUser;
import com.example.userservice.domain.model.UpdateUser;
import com.example.userservice.domain.model.User;
import com.example.userservice.domain.port.UserRepositoryPort;
import com.example.userservice.infrastructure.persistence.entity.UserEntity;
import com.example.userservice.infrastructure.persistence.mapper.UserMapper;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

/**
 * {@link UserRepositoryPort} backed by the {@code users} table through MyBatis.
 *
 * <p>Each operation issues single statements over the pooled connection; there is no retry and no
 * transaction spanning the read and write of an update.
 */
@Repository
public class MybatisUserRepositoryAdapter implements UserRepositoryPort {

    private static final Logger log = LoggerFactory.getLogger(MybatisUserRepositoryAdapter.class);

    private final UserMapper userMapper;

    public MybatisUserRepositoryAdapter(UserMapper userMapper) {
        this.userMapper = userMapper;
    }

    @Override
    public User createUser(CreateUser user) {
        UserEntity entity = new UserEntity();
        entity.setId(UUID.randomUUID().toString());
        entity.setName(user.getName());
        entity.setEmail(user.getEmail());
        entity.setAge(user.getAge());

        translate("create", () -> userMapper.insert(entity));
        return toDomain(entity);
    }

    @Override
    public User getUser(String id) {
        UserEntity entity = translate("get", () -> userMapper.selectById(id));
        if (entity == null) {
            throw UserDomainException.notFound(id);
        }
        return toDomain(entity);
    }

    @Override
    public User updateUser(UpdateUser user) {
        User merged = user.mergeInto(getUser(user.getId()));
        UserEntity entity = toEntity(merged);

        int updated = translate("update", () -> userMapper.update(entity));
        if (updated == 0) {
            // deleted between the select and the update
            throw UserDomainException.notFound(user.getId());
        }
        return merged;
    }

    @Override
    public void deleteUser(String id) {
        int deleted = translate("delete", () -> userMapper.deleteById(id));
        if (deleted == 0) {
            throw UserDomainException.notFound(id);
        }
    }

    private <T> T translate(String operation, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DuplicateKeyException e) {
            log.warn("USER_STORE op={} result=conflict msg={}", operation, e.getMostSpecificCause().getMessage());
            throw new UserDomainException(UserDomainError.CONFLICT, "A user with this email already exists", e);
        } catch (DataIntegrityViolationException e) {
            log.warn("USER_STORE op={} result=rejected msg={}", operation, e.getMostSpecificCause().getMessage());
            throw new UserDomainException(UserDomainError.VALIDATION, "User data violates a store constraint", e);
        } catch (DataAccessException e) {
            log.error("USER_STORE op={} result=failure", operation, e);
            throw new UserDomainException(UserDomainError.STORE_FAILURE, "Failed to " + operation + " user", e);
        }
    }

    private User toDomain(UserEntity entity) {
        return new User(entity.getId(), entity.getName(), entity.getEmail(), entity.getAge());
    }

    private UserEntity toEntity(User user) {
        UserEntity entity = new UserEntity();
        entity.setId(user.getId());
        entity.setName(user.getName());
        entity.setEmail(user.getEmail());
        entity.setAge(user.getAge());
        return entity;
    }
}
