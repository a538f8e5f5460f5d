package com.example.userservice.application.service;

import com.example.userservice.domain.error.UserDomainException;
import com.example.userservice.domain.model.CreateUser;
import com.example.userservice.domain.model.UpdateUser;
import com.example.userservice.domain.model.User;
import com.example.userservice.domain.port.UserRepositoryPort;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * User use cases. Each method makes exactly one repository call and hands back its result or
 * {@link UserDomainException} untouched.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepositoryPort userRepository;
    private final MeterRegistry meterRegistry;

    public UserService(UserRepositoryPort userRepository,
                       ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.userRepository = userRepository;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public User createUser(CreateUser user) {
        User created = observe("create", () -> userRepository.createUser(user));
        log.info("USER_EVENT event=created id={}", created.getId());
        return created;
    }

    public User getUser(String id) {
        return observe("get", () -> userRepository.getUser(id));
    }

    public User updateUser(UpdateUser user) {
        User updated = observe("update", () -> userRepository.updateUser(user));
        log.info("USER_EVENT event=updated id={}", updated.getId());
        return updated;
    }

    public void deleteUser(String id) {
        observe("delete", () -> {
            userRepository.deleteUser(id);
            return null;
        });
        log.info("USER_EVENT event=deleted id={}", id);
    }

    private <T> T observe(String op, Supplier<T> call) {
        long startedAtNanos = System.nanoTime();
        try {
            T result = call.get();
            recordCounter("user.service.calls", "op", op, "outcome", "success");
            return result;
        } catch (UserDomainException e) {
            recordCounter("user.service.calls", "op", op, "outcome", e.getError().name().toLowerCase(Locale.ROOT));
            throw e;
        } finally {
            recordDuration("user.service.latency", System.nanoTime() - startedAtNanos, "op", op);
        }
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("User metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("User metric timer failed, name={}", name, ex);
        }
    }
}
