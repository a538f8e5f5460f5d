package com.example.userservice.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.example.userservice.domain.error.UserDomainError;
import com.example.userservice.domain.error.UserDomainException;
import com.example.userservice.domain.model.CreateUser;
import com.example.userservice.domain.model.UpdateUser;
import com.example.userservice.domain.model.User;
import com.example.userservice.domain.port.UserRepositoryPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class UserServiceTest {

    private UserRepositoryPort userRepository;
    private SimpleMeterRegistry meterRegistry;
    private UserService service;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepositoryPort.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new UserService(userRepository, beanProvider(meterRegistry));
    }

    @Test
    void createUserShouldReturnRepositoryResult() {
        CreateUser request = CreateUser.of("Alice", "a@x.com", 30);
        User stored = new User("id-1", "Alice", "a@x.com", 30);
        when(userRepository.createUser(request)).thenReturn(stored);

        assertSame(stored, service.createUser(request));
        verify(userRepository, times(1)).createUser(request);
        verifyNoMoreInteractions(userRepository);
        assertEquals(1.0, meterRegistry.counter("user.service.calls", "op", "create", "outcome", "success").count());
    }

    @Test
    void getUserShouldForwardNotFoundUnchanged() {
        UserDomainException notFound = UserDomainException.notFound("missing");
        when(userRepository.getUser("missing")).thenThrow(notFound);

        UserDomainException error = assertThrows(UserDomainException.class, () -> service.getUser("missing"));

        assertSame(notFound, error);
        assertEquals(1.0, meterRegistry.counter("user.service.calls", "op", "get", "outcome", "not_found").count());
    }

    @Test
    void updateUserShouldMakeExactlyOneRepositoryCall() {
        UpdateUser request = UpdateUser.of("id-1", "Bob", null, null);
        User updated = new User("id-1", "Bob", "a@x.com", 30);
        when(userRepository.updateUser(request)).thenReturn(updated);

        assertSame(updated, service.updateUser(request));
        verify(userRepository).updateUser(request);
        verifyNoMoreInteractions(userRepository);
    }

    @Test
    void deleteUserShouldForwardStoreFailure() {
        doThrow(new UserDomainException(UserDomainError.STORE_FAILURE)).when(userRepository).deleteUser("id-1");

        UserDomainException error = assertThrows(UserDomainException.class, () -> service.deleteUser("id-1"));

        assertEquals(UserDomainError.STORE_FAILURE, error.getError());
        verify(userRepository).deleteUser("id-1");
    }

    @Test
    void serviceShouldWorkWithoutMeterRegistry() {
        UserService bare = new UserService(userRepository, new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));
        User stored = new User("id-1", "Alice", "a@x.com", 30);
        when(userRepository.getUser("id-1")).thenReturn(stored);

        assertSame(stored, bare.getUser("id-1"));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
