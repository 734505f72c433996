package com.has.domain.user.repository;

import com.has.domain.user.entity.User;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    Flux<User> findByRoleAndIsActiveTrue(String role);
}
