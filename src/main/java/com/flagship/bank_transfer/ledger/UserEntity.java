package com.flagship.bank_transfer.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * JPA entity for a customer. The password hash is a persistence concern and
 * is never copied into the {@link User} domain object.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserEntity implements Persistable<String> {

    @Id
    @Column(name = "username", nullable = false, updatable = false, length = 64)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "email")
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    static UserEntity create(String username, String passwordHash, String email, Instant now) {
        return new UserEntity(username, passwordHash, email, now, true);
    }

    public User toDomain() {
        return new User(username, email, createdAt);
    }

    @Override
    public String getId() {
        return username;
    }

    /**
     * Ids are assigned, so Spring Data cannot tell new from existing rows by id.
     * Entities built by the factory methods insert; loaded ones update.
     */
    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
