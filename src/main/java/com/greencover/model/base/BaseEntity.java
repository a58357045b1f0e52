package com.greencover.model.base;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Base entity with identifier, creation time and optional expiration
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> {

    private ID id;

    private Instant createdAt;

    /**
     * Null means the entity never expires
     */
    private Instant expiresAt;

    /**
     * Expired once {@code now} reaches the expiration instant
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
