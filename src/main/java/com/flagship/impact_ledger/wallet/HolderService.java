package com.flagship.impact_ledger.wallet;

import com.flagship.impact_ledger.common.exception.ConstraintViolationException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Minimal identity registry for users, merchants and partners.
 * The ledger only needs to know that a referenced party exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HolderService {

    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public UUID registerUser(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationFailedException("User email is required");
        }
        UUID id = UUID.randomUUID();
        try {
            jdbcTemplate.update("INSERT INTO users (id, email) VALUES (?, ?)", id, email);
        } catch (DuplicateKeyException e) {
            throw new ConstraintViolationException("User email already registered: " + email, e);
        }
        log.info("Registered user: userId={}", id);
        return id;
    }

    @Transactional
    public UUID registerMerchant(String name) {
        return registerNamed("merchants", "Merchant", name);
    }

    @Transactional
    public UUID registerPartner(String name) {
        return registerNamed("partners", "Partner", name);
    }

    /**
     * Sets the user's connect flag if it is not set yet.
     *
     * @return true only for the call that changed it
     */
    @Transactional
    public boolean markConnected(UUID userId) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET connect_flag = TRUE WHERE id = ? AND connect_flag = FALSE",
            userId
        );
        if (updated == 1) {
            log.info("User connected: userId={}", userId);
        }
        return updated == 1;
    }

    @Transactional(readOnly = true)
    public boolean isConnected(UUID userId) {
        List<Boolean> flags = jdbcTemplate.queryForList(
            "SELECT connect_flag FROM users WHERE id = ?",
            Boolean.class,
            userId
        );
        if (flags.isEmpty()) {
            throw new NotFoundException("User", userId);
        }
        return flags.get(0);
    }

    @Transactional(readOnly = true)
    public void requireExists(Holder holder) {
        if (holder == null || holder.getId() == null) {
            throw new ValidationFailedException("Holder is required");
        }
        requireRow(holder.getType().table(), holder.getType() == HolderType.USER ? "User" : "Merchant",
                holder.getId());
    }

    @Transactional(readOnly = true)
    public void requirePartner(UUID partnerId) {
        requireRow("partners", "Partner", partnerId);
    }

    private UUID registerNamed(String table, String entity, String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationFailedException(entity + " name is required");
        }
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO " + table + " (id, name) VALUES (?, ?)", id, name);
        log.info("Registered {}: id={}, name={}", entity.toLowerCase(), id, name);
        return id;
    }

    private void requireRow(String table, String entity, UUID id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE id = ?",
            Integer.class,
            id
        );
        if (count == null || count == 0) {
            throw new NotFoundException(entity, id);
        }
    }
}
