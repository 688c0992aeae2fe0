package com.flagship.fund_ledger.identity;

import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Narrow view of the identity and site collaborators.
 *
 * User and site CRUD live elsewhere; the engine only needs a user's role,
 * organization and subordinate set, and whether a site exists in an
 * organization. The register methods exist for seeding and tests.
 */
@Service
@Slf4j
public class DirectoryService {

    private static final String SUBORDINATES_SQL =
        "WITH RECURSIVE subordinates (id) AS (" +
        " SELECT id FROM users WHERE parent_id = ?" +
        " UNION ALL" +
        " SELECT u.id FROM users u JOIN subordinates s ON u.parent_id = s.id" +
        ") SELECT id FROM subordinates";

    private final JdbcTemplate jdbcTemplate;

    public DirectoryService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public UUID registerUser(UUID organizationId, UUID parentId, Role role, String name, String email) {
        UUID userId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO users (id, organization_id, parent_id, role, name, email, active, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, TRUE, CURRENT_TIMESTAMP)",
            userId, organizationId, parentId, role.getLevel(), name, email
        );
        log.debug("Registered user {} with role {} in organization {}", userId, role, organizationId);
        return userId;
    }

    @Transactional
    public UUID registerSite(UUID organizationId, String name) {
        UUID siteId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO sites (id, organization_id, name, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            siteId, organizationId, name
        );
        return siteId;
    }

    @Transactional
    public void deactivateUser(UUID userId) {
        jdbcTemplate.update("UPDATE users SET active = FALSE WHERE id = ?", userId);
    }

    /**
     * Takes a row lock on the user until the current transaction ends. Every
     * spend charged to a user's wallet holds this lock while it checks the
     * wallet, so two spends against the same wallet serialize.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockUser(UUID userId) {
        jdbcTemplate.query("SELECT id FROM users WHERE id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getObject("id", UUID.class), userId);
    }

    public Optional<UserRecord> findUser(UUID userId) {
        List<UserRecord> users = jdbcTemplate.query(
            "SELECT id, organization_id, parent_id, role, name, email, active FROM users WHERE id = ?",
            userRowMapper(),
            userId
        );
        return users.stream().findFirst();
    }

    /**
     * Resolves the user behind a request into a {@link Caller}.
     *
     * @throws NotFoundException if the user does not exist
     * @throws ForbiddenException if the user is inactive or has no organization
     */
    @Transactional(readOnly = true)
    public Caller resolveCaller(UUID userId) {
        UserRecord user = findUser(userId)
            .orElseThrow(() -> new NotFoundException("User", userId));
        if (!user.isActive()) {
            throw new ForbiddenException("User is inactive");
        }
        if (user.getOrganizationId() == null) {
            throw new ForbiddenException("No organization assigned");
        }
        return new Caller(user.getId(), user.getOrganizationId(), user.getRole(), subordinateIds(userId));
    }

    /**
     * Transitive set of users below the given user, materialised with one
     * recursive adjacency query.
     */
    public Set<UUID> subordinateIds(UUID userId) {
        return new HashSet<>(jdbcTemplate.query(
            SUBORDINATES_SQL,
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            userId
        ));
    }

    public boolean siteExists(UUID siteId, UUID organizationId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sites WHERE id = ? AND organization_id = ?",
            Integer.class,
            siteId,
            organizationId
        );
        return count != null && count > 0;
    }

    /**
     * Loads a user that must belong to the caller's organization.
     *
     * @throws NotFoundException if the user is missing or belongs to another organization
     */
    public UserRecord requireUserInOrganization(UUID userId, UUID organizationId, String resource) {
        return findUser(userId)
            .filter(user -> organizationId.equals(user.getOrganizationId()))
            .orElseThrow(() -> new NotFoundException(resource, userId));
    }

    /**
     * @throws NotFoundException if the site does not exist in the organization
     */
    public void requireSite(UUID siteId, UUID organizationId) {
        if (!siteExists(siteId, organizationId)) {
            throw new NotFoundException("Site", siteId);
        }
    }

    private RowMapper<UserRecord> userRowMapper() {
        return (rs, rowNum) -> new UserRecord(
            rs.getObject("id", UUID.class),
            rs.getObject("organization_id", UUID.class),
            rs.getObject("parent_id", UUID.class),
            Role.fromLevel(rs.getInt("role")),
            rs.getString("name"),
            rs.getString("email"),
            rs.getBoolean("active")
        );
    }
}
