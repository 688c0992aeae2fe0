package com.flagship.fund_ledger.identity;

import lombok.Value;

import java.util.UUID;

/**
 * Read-only view of a user owned by the identity collaborator.
 */
@Value
public class UserRecord {
    UUID id;
    UUID organizationId;
    UUID parentId;
    Role role;
    String name;
    String email;
    boolean active;
}
