package com.flagship.fund_ledger.identity;

import lombok.Value;

import java.util.Set;
import java.util.UUID;

/**
 * The authenticated user on whose behalf an operation runs, together with the
 * subordinate set materialised once for the request.
 */
@Value
public class Caller {

    /** Request header carrying the authenticated user id. */
    public static final String USER_ID_HEADER = "X-User-Id";

    UUID userId;
    UUID organizationId;
    Role role;
    Set<UUID> subordinateIds;

    public boolean isDeveloper() {
        return role == Role.DEVELOPER;
    }

    public boolean hasRole(Role... roles) {
        for (Role candidate : roles) {
            if (candidate == role) {
                return true;
            }
        }
        return false;
    }

    /**
     * A caller may act on themselves and on anyone below them in the hierarchy.
     * Developers may act on anyone in their organization; the organization check
     * is the caller's responsibility since this object only knows ids.
     */
    public boolean hasAuthorityOver(UUID targetUserId) {
        return isDeveloper() || userId.equals(targetUserId) || subordinateIds.contains(targetUserId);
    }
}
