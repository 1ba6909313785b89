package com.trellis.tenancy;

import java.util.List;

/** Source of truth for which tenants a caller belongs to. Queried on every resolution. */
public interface MembershipDirectory {

    /** All memberships of the caller, in no particular order; empty when there are none. */
    List<Membership> listMemberships(String userId);

    default boolean isMember(String userId, String tenantId) {
        return listMemberships(userId).stream().anyMatch(m -> m.tenantId().equals(tenantId));
    }
}
