package com.trellis.tenancy.testing;

import com.trellis.tenancy.Membership;
import com.trellis.tenancy.MembershipDirectory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MembershipDirectory} held in memory. Used by tests and by the demo service, which has no
 * tenant persistence of its own.
 */
public final class InMemoryMembershipDirectory implements MembershipDirectory {

    private final Map<String, List<Membership>> memberships = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();

    public InMemoryMembershipDirectory add(String userId, String tenantId, String tenantName, Instant createdAt) {
        return add(userId, new Membership(tenantId, tenantName, createdAt));
    }

    public InMemoryMembershipDirectory add(String userId, Membership membership) {
        List<Membership> entries = memberships.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>());
        entries.removeIf(m -> m.tenantId().equals(membership.tenantId()));
        entries.add(membership);
        return this;
    }

    public void remove(String userId, String tenantId) {
        memberships.computeIfPresent(userId, (id, entries) -> {
            entries.removeIf(m -> m.tenantId().equals(tenantId));
            return entries;
        });
    }

    @Override
    public List<Membership> listMemberships(String userId) {
        lookups.incrementAndGet();
        return List.copyOf(memberships.getOrDefault(userId, List.of()));
    }

    /** Whether any user holds a membership in the tenant. */
    public boolean knowsTenant(String tenantId) {
        return memberships.values().stream()
                .flatMap(List::stream)
                .anyMatch(m -> m.tenantId().equals(tenantId));
    }

    /** Number of directory queries so far. */
    public int lookupCount() {
        return lookups.get();
    }
}
