package uk.gegc.flowrbac.features.rbac.application;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One inheritance hop: an assignment on the parent of a {@code child} resource
 * applies to the child when the child has no direct assignment of its own.
 */
public record InheritanceEdge(ScopeType child, ScopeType parent, ParentLookup lookup) {

    public InheritanceEdge {
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(lookup, "lookup");
        if (child == parent) {
            throw new IllegalArgumentException("Scope cannot inherit from itself: " + child);
        }
    }

    public Optional<UUID> parentOf(UUID childId) {
        return Optional.ofNullable(lookup.parentsOf(List.of(childId)).get(childId));
    }

    public Map<UUID, UUID> parentsOf(Collection<UUID> childIds) {
        return lookup.parentsOf(childIds);
    }

    @FunctionalInterface
    public interface ParentLookup {

        /**
         * Parent ids keyed by child id; children without a parent are absent.
         */
        Map<UUID, UUID> parentsOf(Collection<UUID> childIds);
    }
}
