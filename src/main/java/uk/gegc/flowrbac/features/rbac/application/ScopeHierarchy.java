package uk.gegc.flowrbac.features.rbac.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The finite, ordered list of inheritance hops followed during role resolution.
 * <p>
 * The hierarchy is fixed at two levels: a Flow defers to its parent Project and
 * nothing defers further. Global is independent and never an ancestor. Nested
 * projects are not modelled; adding a hop here is the single place to change that.
 */
@Component
public class ScopeHierarchy {

    private final List<InheritanceEdge> edges;
    private final Map<ScopeType, InheritanceEdge> edgesByChild = new EnumMap<>(ScopeType.class);

    @Autowired
    public ScopeHierarchy(PermissionStore store) {
        this(List.of(new InheritanceEdge(ScopeType.FLOW, ScopeType.PROJECT, store::findFlowParentProjectIds)));
    }

    ScopeHierarchy(List<InheritanceEdge> edges) {
        this.edges = List.copyOf(edges);
        for (InheritanceEdge edge : this.edges) {
            if (edgesByChild.putIfAbsent(edge.child(), edge) != null) {
                throw new IllegalArgumentException("Scope " + edge.child() + " already has a parent");
            }
        }
    }

    public Optional<InheritanceEdge> parentEdge(ScopeType child) {
        return Optional.ofNullable(edgesByChild.get(child));
    }

    public List<InheritanceEdge> edges() {
        return edges;
    }
}
