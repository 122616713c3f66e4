package com.baton.core.model;

import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;
import com.baton.core.scope.ResourceMatcher;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Write-once claim of exclusive and excluded resources for a work item.
 *
 * @param workItemId owning work item
 * @param claimed    resources claimed exclusively
 * @param excluded   resources explicitly left alone
 * @param sequence   id of the comment holding the declaration
 * @param actor      declaring actor
 * @param declaredAt when the declaration was posted
 */
public record ScopeDeclaration(
    String workItemId,
    List<String> claimed,
    List<String> excluded,
    String sequence,
    String actor,
    Instant declaredAt
) implements Serializable {

    public ScopeDeclaration {
        claimed = claimed == null ? List.of() : List.copyOf(claimed);
        excluded = excluded == null ? List.of() : List.copyOf(excluded);
    }

    /**
     * The first well-formed scope block on the item. Malformed blocks are skipped and later
     * blocks are never authoritative.
     */
    public static Optional<ScopeDeclaration> of(WorkItem item) {
        return item.marked(MarkerType.SCOPE).stream()
                .filter(m -> malformation(clean(m.block().list("claimed")), clean(m.block().list("excluded")))
                        .isEmpty())
                .findFirst()
                .map(m -> new ScopeDeclaration(item.id(), clean(m.block().list("claimed")),
                        clean(m.block().list("excluded")), m.event().id(), m.event().author(),
                        m.event().createdAt()));
    }

    /** Why a declaration with these resources is malformed, or empty when it is well formed. */
    public static Optional<String> malformation(List<String> claimed, List<String> excluded) {
        if (claimed.isEmpty()) {
            return Optional.of("A scope declaration must claim at least one resource");
        }
        var both = new ArrayList<String>();
        for (String resource : claimed) {
            String normalized = ResourceMatcher.normalize(resource);
            if (excluded.stream().map(ResourceMatcher::normalize).anyMatch(normalized::equals)) {
                both.add(resource);
            }
        }
        if (!both.isEmpty()) {
            return Optional.of("Resources cannot be both claimed and excluded: " + both);
        }
        return Optional.empty();
    }

    /** Trimmed, de-duplicated resources with blanks dropped. */
    public static List<String> clean(List<String> resources) {
        if (resources == null) return List.of();
        Set<String> result = new LinkedHashSet<>();
        for (String resource : resources) {
            if (resource != null && !resource.isBlank()) {
                result.add(resource.trim());
            }
        }
        return List.copyOf(result);
    }

    public static MarkerBlock toBlock(List<String> claimed, List<String> excluded) {
        return MarkerBlock.builder(MarkerType.SCOPE)
                .items("claimed", claimed)
                .items("excluded", excluded)
                .build();
    }
}
