package com.baton.core.model;

import java.util.List;

/**
 * Outcome of a scope declaration: the stored declaration plus any conflicts it raised.
 */
public record ScopeDeclarationResult(ScopeDeclaration declaration, List<ScopeConflict> conflicts) {

    public ScopeDeclarationResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
