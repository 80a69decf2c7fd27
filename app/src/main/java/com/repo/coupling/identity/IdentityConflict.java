package com.repo.coupling.identity;

/**
 * A rename whose target path was already held by another live identity.
 * The holder keeps the path; the renamed identity ends at {@code commitOid}.
 */
public record IdentityConflict(
        String commitOid,
        String oldPath,
        String newPath,
        int renamedFileId,
        int holderFileId) {
}
