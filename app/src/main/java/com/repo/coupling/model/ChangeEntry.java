package com.repo.coupling.model;

/**
 * One file touched by one commit.
 *
 * @param similarity rename/copy similarity percentage, or -1 for other statuses
 * @param oldPath    source path for renames and copies, otherwise null
 * @param fileId     resolved identity, 0 until the identity resolver has run
 * @param suspect    borderline path accepted in permissive validation
 */
public record ChangeEntry(
        String commitOid,
        ChangeStatus status,
        int similarity,
        String newPath,
        String oldPath,
        int fileId,
        boolean suspect) {

    public static final int UNRESOLVED = 0;

    public static ChangeEntry single(String commitOid, ChangeStatus status, String path, boolean suspect) {
        return new ChangeEntry(commitOid, status, -1, path, null, UNRESOLVED, suspect);
    }

    public static ChangeEntry withSource(String commitOid, ChangeStatus status, int similarity,
            String oldPath, String newPath, boolean suspect) {
        return new ChangeEntry(commitOid, status, similarity, newPath, oldPath, UNRESOLVED, suspect);
    }

    public ChangeEntry withFileId(int id) {
        return new ChangeEntry(commitOid, status, similarity, newPath, oldPath, id, suspect);
    }

    public boolean isRename() {
        return status == ChangeStatus.RENAMED;
    }
}
