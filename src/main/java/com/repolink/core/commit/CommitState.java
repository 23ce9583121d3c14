package com.repolink.core.commit;

/**
 * Phases of one commit attempt, in order. {@link #COMMITTED} and
 * {@link #ABORTED} are terminal.
 */
public enum CommitState {
    RESOLVING,
    BLOBS_PENDING,
    TREE_BUILDING,
    COMMIT_PENDING,
    REF_UPDATING,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }

    /** The only state a non-terminal state may advance to besides {@link #ABORTED}. */
    public CommitState next() {
        return switch (this) {
            case RESOLVING -> BLOBS_PENDING;
            case BLOBS_PENDING -> TREE_BUILDING;
            case TREE_BUILDING -> COMMIT_PENDING;
            case COMMIT_PENDING -> REF_UPDATING;
            case REF_UPDATING -> COMMITTED;
            case COMMITTED, ABORTED -> throw new IllegalStateException(this + " is terminal");
        };
    }
}
