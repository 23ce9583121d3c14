package com.repolink.core.commit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * State machine for a single commit attempt. A retry is a new instance;
 * terminal states never change.
 */
public class CommitAttempt {

    private static final Logger log = LoggerFactory.getLogger(CommitAttempt.class);

    private final String id;
    private final List<CommitState> history = new ArrayList<>();
    private CommitState state = CommitState.RESOLVING;
    private Throwable failure;

    public CommitAttempt(String id) {
        this.id = id;
        history.add(state);
    }

    public String id() {
        return id;
    }

    public synchronized CommitState state() {
        return state;
    }

    public synchronized List<CommitState> history() {
        return List.copyOf(history);
    }

    public synchronized Throwable failure() {
        return failure;
    }

    /** Moves to the next phase; fails if the attempt already ended. */
    public synchronized void advance() {
        state = state.next();
        history.add(state);
        log.debug("Commit attempt {} -> {}", id, state);
    }

    /** Ends the attempt as {@link CommitState#ABORTED}. Ignored once terminal. */
    public synchronized void abort(Throwable cause) {
        if (state.isTerminal()) {
            return;
        }
        log.debug("Commit attempt {} aborted in {}: {}", id, state, cause.getMessage());
        state = CommitState.ABORTED;
        failure = cause;
        history.add(state);
    }
}
