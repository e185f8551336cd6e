package io.timstate.model;

public record WorkspaceLockInfo(
        long workspaceId,
        LockType type,
        Long pid,
        long startedAtMs,
        String hostname,
        String command
) {
}
