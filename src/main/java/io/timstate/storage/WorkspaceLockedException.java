package io.timstate.storage;

import io.timstate.model.WorkspaceLockInfo;

public class WorkspaceLockedException extends StorageException {
    private final WorkspaceLockInfo holder;

    public WorkspaceLockedException(WorkspaceLockInfo holder) {
        super("Workspace " + holder.workspaceId() + " is already locked by "
                + describe(holder));
        this.holder = holder;
    }

    public WorkspaceLockInfo holder() {
        return holder;
    }

    private static String describe(WorkspaceLockInfo holder) {
        StringBuilder sb = new StringBuilder(holder.type().dbValue()).append(" lock");
        if (holder.pid() != null) {
            sb.append(" pid=").append(holder.pid());
        }
        sb.append(" host=").append(holder.hostname());
        sb.append(" command=").append(holder.command());
        return sb.toString();
    }
}
