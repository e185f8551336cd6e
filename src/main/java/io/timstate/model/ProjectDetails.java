package io.timstate.model;

/**
 * Optional project columns. A {@code null} component means "not supplied": inserts store
 * NULL for it and partial updates leave the stored value alone.
 */
public record ProjectDetails(
        String remoteUrl,
        String lastGitRoot,
        String externalConfigPath,
        String externalTasksDir,
        String remoteLabel
) {
    public static final ProjectDetails NONE = new ProjectDetails(null, null, null, null, null);

    public boolean isEmpty() {
        return remoteUrl == null
                && lastGitRoot == null
                && externalConfigPath == null
                && externalTasksDir == null
                && remoteLabel == null;
    }
}
