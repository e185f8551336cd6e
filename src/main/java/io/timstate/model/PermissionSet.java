package io.timstate.model;

import java.util.List;

public record PermissionSet(List<String> allow, List<String> deny) {
    public static final PermissionSet EMPTY = new PermissionSet(List.of(), List.of());

    public PermissionSet {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public List<String> patterns(PermissionType type) {
        return type == PermissionType.ALLOW ? allow : deny;
    }
}
