package io.timstate.storage;

import java.util.Optional;

@FunctionalInterface
public interface ProcessProbe {
    boolean isAlive(long pid);

    static ProcessProbe system() {
        return pid -> {
            if (pid <= 0) {
                return false;
            }
            Optional<ProcessHandle> handle = ProcessHandle.of(pid);
            return handle.map(ProcessHandle::isAlive).orElse(false);
        };
    }
}
