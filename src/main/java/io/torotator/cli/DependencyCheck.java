package io.torotator.cli;

import io.torotator.haproxy.ReverseProxyController;
import io.torotator.worker.PrivoxyForwarder;
import io.torotator.worker.TorCircuit;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class DependencyCheck {
    static final List<String> REQUIRED = List.of(
            ReverseProxyController.EXECUTABLE,
            PrivoxyForwarder.EXECUTABLE,
            TorCircuit.EXECUTABLE
    );

    private DependencyCheck() {
    }

    static Map<String, Optional<Path>> resolve(List<String> programs, String searchPath) {
        Map<String, Optional<Path>> out = new LinkedHashMap<>();
        for (String program : programs) {
            out.put(program, lookPath(program, searchPath));
        }
        return out;
    }

    static Optional<Path> lookPath(String program, String searchPath) {
        if (searchPath == null || searchPath.isBlank()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, program);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
