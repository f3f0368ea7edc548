package io.torotator.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class FileTreesTest {
    @Test
    void writeAtomicallyReplacesContentWithoutLeftovers() throws Exception {
        Path dir = Files.createTempDirectory("torotator-files-");
        try {
            Path target = dir.resolve("nested").resolve("out.cfg");
            FileTrees.writeAtomically(target, "first");
            FileTrees.writeAtomically(target, "second");
            assertEquals("second", Files.readString(target));
            try (Stream<Path> listing = Files.list(target.getParent())) {
                assertEquals(1L, listing.count());
            }
        } finally {
            FileTrees.deleteRecursively(dir);
        }
        assertFalse(Files.exists(dir));
    }

    @Test
    void deleteRecursivelyToleratesMissingRoot() throws Exception {
        Path dir = Files.createTempDirectory("torotator-files-");
        FileTrees.deleteRecursively(dir);
        FileTrees.deleteRecursively(dir);
        assertFalse(Files.exists(dir));
    }
}
