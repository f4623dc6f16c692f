package com.codesurvey.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);
    private static final String GIT_DIRECTORY = ".git";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against the path relative to {@code rootPath}, so
     * {@code **}{@code /*.py} matches Python files at any depth (including the root) and
     * {@code *.py} matches only top-level ones. Files inside {@code .git} directories are
     * never returned. Results are sorted for a stable unit order.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        PathMatcher rootMatcher = globPattern.startsWith("**/")
            ? FileSystems.getDefault().getPathMatcher("glob:" + globPattern.substring(3))
            : matcher;

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .map(rootPath::relativize)
                .filter(relative -> !isInGitDirectory(relative))
                .filter(relative -> matcher.matches(relative)
                    || (relative.getNameCount() == 1 && rootMatcher.matches(relative)))
                .map(rootPath::resolve)
                .sorted()
                .toList();
        }
    }

    private static boolean isInGitDirectory(Path relativePath) {
        for (Path part : relativePath) {
            if (part.toString().equals(GIT_DIRECTORY)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates a fresh temporary directory.
     *
     * @param prefix directory name prefix
     * @return created directory
     */
    public static Path createTempDirectory(String prefix) {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create temporary directory", e);
        }
    }

    /**
     * Deletes a directory tree. Missing paths are ignored; files that cannot be
     * removed are logged and left behind.
     *
     * @param root directory (or file) to delete
     */
    public static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {} for deletion: {}", root, e.getMessage());
        }
    }
}
