package com.codepartition.core.util;

import com.codepartition.core.model.Language;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    /**
     * Directory names that are never descended into.
     */
    public static final Set<String> BUILT_IN_EXCLUDED_DIRECTORIES = Set.of(
        ".git", "node_modules", "target", "build", "dist", "out", "bin", "obj",
        "__pycache__", ".venv", "venv", "vendor"
    );

    private FileUtils() {
        // Utility class
    }

    /**
     * Resolves include and exclude glob patterns into a sorted list of regular files.
     *
     * <p>Patterns are matched against the path relative to {@code rootPath} using
     * {@code /} separators. A file is selected when it matches at least one include
     * pattern and no exclude pattern. Directories in
     * {@link #BUILT_IN_EXCLUDED_DIRECTORIES} are pruned. An empty include list selects
     * every file with a supported extension.
     *
     * @param rootPath repository root
     * @param includes include globs, may be empty
     * @param excludes exclude globs, may be empty
     * @return matching files ordered by relative path
     * @throws IOException if directory traversal fails
     */
    public static List<Path> resolveSources(Path rootPath, List<String> includes, List<String> excludes)
            throws IOException {
        List<PathMatcher> includeMatchers = includes == null || includes.isEmpty()
            ? defaultIncludes()
            : compile(includes);
        List<PathMatcher> excludeMatchers = excludes == null ? List.of() : compile(excludes);

        List<Path> selected = new ArrayList<>();
        Files.walkFileTree(rootPath, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(rootPath) && BUILT_IN_EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    Path relative = rootPath.relativize(file);
                    if (matchesAny(includeMatchers, relative) && !matchesAny(excludeMatchers, relative)) {
                        selected.add(file);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });

        selected.sort(Comparator.comparing(path -> toRelativePath(rootPath, path)));
        return selected;
    }

    /**
     * Reads a source file as UTF-8, replacing malformed or unmappable bytes with U+FFFD.
     *
     * @param path file to read
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readSource(Path path) throws IOException {
        ByteBuffer bytes = ByteBuffer.wrap(Files.readAllBytes(path));
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)
            .decode(bytes)
            .toString();
    }

    /**
     * Converts a path to a repository-relative path with {@code /} separators.
     *
     * @param rootPath repository root
     * @param path file inside the repository
     * @return relative path such as {@code src/app/main.py}
     */
    public static String toRelativePath(Path rootPath, Path path) {
        Path relative = path.isAbsolute() && rootPath.isAbsolute()
            ? rootPath.relativize(path)
            : rootPath.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }

    /**
     * Gets the file extension.
     *
     * @param fileName file name or path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(String fileName) {
        int slash = fileName.lastIndexOf('/');
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > slash + 1 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Strips the extension from a relative path.
     *
     * @param relativePath path such as {@code src/a.ts}
     * @return path without extension such as {@code src/a}
     */
    public static String stripExtension(String relativePath) {
        String extension = getExtension(relativePath);
        return extension.isEmpty() ? relativePath : relativePath.substring(0, relativePath.length() - extension.length() - 1);
    }

    /**
     * Returns the directory part of a relative path.
     *
     * @param relativePath path such as {@code src/a.ts}
     * @return directory such as {@code src}, or empty string at the root
     */
    public static String parentDirectory(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    /**
     * Resolves a relative reference ({@code ./x}, {@code ../y/z}) against a directory
     * and normalizes {@code .} and {@code ..} segments.
     *
     * @param directory base directory, empty for the root
     * @param reference reference as written in source
     * @return normalized repository-relative path; segments escaping the root are dropped
     */
    public static String resolveRelative(String directory, String reference) {
        List<String> segments = new ArrayList<>();
        if (!directory.isEmpty() && !reference.startsWith("/")) {
            segments.addAll(Arrays.asList(directory.split("/")));
        }
        for (String segment : reference.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.remove(segments.size() - 1);
                }
            } else {
                segments.add(segment);
            }
        }
        return String.join("/", segments);
    }

    private static List<PathMatcher> defaultIncludes() {
        List<String> patterns = new ArrayList<>();
        for (Language language : Language.values()) {
            for (String extension : language.extensions()) {
                patterns.add("**." + extension);
            }
        }
        return compile(patterns);
    }

    private static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            // "**/x" does not match "x" at the root with the JDK glob syntax
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }
}
