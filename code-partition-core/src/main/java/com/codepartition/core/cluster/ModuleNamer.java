package com.codepartition.core.cluster;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Derives human-readable module names from the files a module covers.
 */
public final class ModuleNamer {

    static final String ROOT_DIRECTORY_NAME = "(root)";

    private ModuleNamer() {
        // Utility class
    }

    /**
     * Names a module after its files.
     *
     * @param filePaths repository-relative paths of the module's entities
     * @return the file path when there is a single file, otherwise the longest common
     *         directory, or {@code (root)} when the files share none
     */
    public static String nameFor(Collection<String> filePaths) {
        TreeSet<String> files = new TreeSet<>(filePaths);
        if (files.isEmpty()) {
            return ROOT_DIRECTORY_NAME;
        }
        if (files.size() == 1) {
            return files.first();
        }
        String[] common = directorySegments(files.first());
        int length = common.length;
        for (String file : files) {
            String[] segments = directorySegments(file);
            int shared = 0;
            while (shared < length && shared < segments.length && common[shared].equals(segments[shared])) {
                shared++;
            }
            length = shared;
        }
        return length == 0 ? ROOT_DIRECTORY_NAME : String.join("/", List.of(common).subList(0, length));
    }

    /**
     * Makes sibling names unique by suffixing repeats with {@code -2}, {@code -3}, ...
     *
     * @param names names in sibling order
     * @return unique names in the same order
     */
    public static List<String> uniqueNames(List<String> names) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> unique = new ArrayList<>(names.size());
        for (String name : names) {
            int count = seen.merge(name, 1, Integer::sum);
            String candidate = count == 1 ? name : name + "-" + count;
            while (count > 1 && names.contains(candidate)) {
                count = seen.merge(name, 1, Integer::sum);
                candidate = name + "-" + count;
            }
            unique.add(candidate);
        }
        return unique;
    }

    private static String[] directorySegments(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? new String[0] : path.substring(0, slash).split("/");
    }
}
