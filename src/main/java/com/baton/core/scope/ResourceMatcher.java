package com.baton.core.scope;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether two declared resources refer to the same thing.
 * <p>
 * Resources match if they are equal after normalisation, if one is a path suffix of the
 * other (relative vs. absolute paths), or if one is a directory (declared with a trailing
 * {@code /}) that contains the other.
 */
public final class ResourceMatcher {

    private ResourceMatcher() {}

    public static boolean matches(String first, String second) {
        String n1 = normalize(first);
        String n2 = normalize(second);
        if (n1.isEmpty() || n2.isEmpty()) return false;

        if (n1.equals(n2)) return true;
        if (n1.endsWith("/" + n2) || n2.endsWith("/" + n1)) return true;

        if (isDirectory(first) && contains(n1, n2)) return true;
        return isDirectory(second) && contains(n2, n1);
    }

    /**
     * Resources of {@code claimed} that overlap any of {@code others}. Both sides of a
     * pair are reported so each work item sees its own spelling of the resource.
     */
    public static Set<String> overlap(Collection<String> claimed, Collection<String> others) {
        var result = new TreeSet<String>();
        for (String mine : claimed) {
            for (String theirs : others) {
                if (matches(mine, theirs)) {
                    result.add(normalize(mine));
                    result.add(normalize(theirs));
                }
            }
        }
        return result;
    }

    public static String normalize(String resource) {
        if (resource == null) return "";
        String path = resource.trim().replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static boolean isDirectory(String resource) {
        return resource != null && resource.trim().endsWith("/");
    }

    private static boolean contains(String directory, String path) {
        return path.startsWith(directory + "/") || path.contains("/" + directory + "/");
    }
}
