package com.example.releaseservice.support;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders version strings part by part. Versions are split on '.', '-' and '+';
 * numeric parts compare numerically and sort before text parts, text parts
 * compare lexically, and a version that is a prefix of another sorts first.
 */
public class ReleaseVersionComparator implements Comparator<String> {

    public static final ReleaseVersionComparator INSTANCE = new ReleaseVersionComparator();

    @Override
    public int compare(String left, String right) {
        List<Object> a = parts(left);
        List<Object> b = parts(right);
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int result = comparePart(a.get(i), b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int comparePart(Object a, Object b) {
        if (a instanceof Long x && b instanceof Long y) {
            return Long.compare(x, y);
        }
        if (a instanceof Long) {
            return -1;
        }
        if (b instanceof Long) {
            return 1;
        }
        return ((String) a).compareTo((String) b);
    }

    private static List<Object> parts(String version) {
        List<Object> parts = new ArrayList<>();
        for (String part : version.replace('+', '.').replace('-', '.').split("\\.")) {
            try {
                parts.add(Long.parseLong(part));
            } catch (NumberFormatException ex) {
                parts.add(part);
            }
        }
        return parts;
    }
}
