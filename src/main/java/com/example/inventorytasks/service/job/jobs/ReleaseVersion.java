package com.example.inventorytasks.service.job.jobs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Numeric release version parsed from tags such as {@code v0.12.3} or {@code 1.4}.
 * Non-numeric suffixes ({@code -rc1}) are ignored.
 */
final class ReleaseVersion implements Comparable<ReleaseVersion> {

    private static final Pattern VERSION = Pattern.compile("^[vV]?(\\d+(?:\\.\\d+)*)");

    private final List<Integer> parts;

    private ReleaseVersion(List<Integer> parts) {
        this.parts = parts;
    }

    /**
     * @throws IllegalArgumentException if the tag has no leading numeric version
     */
    static ReleaseVersion parse(String tag) {
        var matcher = VERSION.matcher(tag == null ? "" : tag.trim());
        if (!matcher.find()) {
            throw new IllegalArgumentException("Not a release version: " + tag);
        }
        var parts = new ArrayList<Integer>();
        for (var part : matcher.group(1).split("\\.")) {
            parts.add(Integer.parseInt(part));
        }
        return new ReleaseVersion(parts);
    }

    boolean isNewerThan(ReleaseVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(ReleaseVersion other) {
        var length = Math.max(parts.size(), other.parts.size());
        for (var i = 0; i < length; i++) {
            var mine = i < parts.size() ? parts.get(i) : 0;
            var theirs = i < other.parts.size() ? other.parts.get(i) : 0;
            if (mine != theirs) {
                return Integer.compare(mine, theirs);
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        return String.join(".", parts.stream().map(String::valueOf).toList());
    }
}
