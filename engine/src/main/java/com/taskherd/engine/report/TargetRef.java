package com.taskherd.engine.report;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where on the host a result goes.
 *
 * <pre>
 *   owner/repo#42        pull request or issue 42
 *   owner/repo@1a2b3c4   commit 1a2b3c4
 * </pre>
 */
public record TargetRef(String owner, String repo, Kind kind, String ref) {

    public enum Kind { ISSUE, COMMIT }

    private static final Pattern FORMAT =
            Pattern.compile("([\\w.-]+)/([\\w.-]+)(?:#(\\d+)|@([0-9a-fA-F]{7,40}))");

    /** @throws IllegalArgumentException if {@code text} matches neither form */
    public static TargetRef parse(String text) {
        Matcher m = text == null ? null : FORMAT.matcher(text.trim());
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Not a report target (owner/repo#n or owner/repo@sha): " + text);
        }
        return m.group(3) != null
                ? new TargetRef(m.group(1), m.group(2), Kind.ISSUE, m.group(3))
                : new TargetRef(m.group(1), m.group(2), Kind.COMMIT, m.group(4));
    }

    public static TargetRef issue(String fullName, long number) {
        return parse(fullName + "#" + number);
    }

    public static TargetRef commit(String fullName, String sha) {
        return parse(fullName + "@" + sha);
    }

    @Override
    public String toString() {
        return owner + "/" + repo + (kind == Kind.ISSUE ? "#" : "@") + ref;
    }
}
