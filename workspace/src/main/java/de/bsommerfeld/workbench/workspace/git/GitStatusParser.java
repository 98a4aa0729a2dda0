package de.bsommerfeld.workbench.workspace.git;

import de.bsommerfeld.workbench.core.domain.GitStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the output of {@code git status --porcelain=v1 --branch}.
 *
 * <pre>
 * ## main...origin/main [ahead 1, behind 2]
 * M  staged.txt
 *  M unstaged.txt
 * MM both.txt
 * ?? new.txt
 * </pre>
 */
public final class GitStatusParser {

    private static final Pattern AHEAD = Pattern.compile("ahead (\\d+)");
    private static final Pattern BEHIND = Pattern.compile("behind (\\d+)");
    private static final String NO_COMMITS_PREFIX = "No commits yet on ";

    private GitStatusParser() {
    }

    public static GitStatus parse(String worktreeId, String output, long fetchedAt) {
        String branch = null;
        int ahead = 0;
        int behind = 0;
        int staged = 0;
        int unstaged = 0;
        int untracked = 0;

        for (String line : output.split("\\R")) {
            if (line.startsWith("## ")) {
                String header = line.substring(3);
                branch = parseBranch(header);
                ahead = count(AHEAD, header);
                behind = count(BEHIND, header);
                continue;
            }
            if (line.length() < 3)
                continue;

            char x = line.charAt(0);
            char y = line.charAt(1);
            if (x == '?' && y == '?') {
                untracked++;
            } else if (x != '!') {
                if (x != ' ')
                    staged++;
                if (y != ' ')
                    unstaged++;
            }
        }
        return new GitStatus(worktreeId, branch, ahead, behind, staged, unstaged, untracked, fetchedAt);
    }

    private static String parseBranch(String header) {
        if (header.startsWith(NO_COMMITS_PREFIX))
            return header.substring(NO_COMMITS_PREFIX.length()).trim();
        if (header.startsWith("HEAD (no branch)"))
            return null;
        int end = header.indexOf("...");
        if (end < 0)
            end = header.indexOf(' ');
        return end < 0 ? header.trim() : header.substring(0, end);
    }

    private static int count(Pattern pattern, String header) {
        Matcher m = pattern.matcher(header);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }
}
