package com.repo.audit.analyzers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-oriented regex scanning shared by the drift and lag detectors.
 */
final class LineScanner {

    private LineScanner() {
    }

    /**
     * 1-based numbers of non-blank lines on which any pattern is found.
     * A line is reported once no matter how many patterns hit it.
     */
    static List<Integer> matchingLines(List<String> lines, List<Pattern> patterns) {
        List<Integer> matches = new ArrayList<>();
        if (patterns.isEmpty())
            return matches;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank())
                continue;
            for (Pattern pattern : patterns) {
                if (pattern.matcher(line).find()) {
                    matches.add(i + 1);
                    break;
                }
            }
        }
        return matches;
    }

    static int countNonBlank(List<String> lines) {
        return (int) lines.stream()
                .filter(line -> !line.isBlank())
                .count();
    }
}
