package com.taskloop.core.tracker.github;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an issue body into description, acceptance criteria and notes, pivoting on an
 * "Acceptance Criteria" heading.
 */
public final class IssueBodyParser {

    static final Pattern ACCEPTANCE_HEADING =
            Pattern.compile("^\\s*#{1,6}\\s+acceptance\\s+criteria\\b.*$", Pattern.CASE_INSENSITIVE);
    static final Pattern DESCRIPTION_HEADING =
            Pattern.compile("^\\s*#{1,6}\\s+description\\s*$", Pattern.CASE_INSENSITIVE);
    static final Pattern HEADING = Pattern.compile("^\\s*#{1,6}\\s+.*$");
    static final Pattern CHECKBOX = Pattern.compile("^\\s*[-*]\\s+\\[[ xX]\\]\\s+(.+)$");

    /**
     * @param description free text before the pivot
     * @param acceptance  checkbox items under the pivot, in order
     * @param notes       text after the heading that ends the acceptance section
     */
    public record ParsedBody(String description, List<String> acceptance, String notes) {
    }

    private IssueBodyParser() {
    }

    public static ParsedBody parse(String body) {
        if (body == null || body.isBlank()) {
            return new ParsedBody("", List.of(), "");
        }
        String[] lines = body.replace("\r\n", "\n").split("\n", -1);

        int pivot = -1;
        for (int i = 0; i < lines.length; i++) {
            if (ACCEPTANCE_HEADING.matcher(lines[i]).matches()) {
                pivot = i;
                break;
            }
        }
        if (pivot < 0) {
            return new ParsedBody(body.strip(), List.of(), "");
        }

        String description = description(lines, pivot);

        var acceptance = new ArrayList<String>();
        int notesHeading = -1;
        for (int i = pivot + 1; i < lines.length; i++) {
            if (HEADING.matcher(lines[i]).matches()) {
                notesHeading = i;
                break;
            }
            Matcher m = CHECKBOX.matcher(lines[i]);
            if (m.matches()) {
                acceptance.add(m.group(1).strip());
            }
        }

        String notes = "";
        if (notesHeading >= 0) {
            notes = join(lines, notesHeading + 1, lines.length);
        }
        return new ParsedBody(description, acceptance, notes);
    }

    private static String description(String[] lines, int pivot) {
        int start = 0;
        while (start < pivot && lines[start].isBlank()) {
            start++;
        }
        if (start < pivot && DESCRIPTION_HEADING.matcher(lines[start]).matches()) {
            start++;
        }
        return join(lines, start, pivot);
    }

    private static String join(String[] lines, int from, int to) {
        return String.join("\n", Arrays.copyOfRange(lines, from, to)).strip();
    }
}
