package com.signalwatch.scan.extract;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds company names stated in filing text: certificate wording, "company name:" headers and
 * change-of-name resolutions.
 */
public class CompanyNameExtractor {
    // a labelled name ends at the line end, a run of spaces or the next form field on the same line
    private static final String FIELD_END =
        "(?=[ \\t]{2,}|\\t|\\s+(?:company (?:number|no\\b|registration)|registered (?:number|office)|date of)|[ \\t]*(?:\\n|$))";
    // a stated name may contain periods (CO., ST., U.K.) and ends only where the sentence does
    private static final String SENTENCE_END = "(?=\\s+on\\b|\\.[ \\t]*(?:\\n|$)|[;\\n]|$)";

    private static final List<Pattern> NAME_PATTERNS = List.of(
        Pattern.compile(
            "\\bcompany name(?:[ \\t]+in[ \\t]+full)?(?:[ \\t]*:[ \\t]*\\n?|[ \\t]*\\n)[ \\t]*([^\\n]{2,160}?)" + FIELD_END,
            Pattern.CASE_INSENSITIVE
        ),
        Pattern.compile("\\bcertif(?:y|ies) that\\s+([^\\n]{2,160}?)\\s+is this day incorporated", Pattern.CASE_INSENSITIVE),
        Pattern.compile(
            "\\bchanged its name (?:from\\s+[^\\n]{2,160}?\\s+)?to\\s+([^\\n]{2,160}?)" + SENTENCE_END,
            Pattern.CASE_INSENSITIVE
        ),
        Pattern.compile(
            "\\bpreviously known as\\s+([^\\n]{2,160}?)(?=\\.[ \\t]*(?:\\n|$)|\\.\\)|[,;)\\n]|$)",
            Pattern.CASE_INSENSITIVE
        )
    );

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\"'“‘]+|[\"'”’.,;:]+$");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");

    /**
     * Distinct names in order of first appearance per pattern.
     */
    public Set<String> extractNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return names;
        }
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String name = clean(matcher.group(1));
                if (name != null) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    /**
     * Case-insensitive, whitespace-collapsed form used for name comparison. Surrounding quotes and
     * trailing punctuation are dropped, so "ACME LTD." and "Acme Ltd" compare equal.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return canonical(name).toUpperCase(Locale.ROOT);
    }

    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String name = canonical(raw);
        if (name.length() < 2 || !LETTER.matcher(name).find()) {
            return null;
        }
        return name;
    }

    private static String canonical(String raw) {
        String name = raw.replaceAll("\\s+", " ").trim();
        return EDGE_PUNCTUATION.matcher(name).replaceAll("").trim();
    }
}
