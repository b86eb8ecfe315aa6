package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DateDiscrepancy;
import com.signalwatch.scan.model.DateRange;
import com.signalwatch.scan.model.FactContext;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls calendar dates out of filing text.
 * <p>
 * Two passes: context phrases ("date of incorporation:", "incorporated on", ...) when a context is
 * given, then the generic date patterns over the whole text. The union is de-duplicated on exact
 * date equality and sorted ascending. Stateless and safe to share between threads.
 */
public class DateFactExtractor {
    private static final String SPAN = "[:\\s]+([^\\n]{5,30})";

    private static final Map<FactContext, List<String>> CONTEXT_PHRASES = contextPhrases();
    private static final Map<FactContext, List<Pattern>> CONTEXT_PATTERNS = compile(SPAN);
    private static final Map<FactContext, List<Pattern>> STATEMENT_PATTERNS = compile("");

    private static final List<Pattern> GENERIC_PATTERNS = List.of(
        DatePhraseParser.numericLongYear(),
        DatePhraseParser.dayMonthYear(),
        DatePhraseParser.monthDayYear(),
        DatePhraseParser.numericShortYear()
    );

    private static final Pattern RANGE = Pattern.compile(
        "from\\s+([^\\s]+(?:\\s+\\w+\\s+\\d{4})?)\\s+to\\s+([^\\s]+(?:\\s+\\w+\\s+\\d{4})?)",
        Pattern.CASE_INSENSITIVE
    );

    private static final Map<String, DateTimeFormatter> FORMATS = Map.of(
        "uk", DateTimeFormatter.ofPattern("dd/MM/yyyy", Locale.UK),
        "us", DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.UK),
        "iso", DateTimeFormatter.ISO_LOCAL_DATE,
        "long", DateTimeFormatter.ofPattern("dd MMMM yyyy", Locale.UK)
    );

    /**
     * All distinct dates in {@code text}, ascending. With a scoped context the context phrases are
     * tried first; the generic patterns always run.
     */
    public SortedSet<LocalDate> extract(String text, FactContext context) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return dates;
        }
        dates.addAll(extractScoped(text, context));
        dates.addAll(extractGeneric(text));
        return dates;
    }

    public SortedSet<LocalDate> extract(String text) {
        return extract(text, null);
    }

    /**
     * Dates captured by the phrase patterns of one context only.
     */
    public SortedSet<LocalDate> extractScoped(String text, FactContext context) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (text == null || context == null) {
            return dates;
        }
        for (Pattern pattern : CONTEXT_PATTERNS.getOrDefault(context, List.of())) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                LocalDate date = DatePhraseParser.parse(matcher.group(1));
                if (date != null) {
                    dates.add(date);
                }
            }
        }
        return dates;
    }

    /**
     * Dates matched by the generic patterns anywhere in the text.
     */
    public SortedSet<LocalDate> extractGeneric(String text) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (text == null) {
            return dates;
        }
        for (Pattern pattern : GENERIC_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                LocalDate date = DatePhraseParser.fromMatch(pattern, matcher);
                if (date != null) {
                    dates.add(date);
                }
            }
        }
        return dates;
    }

    /**
     * Scoped dates for every context that yields at least one, in context declaration order.
     */
    public Map<FactContext, SortedSet<LocalDate>> extractWithContext(String text) {
        Map<FactContext, SortedSet<LocalDate>> out = new EnumMap<>(FactContext.class);
        for (FactContext context : CONTEXT_PATTERNS.keySet()) {
            SortedSet<LocalDate> dates = extractScoped(text, context);
            if (!dates.isEmpty()) {
                out.put(context, dates);
            }
        }
        return out;
    }

    /**
     * Contexts whose statement phrase occurs in the text, whether or not a date follows it.
     */
    public Set<FactContext> findContextStatements(String text) {
        Set<FactContext> found = EnumSet.noneOf(FactContext.class);
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Map.Entry<FactContext, List<Pattern>> entry : STATEMENT_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    found.add(entry.getKey());
                    break;
                }
            }
        }
        return found;
    }

    /**
     * "from X to Y" phrases where both ends parse.
     */
    public List<DateRange> extractDateRanges(String text) {
        List<DateRange> ranges = new ArrayList<>();
        if (text == null) {
            return ranges;
        }
        Matcher matcher = RANGE.matcher(text);
        while (matcher.find()) {
            LocalDate start = DatePhraseParser.parse(matcher.group(1));
            LocalDate end = DatePhraseParser.parse(matcher.group(2));
            if (start != null && end != null) {
                ranges.add(new DateRange(start, end, matcher.group()));
            }
        }
        return ranges;
    }

    public Optional<LocalDate> extractIncorporationDate(String text) {
        return first(extractScoped(text, FactContext.INCORPORATION));
    }

    public Optional<LocalDate> extractNameChangeDate(String text) {
        return first(extractScoped(text, FactContext.NAME_CHANGE));
    }

    /**
     * Exact day equality when {@code toleranceDays} is 0, otherwise an absolute day difference within tolerance.
     */
    public boolean compareDates(LocalDate first, LocalDate second, int toleranceDays) {
        if (first == null || second == null) {
            return false;
        }
        if (toleranceDays <= 0) {
            return first.equals(second);
        }
        return Math.abs(ChronoUnit.DAYS.between(first, second)) <= toleranceDays;
    }

    /**
     * One discrepancy per found date outside tolerance of {@code expected}, in input order.
     */
    public List<DateDiscrepancy> findMismatches(LocalDate expected, Collection<LocalDate> found, int toleranceDays) {
        List<DateDiscrepancy> discrepancies = new ArrayList<>();
        if (expected == null || found == null) {
            return discrepancies;
        }
        for (LocalDate date : found) {
            if (date != null && !compareDates(expected, date, toleranceDays)) {
                discrepancies.add(new DateDiscrepancy(expected, date, ChronoUnit.DAYS.between(expected, date)));
            }
        }
        return discrepancies;
    }

    /**
     * True when the dates are already in non-decreasing order.
     */
    public boolean validateSequence(List<LocalDate> dates) {
        if (dates == null) {
            return true;
        }
        for (int i = 1; i < dates.size(); i++) {
            LocalDate previous = dates.get(i - 1);
            LocalDate current = dates.get(i);
            if (previous == null || current == null || current.isBefore(previous)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Formats with one of {@code uk}, {@code us}, {@code iso} or {@code long}; unknown styles fall back to ISO.
     */
    public String formatDate(LocalDate date, String style) {
        if (date == null) {
            return null;
        }
        String key = style == null ? "iso" : style.trim().toLowerCase(Locale.ROOT);
        return FORMATS.getOrDefault(key, DateTimeFormatter.ISO_LOCAL_DATE).format(date);
    }

    private static Optional<LocalDate> first(SortedSet<LocalDate> dates) {
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.first());
    }

    private static Map<FactContext, List<String>> contextPhrases() {
        Map<FactContext, List<String>> phrases = new LinkedHashMap<>();
        phrases.put(FactContext.INCORPORATION, List.of(
            "date of incorporation", "incorporated on", "incorporation date"
        ));
        phrases.put(FactContext.NAME_CHANGE, List.of(
            "date of change", "changed (?:its name )?on", "effective (?:date|from)"
        ));
        phrases.put(FactContext.REGISTRATION, List.of(
            "date of registration", "registered on"
        ));
        phrases.put(FactContext.FILING, List.of(
            "filed on", "filing date"
        ));
        return phrases;
    }

    private static Map<FactContext, List<Pattern>> compile(String suffix) {
        Map<FactContext, List<Pattern>> compiled = new EnumMap<>(FactContext.class);
        for (Map.Entry<FactContext, List<String>> entry : CONTEXT_PHRASES.entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String phrase : entry.getValue()) {
                patterns.add(Pattern.compile("\\b" + phrase + suffix, Pattern.CASE_INSENSITIVE));
            }
            compiled.put(entry.getKey(), List.copyOf(patterns));
        }
        return compiled;
    }
}
