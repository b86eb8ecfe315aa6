package com.signalwatch.scan.extract;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive day-first date phrase parser.
 * <p>
 * Finds the earliest date-looking token in a phrase and turns it into a {@link LocalDate}. Numeric
 * dates are read as day/month/year, falling back to month/day/year only when the day-first reading
 * is impossible. A phrase naming only a month and year resolves to the first of the month. Dates
 * outside {@value #MIN_YEAR}..{@value #MAX_YEAR} are discarded.
 */
public final class DatePhraseParser {
    public static final int MIN_YEAR = 1800;
    public static final int MAX_YEAR = 2100;

    static final String MONTH = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
        + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";

    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final Pattern NUMERIC_LONG_YEAR = Pattern.compile("\\b(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})\\b");
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
        "\\b(\\d{1,2})(?:st|nd|rd|th)?(?:\\s+of)?\\s+" + MONTH + "\\.?,?\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
        "\\b" + MONTH + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NUMERIC_SHORT_YEAR = Pattern.compile("\\b(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{2})\\b");
    private static final Pattern MONTH_YEAR = Pattern.compile("\\b" + MONTH + "\\.?,?\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PRIORITY = List.of(
        ISO, NUMERIC_LONG_YEAR, DAY_MONTH_YEAR, MONTH_DAY_YEAR, NUMERIC_SHORT_YEAR, MONTH_YEAR
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private DatePhraseParser() {}

    /**
     * Parses the earliest date found in {@code phrase}, or returns null when nothing in it reads as a
     * plausible date.
     */
    public static LocalDate parse(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return null;
        }
        LocalDate best = null;
        int bestStart = Integer.MAX_VALUE;
        for (Pattern pattern : PRIORITY) {
            Matcher matcher = pattern.matcher(phrase);
            while (matcher.find()) {
                if (matcher.start() >= bestStart) {
                    break;
                }
                LocalDate candidate = fromMatch(pattern, matcher);
                if (candidate != null) {
                    best = candidate;
                    bestStart = matcher.start();
                    break;
                }
            }
        }
        return best;
    }

    /**
     * Turns one match of a generic date pattern into a date, applying the range check.
     */
    static LocalDate fromMatch(Pattern pattern, Matcher matcher) {
        if (pattern == ISO) {
            return build(toInt(matcher.group(1)), toInt(matcher.group(2)), toInt(matcher.group(3)));
        }
        if (pattern == NUMERIC_LONG_YEAR) {
            return dayFirst(toInt(matcher.group(1)), toInt(matcher.group(2)), toInt(matcher.group(3)));
        }
        if (pattern == NUMERIC_SHORT_YEAR) {
            return dayFirst(toInt(matcher.group(1)), toInt(matcher.group(2)), expandYear(toInt(matcher.group(3))));
        }
        if (pattern == DAY_MONTH_YEAR) {
            return build(toInt(matcher.group(3)), month(matcher.group(2)), toInt(matcher.group(1)));
        }
        if (pattern == MONTH_DAY_YEAR) {
            return build(toInt(matcher.group(3)), month(matcher.group(1)), toInt(matcher.group(2)));
        }
        if (pattern == MONTH_YEAR) {
            return build(toInt(matcher.group(2)), month(matcher.group(1)), 1);
        }
        return null;
    }

    static Pattern numericLongYear() {
        return NUMERIC_LONG_YEAR;
    }

    static Pattern dayMonthYear() {
        return DAY_MONTH_YEAR;
    }

    static Pattern monthDayYear() {
        return MONTH_DAY_YEAR;
    }

    static Pattern numericShortYear() {
        return NUMERIC_SHORT_YEAR;
    }

    public static boolean inRange(LocalDate date) {
        return date != null && date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR;
    }

    private static LocalDate dayFirst(int day, int month, int year) {
        LocalDate date = build(year, month, day);
        if (date == null && month > 12 && day <= 12) {
            date = build(year, day, month);
        }
        return date;
    }

    private static LocalDate build(int year, int month, int day) {
        if (year < MIN_YEAR || year > MAX_YEAR || month < 1 || month > 12 || day < 1) {
            return null;
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int expandYear(int twoDigitYear) {
        return twoDigitYear >= 69 ? 1900 + twoDigitYear : 2000 + twoDigitYear;
    }

    private static int month(String token) {
        if (token == null || token.length() < 3) {
            return -1;
        }
        return MONTHS.getOrDefault(token.substring(0, 3).toLowerCase(Locale.ROOT), -1);
    }

    private static int toInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
