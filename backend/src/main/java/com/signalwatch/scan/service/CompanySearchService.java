package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.model.CompanySearchFilters;
import com.signalwatch.scan.model.CompanySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves scan targets from registry search. Only the name fragment and status are sent to the
 * registry; the remaining filters run over the returned records.
 */
@Service
public class CompanySearchService {
    private static final Logger log = LoggerFactory.getLogger(CompanySearchService.class);

    private final ScannerProperties properties;

    public CompanySearchService(ScannerProperties properties) {
        this.properties = properties;
    }

    public List<CompanySummary> search(CompaniesHouseClient client, String query, String status, Integer limit) {
        return client.search(query, blankToNull(status), resolveLimit(limit));
    }

    public List<CompanySummary> findCompanies(CompaniesHouseClient client, CompanySearchFilters filters) {
        int limit = resolveLimit(filters.limit());
        String status = blankToNull(filters.status());
        Map<String, CompanySummary> found = new LinkedHashMap<>();
        List<String> letters = letters(filters.alphaStart(), filters.alphaEnd());
        if (!letters.isEmpty()) {
            for (String letter : letters) {
                for (CompanySummary summary : client.search(letter, status, limit)) {
                    found.putIfAbsent(summary.companyNumber(), summary);
                }
                if (found.size() >= limit) {
                    break;
                }
            }
        } else {
            for (CompanySummary summary : client.search(blankToNull(filters.query()), status, limit)) {
                found.putIfAbsent(summary.companyNumber(), summary);
            }
        }

        List<CompanySummary> matches = new ArrayList<>();
        for (CompanySummary summary : found.values()) {
            if (matches.size() >= limit) {
                break;
            }
            if (matches(summary, filters)) {
                matches.add(summary);
            }
        }
        log.info("Search resolved {} of {} candidates after filters", matches.size(), found.size());
        return matches;
    }

    boolean matches(CompanySummary summary, CompanySearchFilters filters) {
        if (filters.yearFrom() != null || filters.yearTo() != null) {
            LocalDate created = summary.incorporationDate();
            if (created == null) {
                return false;
            }
            int year = created.getYear();
            if ((filters.yearFrom() != null && year < filters.yearFrom()) || (filters.yearTo() != null && year > filters.yearTo())) {
                return false;
            }
        }
        String location = blankToNull(filters.location());
        if (location != null) {
            String address = summary.address() == null ? "" : summary.address().toUpperCase(Locale.ROOT);
            if (!address.contains(location.toUpperCase(Locale.ROOT))) {
                return false;
            }
        }
        if (!filters.sicCodes().isEmpty()) {
            boolean anyCode = false;
            for (String code : filters.sicCodes()) {
                if (code != null && summary.sicCodes().contains(code.trim())) {
                    anyCode = true;
                    break;
                }
            }
            if (!anyCode) {
                return false;
            }
        }
        if (!filters.companyTypes().isEmpty() && !filters.companyTypes().contains(summary.companyType())) {
            return false;
        }
        if (filters.dissolvedFrom() != null || filters.dissolvedTo() != null) {
            LocalDate dissolved = summary.dissolutionDate();
            if (dissolved == null) {
                return false;
            }
            if (filters.dissolvedFrom() != null && dissolved.isBefore(filters.dissolvedFrom())) {
                return false;
            }
            if (filters.dissolvedTo() != null && dissolved.isAfter(filters.dissolvedTo())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Letters from start to end inclusive, at most {@code maxLetters} of them.
     */
    List<String> letters(String start, String end) {
        String from = blankToNull(start);
        String to = blankToNull(end);
        if (from == null || to == null) {
            return List.of();
        }
        char first = Character.toUpperCase(from.charAt(0));
        char last = Character.toUpperCase(to.charAt(0));
        if (first < 'A' || first > 'Z' || last < 'A' || last > 'Z') {
            throw new InvalidScanRequestException("Alphabetical range must use letters A-Z");
        }
        if (last < first) {
            throw new InvalidScanRequestException("Alphabetical range end precedes its start");
        }
        int maxLetters = properties.getSearch().getMaxLetters();
        List<String> letters = new ArrayList<>();
        for (char letter = first; letter <= last && letters.size() < maxLetters; letter++) {
            letters.add(String.valueOf(letter));
        }
        return letters;
    }

    private int resolveLimit(Integer limit) {
        return limit == null ? properties.getSearch().getDefaultLimit() : Math.max(1, limit);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
