package com.signalwatch.scan.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.scan.model.CompanyOfficer;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.CompanyStatus;
import com.signalwatch.scan.model.CompanySummary;
import com.signalwatch.scan.model.DirectorAppointment;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.FilingDocumentType;
import com.signalwatch.scan.model.PreviousCompanyName;
import com.signalwatch.scan.util.CompanyNumbers;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps registry JSON payloads onto the scan model.
 */
public class RegistryResponseParser {
    private static final String[] ADDRESS_FIELDS = {
        "premises", "address_line_1", "address_line_2", "locality", "region", "postal_code", "country"
    };

    private final ObjectMapper objectMapper;

    public RegistryResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(String body, String subject) {
        if (body == null || body.isBlank()) {
            throw new ResponseParseException("Empty registry response for " + subject, null);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ResponseParseException("Registry response for " + subject + " is not a JSON object", null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Malformed registry response for " + subject, e);
        }
    }

    public CompanyRecord parseProfile(JsonNode root) {
        String companyNumber = text(root, "company_number");
        if (companyNumber == null || !CompanyNumbers.isValid(companyNumber)) {
            throw new ResponseParseException("Company profile is missing a valid company_number", null);
        }
        List<PreviousCompanyName> previousNames = new ArrayList<>();
        for (JsonNode previous : root.path("previous_company_names")) {
            String name = text(previous, "name");
            if (name != null) {
                previousNames.add(new PreviousCompanyName(
                    name,
                    date(previous, "effective_from"),
                    date(previous, "ceased_on")
                ));
            }
        }
        return new CompanyRecord(
            CompanyNumbers.normalize(companyNumber),
            text(root, "company_name"),
            CompanyStatus.fromRegistryValue(text(root, "company_status")),
            date(root, "date_of_creation"),
            date(root, "date_of_cessation"),
            address(root.path("registered_office_address")),
            textSet(root.path("sic_codes")),
            text(root, "type"),
            previousNames
        );
    }

    public FilingDocument parseFiling(JsonNode item, String companyNumber, Instant retrievedAt) {
        String category = text(item, "category");
        return new FilingDocument(
            documentIdFromLink(text(item.path("links"), "document_metadata")),
            companyNumber,
            FilingDocumentType.fromCategory(category),
            category,
            text(item, "description"),
            date(item, "date"),
            retrievedAt
        );
    }

    public CompanySummary parseSearchItem(JsonNode item) {
        String companyNumber = text(item, "company_number");
        if (companyNumber == null || !CompanyNumbers.isValid(companyNumber)) {
            return null;
        }
        String name = text(item, "company_name");
        if (name == null) {
            name = text(item, "title");
        }
        JsonNode addressNode = item.has("registered_office_address")
            ? item.path("registered_office_address")
            : item.path("address");
        String address = address(addressNode);
        if (address == null) {
            address = text(item, "address_snippet");
        }
        return new CompanySummary(
            CompanyNumbers.normalize(companyNumber),
            name,
            CompanyStatus.fromRegistryValue(text(item, "company_status")),
            date(item, "date_of_creation"),
            date(item, "date_of_cessation"),
            firstNonBlank(text(item, "company_type"), text(item, "type")),
            address,
            new ArrayList<>(textSet(item.path("sic_codes")))
        );
    }

    public CompanyOfficer parseOfficer(JsonNode item) {
        String directorId = officerIdFromLink(text(item.path("links").path("officer"), "appointments"));
        if (directorId == null) {
            return null;
        }
        return new CompanyOfficer(
            directorId,
            text(item, "name"),
            text(item, "officer_role"),
            date(item, "appointed_on"),
            date(item, "resigned_on")
        );
    }

    public DirectorAppointment parseAppointment(JsonNode item) {
        JsonNode appointedTo = item.path("appointed_to");
        String companyNumber = text(appointedTo, "company_number");
        if (companyNumber == null || !CompanyNumbers.isValid(companyNumber)) {
            return null;
        }
        return new DirectorAppointment(
            CompanyNumbers.normalize(companyNumber),
            text(appointedTo, "company_name"),
            CompanyStatus.fromRegistryValue(text(appointedTo, "company_status")),
            text(item, "officer_role"),
            date(item, "appointed_on"),
            date(item, "resigned_on")
        );
    }

    static String documentIdFromLink(String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String trimmed = link.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String id = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return id.isBlank() ? null : id;
    }

    static String officerIdFromLink(String link) {
        if (link == null) {
            return null;
        }
        String[] parts = link.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if ("officers".equals(parts[i]) && !parts[i + 1].isBlank()) {
                return parts[i + 1];
            }
        }
        return null;
    }

    private String address(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText().trim();
        }
        List<String> parts = new ArrayList<>();
        for (String field : ADDRESS_FIELDS) {
            String value = text(node, field);
            if (value != null) {
                parts.add(value);
            }
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private Set<String> textSet(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (node != null && node.isArray()) {
            for (JsonNode child : node) {
                if (child.isTextual() && !child.asText().isBlank()) {
                    values.add(child.asText().trim());
                }
            }
        }
        return values;
    }

    private LocalDate date(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null) {
            return null;
        }
        String candidate = raw.length() >= 10 ? raw.substring(0, 10) : raw;
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
