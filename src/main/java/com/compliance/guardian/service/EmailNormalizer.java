package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.exception.BatchRejectedException;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.IngestionReport;
import com.compliance.guardian.model.NormalizedBatch;
import com.compliance.guardian.model.NormalizedRow;
import com.compliance.guardian.model.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns raw import rows into Emails. Pure: nothing is persisted here.
 *
 * <p>A batch missing a required column is rejected as a whole. Otherwise every
 * row is either accepted or skipped with a 1-based row number and a reason, so
 * {@code accepted + skipped == totalRows} always holds.
 */
@Service
public class EmailNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EmailNormalizer.class);

    static final String COL_SENDER = "sender";
    static final String COL_SUBJECT = "subject";
    static final String COL_BODY = "body";
    static final String COL_CONTENT = "content";

    private static final List<String> DATE_COLUMNS = List.of("date", "_time", "received_at", "timestamp");
    private static final List<String> BUSINESS_UNIT_COLUMNS = List.of("business_unit", "bunit");
    private static final List<String> CATEGORY_COLUMNS = List.of("category", "final_outcome");

    private static final Pattern MULTI_VALUE_SEPARATOR = Pattern.compile("[,;|]");

    // Month-first is tried before day-first, so 03/04/2024 reads as March 4th
    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm[:ss][.SSS]"),
            strict("M/d/uuuu H:mm[:ss]"),
            strict("d/M/uuuu H:mm[:ss]"),
            strict("uuuu/MM/dd HH:mm[:ss]"));

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("M/d/uuuu"),
            strict("d/M/uuuu"),
            strict("uuuu/MM/dd"));

    private final GuardianProperties properties;

    public EmailNormalizer(GuardianProperties properties) {
        this.properties = properties;
    }

    public NormalizedBatch normalize(List<Map<String, String>> rawRows) {
        if (rawRows == null || rawRows.isEmpty()) {
            return new NormalizedBatch(List.of(), IngestionReport.builder().build());
        }

        List<Map<String, String>> rows = new ArrayList<>(rawRows.size());
        Set<String> columns = new HashSet<>();
        for (Map<String, String> raw : rawRows) {
            Map<String, String> row = normalizeColumns(raw);
            rows.add(row);
            columns.addAll(row.keySet());
        }

        List<String> missing = new ArrayList<>();
        if (!columns.contains(COL_SENDER)) missing.add(COL_SENDER);
        if (!columns.contains(COL_SUBJECT)) missing.add(COL_SUBJECT);
        if (!columns.contains(COL_BODY) && !columns.contains(COL_CONTENT)) missing.add(COL_BODY + "|" + COL_CONTENT);
        if (!missing.isEmpty()) {
            log.warn("Rejecting batch of {} rows, missing columns {}", rawRows.size(), missing);
            throw new BatchRejectedException(missing);
        }

        ZoneId zone = ZoneId.of(properties.getIngestion().getZoneId());
        long importedAt = System.currentTimeMillis();
        List<NormalizedRow> accepted = new ArrayList<>();
        List<SkipReason> skipReasons = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            Map<String, String> row = rows.get(i);

            String sender = value(row, COL_SENDER);
            if (sender == null) {
                skipReasons.add(new SkipReason(rowNumber, "sender is empty"));
                continue;
            }
            String subject = value(row, COL_SUBJECT);
            if (subject == null) {
                skipReasons.add(new SkipReason(rowNumber, "subject is empty"));
                continue;
            }
            String body = value(row, COL_BODY);
            if (body == null) body = value(row, COL_CONTENT);
            if (body == null) body = "";

            long receivedAt = importedAt;
            String rawDate = firstValue(row, DATE_COLUMNS);
            if (rawDate != null) {
                Long parsed = parseTimestamp(rawDate, zone);
                if (parsed == null) {
                    skipReasons.add(new SkipReason(rowNumber, "unparsable date '" + rawDate + "'"));
                    continue;
                }
                receivedAt = parsed;
            }

            Email email = Email.builder()
                    .emailId(UUID.randomUUID().toString())
                    .sender(sender.trim())
                    .subject(subject)
                    .body(body)
                    .recipients(splitMultiValue(value(row, "recipients")))
                    .attachments(splitMultiValue(value(row, "attachments")))
                    .department(value(row, "department"))
                    .businessUnit(firstValue(row, BUSINESS_UNIT_COLUMNS))
                    .categoryHint(firstValue(row, CATEGORY_COLUMNS))
                    .receivedAt(receivedAt)
                    .importedAt(importedAt)
                    .build();
            accepted.add(new NormalizedRow(rowNumber, email));
        }

        IngestionReport report = IngestionReport.builder()
                .totalRows(rows.size())
                .accepted(accepted.size())
                .skipped(skipReasons.size())
                .skipReasons(skipReasons)
                .build();

        if (!skipReasons.isEmpty()) {
            log.warn("Normalized batch: {} accepted, {} skipped (first: row {} {})", report.getAccepted(),
                    report.getSkipped(), skipReasons.get(0).getRowNumber(), skipReasons.get(0).getReason());
        } else {
            log.debug("Normalized batch: {} accepted", report.getAccepted());
        }
        return new NormalizedBatch(accepted, report);
    }

    /**
     * Parse a timestamp in any supported layout.
     *
     * @return epoch millis, or null if no layout fits
     */
    Long parseTimestamp(String raw, ZoneId zone) {
        String text = raw.trim();

        Long millis = tryParse(() -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        if (millis != null) return millis;

        for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
            millis = tryParse(() -> LocalDateTime.parse(text, format).atZone(zone).toInstant());
            if (millis != null) return millis;
        }
        for (DateTimeFormatter format : LOCAL_DATE_FORMATS) {
            millis = tryParse(() -> LocalDate.parse(text, format).atStartOfDay(zone).toInstant());
            if (millis != null) return millis;
        }
        return null;
    }

    private static Long tryParse(Supplier<Instant> parser) {
        try {
            return parser.get().toEpochMilli();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private Map<String, String> normalizeColumns(Map<String, String> raw) {
        Map<String, String> row = new LinkedHashMap<>();
        if (raw == null) return row;
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            if (entry.getKey() == null) continue;
            String column = entry.getKey().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
            if (column.isEmpty()) continue;
            row.put(column, entry.getValue());
        }
        return row;
    }

    /**
     * Cell value with null markers and blanks mapped to null.
     */
    private String value(Map<String, String> row, String column) {
        String raw = row.get(column);
        if (raw == null) return null;
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return null;
        for (String marker : properties.getIngestion().getNullMarkers()) {
            if (marker.equalsIgnoreCase(trimmed)) return null;
        }
        return raw;
    }

    private String firstValue(Map<String, String> row, List<String> columns) {
        for (String column : columns) {
            String v = value(row, column);
            if (v != null) return v;
        }
        return null;
    }

    private static List<String> splitMultiValue(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) return values;
        Arrays.stream(MULTI_VALUE_SEPARATOR.split(raw))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(values::add);
        return values;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
