package com.telefonchi.migrationcli.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.telefonchi.database.migration.MigrationStatusReporter.State;
import com.telefonchi.database.migration.MigrationStatusReporter.StatusReport;
import com.telefonchi.database.migration.MigrationStatusReporter.UnitStatus;
import com.telefonchi.migrationcli.command.MigrationCommand.OutputFormat;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders a {@link StatusReport} as human-readable text or as JSON. */
@Component
public class StatusFormatter {

    private static final ObjectMapper MAPPER =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .enable(SerializationFeature.INDENT_OUTPUT);

    /** JSON shape of a status report. */
    public record StatusView(
            int available,
            int applied,
            int pending,
            String currentVersion,
            boolean upToDate,
            List<UnitView> units) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UnitView(
            String identifier,
            String state,
            Instant appliedAt,
            boolean sourcePresent,
            Boolean checksumMatches) {}

    public String format(StatusReport report, OutputFormat format) {
        return format == OutputFormat.JSON ? json(report) : text(report);
    }

    public String text(StatusReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Migration Status ===\n");
        sb.append("Total available: ").append(report.available()).append('\n');
        sb.append("Total applied:   ").append(report.applied()).append('\n');
        sb.append("Total pending:   ").append(report.pending()).append('\n');
        sb.append("Current version: ")
                .append(report.currentVersion() == null ? "none" : report.currentVersion())
                .append('\n');

        if (!report.units().isEmpty()) {
            sb.append('\n');
        }
        for (UnitStatus unit : report.units()) {
            sb.append("  ").append(String.format("%-8s", state(unit.state())));
            sb.append(unit.identifier());
            if (unit.appliedAt() != null) {
                sb.append("  ").append(unit.appliedAt());
            }
            if (!unit.sourcePresent()) {
                sb.append("  (source missing)");
            }
            if (Boolean.FALSE.equals(unit.checksumMatches())) {
                sb.append("  (modified since applied)");
            }
            sb.append('\n');
        }

        if (report.upToDate()) {
            sb.append("\nAll migrations are up to date!\n");
        }
        return sb.toString();
    }

    public String json(StatusReport report) {
        List<UnitView> units =
                report.units().stream()
                        .map(
                                u ->
                                        new UnitView(
                                                u.identifier(),
                                                state(u.state()),
                                                u.appliedAt(),
                                                u.sourcePresent(),
                                                u.checksumMatches()))
                        .toList();
        StatusView view =
                new StatusView(
                        report.available(),
                        report.applied(),
                        report.pending(),
                        report.currentVersion(),
                        report.upToDate(),
                        units);
        try {
            return MAPPER.writeValueAsString(view) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new StatusFormatException("Failed to render migration status as JSON", e);
        }
    }

    private static String state(State state) {
        return state.name().toLowerCase(Locale.ROOT);
    }

    /** Thrown when the status report cannot be serialized. */
    public static class StatusFormatException extends RuntimeException {
        public StatusFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
