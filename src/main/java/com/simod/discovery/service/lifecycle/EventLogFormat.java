package com.simod.discovery.service.lifecycle;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Event log file types accepted on submission.
 *
 * The type is taken from the file name first and from the declared content
 * type when the name is not conclusive.
 */
public enum EventLogFormat {

    CSV_GZ(".csv.gz", List.of("application/gzip", "application/x-gzip")),
    XES_GZ(".xes.gz", List.of()),
    CSV(".csv", List.of("text/csv", "application/csv")),
    XES(".xes", List.of()),
    XML(".xml", List.of("application/xml", "text/xml"));

    private static final String STORED_NAME = "event_log";

    private final String extension;
    private final List<String> contentTypes;

    EventLogFormat(String extension, List<String> contentTypes) {
        this.extension = extension;
        this.contentTypes = contentTypes;
    }

    /**
     * Name the log is stored under inside the job namespace.
     */
    public String storedName() {
        return STORED_NAME + extension;
    }

    public static Optional<EventLogFormat> infer(String filename, String contentType) {
        if (filename != null) {
            String lower = filename.toLowerCase(Locale.ROOT);
            Optional<EventLogFormat> byName = Arrays.stream(values())
                    .filter(format -> lower.endsWith(format.extension))
                    .findFirst();
            if (byName.isPresent()) {
                return byName;
            }
        }
        if (contentType != null) {
            String lower = contentType.toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(format -> format.contentTypes.stream().anyMatch(lower::contains))
                    .findFirst();
        }
        return Optional.empty();
    }
}
