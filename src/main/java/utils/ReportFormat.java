package utils;

public enum ReportFormat {
    TEXT("text"),
    CSV("csv"),
    JSON("json");

    private final String formatName;

    ReportFormat(String formatName) {
        this.formatName = formatName;
    }

    // Factory method to obtain the format from its command line name
    public static ReportFormat fromString(String formatName) {
        for (ReportFormat format : ReportFormat.values()) {
            if (format.formatName.equalsIgnoreCase(formatName)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + formatName + " (expected text, csv or json)");
    }
}
