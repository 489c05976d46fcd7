package utils;

import model.Stat;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;


public class PrintUtils {

    private static final String[] CSV_HEADER = {"depth", "package", "function", "file", "line", "column"};
    private static final String AVERAGE_LABEL = "Average: ";

    private PrintUtils() {}

    public static String formatAverage(double average) {
        return AVERAGE_LABEL + String.format(Locale.US, "%.3g", average);
    }

    // <depth> <package> <function> <file:row:column>, one per line
    public static void printStats(List<Stat> stats, Double average, PrintWriter writer) {
        for (Stat stat : stats) {
            writer.println(stat);
        }
        if (average != null) {
            writer.println(formatAverage(average));
        }
    }

    public static void printStatsCsv(List<Stat> stats, Double average, PrintWriter writer) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(CSV_HEADER)
                .setCommentMarker('#')
                .setRecordSeparator(System.lineSeparator())
                .build();

        CSVPrinter csvPrinter = new CSVPrinter(writer, csvFormat);
        for (Stat stat : stats) {
            csvPrinter.printRecord(stat.getDepth(), stat.getPackageName(), stat.getFunctionName(),
                    stat.getFile(), stat.getLine(), stat.getColumn());
        }
        if (average != null) {
            csvPrinter.printComment(formatAverage(average));
        }
        csvPrinter.flush();
    }

    public static void printStatsJson(List<Stat> stats, Double average, PrintWriter writer) {
        JSONArray statArray = new JSONArray();
        for (Stat stat : stats) {
            JSONObject statObject = new JSONObject();
            statObject.put("depth", stat.getDepth());
            statObject.put("package", stat.getPackageName());
            statObject.put("function", stat.getFunctionName());
            statObject.put("file", stat.getFile());
            statObject.put("line", stat.getLine());
            statObject.put("column", stat.getColumn());
            statArray.put(statObject);
        }

        JSONObject report = new JSONObject();
        report.put("stats", statArray);
        if (average != null) {
            // JSON has no NaN
            report.put("average", Double.isNaN(average) ? JSONObject.NULL : average);
        }
        writer.println(report.toString(2));
    }
}
