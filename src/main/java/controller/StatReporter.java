package controller;

import model.ReportOptions;
import model.Stat;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import utils.PrintUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

// Sorts, filters and prints the collected Stats
public class StatReporter {

    private static final Logger LOGGER = Logger.getLogger(StatReporter.class.getName());

    private final ReportOptions options;

    public StatReporter(ReportOptions options) {
        this.options = options;
    }

    // Deepest first; List.sort is stable so ties keep discovery order
    public static List<Stat> sortByDepth(List<Stat> stats) {
        List<Stat> sorted = new ArrayList<>(stats);
        sorted.sort(Comparator.comparingInt(Stat::getDepth).reversed());
        return sorted;
    }

    /**
     * Applies -top then -over to a depth-descending list.
     */
    public List<Stat> select(List<Stat> sortedStats) {
        List<Stat> selected = new ArrayList<>();
        for (int i = 0; i < sortedStats.size(); i++) {
            Stat stat = sortedStats.get(i);
            if (options.hasTop() && i == options.getTop()) {
                break;
            }
            if (stat.getDepth() <= options.getOver()) {
                break;
            }
            selected.add(stat);
        }
        return selected;
    }

    // NaN when there is nothing to average
    public static double average(List<Stat> stats) {
        double[] depths = stats.stream().mapToDouble(Stat::getDepth).toArray();
        return new Mean().evaluate(depths);
    }

    /**
     * Prints the report for all collected stats and returns how many records were written.
     * The average, when requested, covers every collected stat, not just the printed ones.
     */
    public int report(List<Stat> stats, PrintWriter writer) throws IOException {
        List<Stat> selected = select(sortByDepth(stats));
        Double avg = options.isAverage() ? average(stats) : null;

        switch (options.getFormat()) {
            case CSV:
                PrintUtils.printStatsCsv(selected, avg, writer);
                break;
            case JSON:
                PrintUtils.printStatsJson(selected, avg, writer);
                break;
            default:
                PrintUtils.printStats(selected, avg, writer);
                break;
        }
        writer.flush();

        LOGGER.log(Level.INFO, "{0} of {1} declarations reported.", new Object[]{selected.size(), stats.size()});
        return selected.size();
    }

    public boolean isThresholdViolated(int written) {
        return options.isOverActive() && written > 0;
    }
}
