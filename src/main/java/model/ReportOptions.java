package model;

import utils.ReportFormat;

// Reporter settings taken from the command line
public class ReportOptions {

    public static final int NO_LIMIT = -1;

    private final int top;
    private final int over;
    private final boolean average;
    private final ReportFormat format;

    public ReportOptions(int top, int over, boolean average, ReportFormat format) {
        this.top = top;
        this.over = over;
        this.average = average;
        this.format = format;
    }

    public static ReportOptions defaults() {
        return new ReportOptions(NO_LIMIT, 0, false, ReportFormat.TEXT);
    }

    public int getTop() {
        return top;
    }

    public int getOver() {
        return over;
    }

    public boolean isAverage() {
        return average;
    }

    public ReportFormat getFormat() {
        return format;
    }

    public boolean hasTop() {
        return top != NO_LIMIT;
    }

    // -over only acts as a threshold check when positive
    public boolean isOverActive() {
        return over > 0;
    }

    public ReportOptions withTop(int top) {
        return new ReportOptions(top, over, average, format);
    }

    public ReportOptions withOver(int over) {
        return new ReportOptions(top, over, average, format);
    }

    public ReportOptions withAverage(boolean average) {
        return new ReportOptions(top, over, average, format);
    }

    @Override
    public String toString() {
        return "ReportOptions{" +
                "top=" + top +
                ", over=" + over +
                ", average=" + average +
                ", format=" + format +
                '}';
    }
}
