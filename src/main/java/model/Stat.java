package model;

import java.util.Objects;

// One analyzed declaration: where it is and how deep its blocks nest
public class Stat {

    private final String packageName;
    private final String functionName;
    private final int depth;
    private final String file;
    private final int line;
    private final int column;

    public Stat(String packageName, String functionName, int depth, String file, int line, int column) {
        this.packageName = packageName;
        this.functionName = functionName;
        this.depth = depth;
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getDepth() {
        return depth;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getPosition() {
        return file + ":" + line + ":" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Stat stat = (Stat) o;
        return depth == stat.depth && line == stat.line && column == stat.column
                && Objects.equals(packageName, stat.packageName)
                && Objects.equals(functionName, stat.functionName)
                && Objects.equals(file, stat.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, functionName, depth, file, line, column);
    }

    // <depth> <package> <function> <file:row:column>
    @Override
    public String toString() {
        return depth + " " + packageName + " " + functionName + " " + getPosition();
    }
}
