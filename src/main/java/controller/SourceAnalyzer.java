package controller;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import model.Stat;
import utils.SourceParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

// Discovers source files under the given paths and collects one Stat per declaration
public class SourceAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SourceAnalyzer.class.getName());
    public static final String SOURCE_EXTENSION = ".java";

    private final JavaParser parser;

    public SourceAnalyzer() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public SourceAnalyzer(ParserConfiguration configuration) {
        this.parser = new JavaParser(configuration);
    }

    /**
     * Analyze every path in argument order. Directories are walked recursively for
     * {@value #SOURCE_EXTENSION} files; anything else is parsed as a single file.
     * The first file that fails to parse aborts the run.
     */
    public List<Stat> analyze(List<Path> paths) throws SourceParseException {
        List<Stat> stats = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                analyzeDir(path, stats);
            } else {
                analyzeFile(path, stats);
            }
        }
        LOGGER.log(Level.INFO, "{0} declarations analyzed.", stats.size());
        return stats;
    }

    public List<Stat> analyzeDir(Path dir, List<Stat> stats) throws SourceParseException {
        for (Path file : findSourceFiles(dir)) {
            analyzeFile(file, stats);
        }
        return stats;
    }

    public List<Stat> analyzeFile(Path file, List<Stat> stats) throws SourceParseException {
        LOGGER.log(Level.INFO, "Analyzing {0}", file);
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file);
        } catch (IOException e) {
            throw new SourceParseException(file, "cannot read file: " + e.getMessage(), e);
        }

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SourceParseException(file, describe(result.getProblems()));
        }

        int before = stats.size();
        DeclarationCollector.buildStats(result.getResult().get(), file.toString(), stats);
        LOGGER.log(Level.INFO, "{0}: {1} declarations.", new Object[]{file, stats.size() - before});
        return stats;
    }

    // Regular source files below dir, in path order
    static List<Path> findSourceFiles(Path dir) throws SourceParseException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SourceParseException(dir, "cannot walk directory: " + e.getMessage(), e);
        }
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "parse failed";
        }
        Problem first = problems.get(0);
        String location = first.getLocation()
                .flatMap(tokenRange -> tokenRange.getBegin().getRange())
                .map(range -> range.begin.line + ":" + range.begin.column + ": ")
                .orElse("");
        return location + first.getMessage();
    }
}
