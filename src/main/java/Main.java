import controller.DepthCommand;
import picocli.CommandLine;

import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {

    public static void main(String[] args) {
        // Only the report goes to the console unless -v is given
        Logger.getLogger("").setLevel(Level.SEVERE);

        int exitCode = new CommandLine(new DepthCommand()).execute(args);
        System.exit(exitCode);
    }
}
