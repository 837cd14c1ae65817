package polyopt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import polyopt.Util.config.Configuration;
import polyopt.Util.error.Errors;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.transform.Transformation;
import polyopt.session.Scop;
import polyopt.session.Scops;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            Configuration config = new Configuration(args);
            if (config.help) {
                System.out.print(Configuration.getUsage());
                return;
            }
            run(config);
        } catch (Errors e) {
            System.err.println(e);
            System.exit(1);
        }
    }

    static void run(Configuration config) {
        try (Scops scops = Scops.open(Path.of(config.inputPath), config)) {
            if (config.scriptPath != null) {
                runScript(scops, readLines(config.scriptPath));
            }
            if (config.printSchedule) {
                for (int i = 0; i < scops.size(); ++i) {
                    Scop scop = scops.select(i);
                    if (scop.failure() == null) {
                        System.out.println("scop " + i + ":");
                        System.out.println(scop.scheduleText());
                    }
                }
            }
            scops.generate(config.outputPath);
        }
    }

    private static List<String> readLines(String path) {
        try {
            return Files.readAllLines(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolkitFailure("cannot read " + path, e);
        }
    }

    /**
     * Runs {@code scop node-path operator args...} lines; blank lines and
     * lines starting with {@code #} are skipped. A step that makes the
     * schedule illegal is rolled back, a step that fails is reported, and the
     * script goes on.
     */
    static int runScript(Scops scops, List<String> lines) {
        int rejected = 0;
        for (int n = 0; n < lines.size(); ++n) {
            String line = lines.get(n).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] words = line.split("\\s+");
            try {
                if (words.length < 3) {
                    throw new ToolkitFailure("expected `scop node-path operator args...`");
                }
                Scop scop = scops.select(Integer.parseInt(words[0]));
                scop.gotoPath(words[1]);
                Transformation transformation = Transformation.parse(words[2]);
                if (!scop.transform(transformation, Arrays.copyOfRange(words, 3, words.length))) {
                    scop.rollback();
                    ++rejected;
                    System.out.println("line " + (n + 1) + ": " + line + " is illegal, rolled back");
                } else {
                    logger.info("line {}: {} applied", n + 1, line);
                }
            } catch (Errors e) {
                ++rejected;
                System.err.println("line " + (n + 1) + ": " + e);
            } catch (NumberFormatException e) {
                ++rejected;
                System.err.println("line " + (n + 1) + ": bad scop index " + words[0]);
            }
        }
        return rejected;
    }
}
