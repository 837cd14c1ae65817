package polyopt.Util.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.dependency.Dependency;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of one run: defaults from {@code polyopt.properties} on the
 * classpath, overridden by command line options.
 */
public class Configuration {
    public final static String opt_input = "i";
    public final static String opt_output = "o";
    public final static String opt_script = "t";
    public final static String opt_param = "P";
    public final static String opt_schedule = "s";
    public final static String opt_help = "h";

    public final static String key_param_prefix = "param.";
    public final static String key_dependence_kinds = "dependence.kinds";
    public final static String key_instances_max = "instances.max";
    public final static String key_indent = "codegen.indent";
    public final static String key_iterator_prefix = "codegen.iterator.prefix";

    public final static String default_output = "out.c";
    public final static String resource = "/polyopt.properties";

    public String inputPath;
    public String outputPath;
    public String scriptPath;
    public boolean printSchedule;
    public boolean help;

    public HashMap<String, Long> params;
    public EnumSet<Dependency> dependenceKinds;
    public long maxInstances;
    public int indent;
    public String iteratorPrefix;

    public Configuration() {
        this(loadDefaults());
    }

    public Configuration(Properties properties) {
        params = new HashMap<>();
        outputPath = default_output;
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(key_param_prefix)) {
                setParam(key.substring(key_param_prefix.length()), properties.getProperty(key));
            }
        }
        dependenceKinds = EnumSet.noneOf(Dependency.class);
        for (String kind : properties.getProperty(key_dependence_kinds, "flow,anti,output").split(",")) {
            if (kind.isBlank()) {
                continue;
            }
            try {
                dependenceKinds.add(Dependency.valueOf(kind.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ToolkitFailure("unknown dependence kind " + kind.trim(), e);
            }
        }
        maxInstances = parseLong(key_instances_max, properties.getProperty(key_instances_max, "4000000"));
        indent = (int) parseLong(key_indent, properties.getProperty(key_indent, "2"));
        iteratorPrefix = properties.getProperty(key_iterator_prefix, "c");
    }

    /**
     * Defaults overridden by {@code -i -o -t -P -s -h}.
     */
    public Configuration(String[] args) {
        this();
        Options options = options();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            throw new ToolkitFailure(e.getMessage(), e);
        }
        help = cmd.hasOption(opt_help);
        inputPath = cmd.getOptionValue(opt_input);
        outputPath = cmd.getOptionValue(opt_output, default_output);
        scriptPath = cmd.getOptionValue(opt_script);
        printSchedule = cmd.hasOption(opt_schedule);
        if (cmd.hasOption(opt_param)) {
            for (String assign : cmd.getOptionValues(opt_param)) {
                int eq = assign.indexOf('=');
                if (eq <= 0) {
                    throw new ToolkitFailure("parameter override must be NAME=value, got " + assign);
                }
                setParam(assign.substring(0, eq).trim(), assign.substring(eq + 1));
            }
        }
        if (!help && inputPath == null) {
            throw new ToolkitFailure("missing input file (-" + opt_input + ")");
        }
    }

    public void setParam(String name, String value) {
        params.put(name, parseLong(key_param_prefix + name, value));
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ToolkitFailure("bad value for " + key + ": " + value, e);
        }
    }

    static Properties loadDefaults() {
        Properties properties = new Properties();
        try (InputStream stream = Configuration.class.getResourceAsStream(resource)) {
            if (stream != null) {
                properties.load(stream);
            }
        } catch (IOException e) {
            throw new ToolkitFailure("cannot read " + resource, e);
        }
        return properties;
    }

    public static Options options() {
        Options options = new Options();
        options.addOption(opt_input, "input", true, "C source with #pragma scop regions");
        options.addOption(opt_output, "output", true, "generated file (default " + default_output + ")");
        options.addOption(opt_script, "script", true, "transformation script, one `scop path operator args...` per line");
        options.addOption(Option.builder(opt_param).longOpt("param").hasArg().argName("NAME=value")
                .desc("parameter value, overrides the source").build());
        options.addOption(opt_schedule, "schedule", false, "print schedule trees");
        options.addOption(opt_help, "help", false, "print this message");
        return options;
    }

    public static String getUsage() {
        StringWriter writer = new StringWriter();
        PrintWriter printWriter = new PrintWriter(writer);
        new HelpFormatter().printHelp(printWriter, 80, "polyopt -i source.c [options]", null, options(), 1, 3, null);
        printWriter.flush();
        return writer.toString();
    }
}
