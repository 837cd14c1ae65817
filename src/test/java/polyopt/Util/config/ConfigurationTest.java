package polyopt.Util.config;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.ToolkitFailure;
import polyopt.polyhedral.dependency.Dependency;

import java.util.EnumSet;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationTest {
    @Test
    void defaultsComeFromTheResource() {
        Configuration config = new Configuration();
        assertEquals(EnumSet.allOf(Dependency.class), config.dependenceKinds);
        assertEquals(4000000, config.maxInstances);
        assertEquals(2, config.indent);
        assertEquals("c", config.iteratorPrefix);
        assertEquals(Configuration.default_output, config.outputPath);
        assertTrue(config.params.isEmpty());
    }

    @Test
    void commandLine() {
        Configuration config = new Configuration(new String[]{"-i", "in.c", "-o", "out.c", "-t", "steps.txt",
                "-P", "N=10", "--param", "M = 3", "-s"});
        assertEquals("in.c", config.inputPath);
        assertEquals("out.c", config.outputPath);
        assertEquals("steps.txt", config.scriptPath);
        assertTrue(config.printSchedule);
        assertFalse(config.help);
        assertEquals(Map.of("N", 10L, "M", 3L), config.params);

        Configuration help = new Configuration(new String[]{"-h"});
        assertTrue(help.help);
        assertNull(help.inputPath);
    }

    @Test
    void badCommandLines() {
        assertThrows(ToolkitFailure.class, () -> new Configuration(new String[]{"-o", "out.c"}));
        assertThrows(ToolkitFailure.class, () -> new Configuration(new String[]{"-i", "in.c", "-P", "N"}));
        assertThrows(ToolkitFailure.class, () -> new Configuration(new String[]{"-i", "in.c", "-P", "N=ten"}));
        assertThrows(ToolkitFailure.class, () -> new Configuration(new String[]{"-i", "in.c", "--unknown"}));
    }

    @Test
    void properties() {
        Properties properties = new Properties();
        properties.setProperty("dependence.kinds", "flow, anti");
        properties.setProperty("param.N", "5");
        properties.setProperty("codegen.iterator.prefix", "t");
        Configuration config = new Configuration(properties);
        assertEquals(EnumSet.of(Dependency.FLOW, Dependency.ANTI), config.dependenceKinds);
        assertEquals(Map.of("N", 5L), config.params);
        assertEquals("t", config.iteratorPrefix);

        properties.setProperty("dependence.kinds", "flow,input");
        assertThrows(ToolkitFailure.class, () -> new Configuration(properties));
        properties.setProperty("dependence.kinds", "flow");
        properties.setProperty("instances.max", "many");
        assertThrows(ToolkitFailure.class, () -> new Configuration(properties));
    }

    @Test
    void usageListsTheOptions() {
        String usage = Configuration.getUsage();
        assertTrue(usage.contains("-i,--input"), usage);
        assertTrue(usage.contains("-P,--param <NAME=value>"), usage);
    }
}
