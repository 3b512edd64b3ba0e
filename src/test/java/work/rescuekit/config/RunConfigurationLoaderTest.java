package work.rescuekit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunConfigurationLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsAllSections() {
        var file = RunConfigurationLoader.parse(String.join("\n",
            "[run]",
            "modules_dir = \"/opt/rescuekit\"",
            "work_dir = \"/tmp/work\"",
            "concurrency = 4",
            "timeout = \"5m\"",
            "",
            "[global]",
            "perfimpact = true",
            "notaninstance = false",
            "onlyclasses = [\"collect\", \"diagnose\"]",
            "retries = 3",
            "",
            "[modules.tcpdump]",
            "interface = \"eth0\"",
            ""
        ));

        assertEquals(Optional.of(Paths.get("/opt/rescuekit")), file.modulesDir());
        assertEquals(Optional.of(Paths.get("/tmp/work")), file.workDir());
        assertEquals(Optional.of(4), file.concurrency());
        assertEquals(Optional.of(Duration.ofMinutes(5)), file.timeout());
        assertEquals("True", file.options().globalArgs().get("perfimpact"));
        assertEquals("False", file.options().globalArgs().get("notaninstance"));
        assertEquals("collect,diagnose", file.options().globalArgs().get("onlyclasses"));
        assertEquals("3", file.options().globalArgs().get("retries"));
        assertEquals(Map.of("interface", "eth0"), file.options().moduleArgs("tcpdump"));
        assertTrue(file.options().isTrue(RunOptions.PERF_IMPACT));
    }

    @Test
    void emptyDocumentHasNoSettings() {
        var file = RunConfigurationLoader.parse("");

        assertEquals(ConfigFile.empty(), file);
    }

    @Test
    void concurrencyHasAFloorOfOne() {
        var file = RunConfigurationLoader.parse("[run]\nconcurrency = 0\n");
        assertEquals(Optional.of(1), file.concurrency());
    }

    @Test
    void zeroTimeoutMeansNoLimit() {
        var file = RunConfigurationLoader.parse("[run]\ntimeout = \"0\"\n");
        assertEquals(Optional.empty(), file.timeout());
    }

    @Test
    void invalidDocumentsAreRejected() {
        assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("[global\nkey = "));
        assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("[run]\ntimeout = \"soon\"\n"));
        assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("[modules]\ntcpdump = \"eth0\"\n"));
        assertThrows(ConfigurationException.class,
            () -> RunConfigurationLoader.parse("[global]\nnested = { a = 1 }\n"));
    }

    @Test
    void valuesOfTheWrongTypeAreRejected() {
        var global = assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("global = 1\n"));
        assertTrue(global.getMessage().contains("global must be a table"), global.getMessage());

        var modules = assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("modules = \"x\"\n"));
        assertTrue(modules.getMessage().contains("modules must be a table"), modules.getMessage());

        var run = assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.parse("run = [1, 2]\n"));
        assertTrue(run.getMessage().contains("run must be a table"), run.getMessage());

        var timeout = assertThrows(ConfigurationException.class,
            () -> RunConfigurationLoader.parse("[run]\ntimeout = 30\n"));
        assertTrue(timeout.getMessage().contains("run.timeout must be a string"), timeout.getMessage());

        var concurrency = assertThrows(ConfigurationException.class,
            () -> RunConfigurationLoader.parse("[run]\nconcurrency = \"4\"\n"));
        assertTrue(concurrency.getMessage().contains("run.concurrency must be an integer"), concurrency.getMessage());

        var workDir = assertThrows(ConfigurationException.class,
            () -> RunConfigurationLoader.parse("[run]\nwork_dir = false\n"));
        assertTrue(workDir.getMessage().contains("run.work_dir must be a string"), workDir.getMessage());
    }

    @Test
    void loadReadsFromDisk() throws Exception {
        Path config = tempDir.resolve("rescuekit.toml");
        Files.writeString(config, "[global]\nremote_host = \"10.0.0.1\"\n");

        var file = RunConfigurationLoader.load(config);

        assertEquals(Optional.of("10.0.0.1"), file.options().global("remote_host"));
        assertThrows(ConfigurationException.class, () -> RunConfigurationLoader.load(tempDir.resolve("missing.toml")));
    }
}
