package work.rescuekit.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.rescuekit.module.Module;
import work.rescuekit.support.ModuleFixtures;

class ModuleRegistryTest {
    @TempDir
    Path tempDir;

    private static Module module(String name, String moduleClass, String software) {
        return ModuleFixtures.module(name)
            .with("class", moduleClass)
            .with("software", software)
            .pkg(software.isEmpty() ? "" : software + " https://example.com/" + software)
            .build();
    }

    @Test
    void appendMaintainsEveryIndex() {
        var registry = new ModuleRegistry();
        var first = module("first", "collect", "bcc");
        var second = module("second", "diagnose", "");

        registry.append(first);
        registry.append(second);

        assertEquals(2, registry.size());
        assertEquals(List.of(first), registry.classIndex().get("collect"));
        assertEquals(List.of(first, second), registry.domainIndex().get("os"));
        assertEquals(List.of(first), registry.softwareIndex().get("bcc"));
        assertEquals(List.of(first), registry.packageIndex().get("bcc https://example.com/bcc"));
        assertEquals(List.of(first, second), registry.languageIndex().get("bash"));
        assertSame(second, registry.nameIndex().get("second"));
        assertEquals(List.of("collect", "diagnose"), registry.classes());
    }

    @Test
    void duplicateNameIsRejectedWithoutMutation() {
        var registry = new ModuleRegistry();
        registry.append(module("probe", "collect", ""));
        var before = registry.classIndex();

        assertThrows(DuplicateModuleNameException.class, () -> registry.append(module("probe", "diagnose", "")));
        assertThrows(DuplicateModuleNameException.class, () -> registry.insert(0, module("probe", "gather", "")));

        assertEquals(1, registry.size());
        assertEquals(before, registry.classIndex());
        assertFalse(registry.classIndex().containsKey("diagnose"));
    }

    @Test
    void nullIsRejected() {
        var registry = new ModuleRegistry();
        assertThrows(ModuleRegistryTypeException.class, () -> registry.append(null));
        assertThrows(ModuleRegistryTypeException.class, () -> registry.remove(null));
    }

    @Test
    void insertHonoursPosition() {
        var registry = new ModuleRegistry();
        var a = module("a", "collect", "");
        var b = module("b", "collect", "");
        registry.append(a);
        registry.insert(0, b);

        assertEquals(List.of(b, a), registry.modules());
        assertThrows(IndexOutOfBoundsException.class, () -> registry.insert(5, module("c", "collect", "")));
        assertFalse(registry.byName("c").isPresent());
    }

    @Test
    void removeDropsEmptyBuckets() {
        var registry = new ModuleRegistry();
        var only = module("only", "gather", "tcpdump");
        var other = module("other", "collect", "");
        registry.append(only);
        registry.append(other);

        registry.remove(only);

        assertEquals(List.of(other), registry.modules());
        assertFalse(registry.classIndex().containsKey("gather"));
        assertFalse(registry.softwareIndex().containsKey("tcpdump"));
        assertFalse(registry.packageIndex().containsKey("tcpdump https://example.com/tcpdump"));
        assertEquals(List.of(other), registry.domainIndex().get("os"));
        assertFalse(registry.contains(only));
    }

    @Test
    void removeOfAbsentModuleFails() {
        var registry = new ModuleRegistry();
        registry.append(module("present", "collect", ""));

        var error = assertThrows(ModuleNotPresentException.class, () -> registry.remove(module("absent", "collect", "")));
        assertTrue(error.getMessage().contains("absent"));
        assertEquals(1, registry.size());
    }

    @Test
    void removeOfSameNamedStrangerFails() {
        var registry = new ModuleRegistry();
        var member = module("twin", "collect", "bcc");
        registry.append(member);

        assertThrows(ModuleNotPresentException.class, () -> registry.remove(module("twin", "collect", "bcc")));

        assertEquals(List.of(member), registry.modules());
        assertSame(member, registry.nameIndex().get("twin"));
        assertEquals(List.of(member), registry.softwareIndex().get("bcc"));
    }

    @Test
    void bulkOperationsAreUnsupported() {
        var registry = new ModuleRegistry();
        assertThrows(UnsupportedOperationException.class, () -> registry.extend(List.of(module("x", "collect", ""))));
        assertThrows(UnsupportedOperationException.class, () -> registry.pop(0));
        assertTrue(registry.isEmpty());
    }

    @Test
    void sortReordersWithoutTouchingIndices() {
        var registry = new ModuleRegistry();
        registry.append(module("z", "diagnose", ""));
        registry.append(module("a", "collect", ""));

        registry.sort(Comparator.comparing((Module module) -> module.constraint().first("class")));

        assertEquals(List.of("a", "z"), registry.stream().map(Module::name).collect(Collectors.toList()));
        assertEquals(1, registry.classIndex().get("diagnose").size());
    }

    @Test
    void indexViewsAreReadOnly() {
        var registry = new ModuleRegistry();
        registry.append(module("probe", "collect", ""));

        assertThrows(UnsupportedOperationException.class, () -> registry.classIndex().clear());
        assertThrows(UnsupportedOperationException.class, () -> registry.classIndex().get("collect").clear());
        assertThrows(UnsupportedOperationException.class, () -> registry.modules().clear());
    }

    @Test
    void loadReadsYamlFilesInLexicalOrderAndSkipsBadOnes() throws Exception {
        ModuleFixtures.writeModuleFile(tempDir, ModuleFixtures.module("bravo"));
        ModuleFixtures.writeModuleFile(tempDir, ModuleFixtures.module("alpha").with("class", "collect"));
        Files.writeString(tempDir.resolve("broken.yaml"), "name: broken\nversion: 1.0\n");
        Files.writeString(tempDir.resolve(".hidden.yaml"), "name: hidden\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not a module");

        var registry = ModuleRegistry.load(tempDir);

        assertEquals(List.of("alpha", "bravo"), registry.stream().map(Module::name).collect(Collectors.toList()));
        assertEquals(List.of("collect", "diagnose"), registry.classes());
        assertTrue(registry.directory().isPresent());
    }

    @Test
    void loadOfMissingDirectoryFails() {
        assertThrows(IllegalStateException.class, () -> ModuleRegistry.load(tempDir.resolve("absent")));
    }
}
