package work.rescuekit.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.module.Module;
import work.rescuekit.module.ModuleConstraintKeyException;
import work.rescuekit.module.ModuleLoader;
import work.rescuekit.module.ModuleParseException;

/**
 * Ordered collection of modules with lookup indices by class, domain, language, software, package and name.
 *
 * <p>Every mutation goes through {@link #append}, {@link #insert} or {@link #remove} so the indices always
 * reference exactly the live members. Index buckets that become empty are dropped. Not thread-safe; the
 * registry is owned by the control thread.</p>
 */
public final class ModuleRegistry implements Iterable<Module> {
    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);
    private static final String MODULE_SUFFIX = ".yaml";

    private final Path directory;
    private final List<Module> modules = new ArrayList<>();
    private final Map<String, List<Module>> classIndex = new LinkedHashMap<>();
    private final Map<String, List<Module>> domainIndex = new LinkedHashMap<>();
    private final Map<String, List<Module>> languageIndex = new LinkedHashMap<>();
    private final Map<String, List<Module>> softwareIndex = new LinkedHashMap<>();
    private final Map<String, List<Module>> packageIndex = new LinkedHashMap<>();
    private final Map<String, Module> nameIndex = new LinkedHashMap<>();

    public ModuleRegistry() {
        this(null);
    }

    private ModuleRegistry(Path directory) {
        this.directory = directory;
    }

    /**
     * Loads every {@code *.yaml} file of {@code directory} in lexical order. Hidden files are ignored and
     * files with invalid metadata are logged and skipped.
     */
    public static ModuleRegistry load(Path directory) {
        Path absolute = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute)) {
            throw new IllegalStateException("Module directory not found: " + absolute);
        }
        ModuleRegistry registry = new ModuleRegistry(absolute);
        List<Path> files;
        try (Stream<Path> listing = Files.list(absolute)) {
            files = listing
                .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list module directory: " + absolute, ex);
        }
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (fileName.startsWith(".") || !fileName.endsWith(MODULE_SUFFIX) || !Files.isRegularFile(file)) {
                log.debug("Skipping hidden or non-yaml file {}.", fileName);
                continue;
            }
            try {
                log.debug("Adding file: {}", file);
                registry.append(ModuleLoader.load(file));
            } catch (ModuleParseException | ModuleConstraintKeyException ex) {
                log.warn("Module parsing error: {}: continuing with next module", ex.getMessage());
            }
        }
        log.debug("Loaded {} module(s) from {}", registry.size(), absolute);
        return registry;
    }

    public Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }

    public void append(Module module) {
        checkInsertable(module);
        modules.add(module);
        index(module);
    }

    public void insert(int position, Module module) {
        checkInsertable(module);
        if (position < 0 || position > modules.size()) {
            throw new IndexOutOfBoundsException("Index " + position + " out of bounds for size " + modules.size());
        }
        modules.add(position, module);
        index(module);
    }

    /**
     * Removes {@code module} together with all its index entries. A different instance that only
     * shares the name is not a member.
     */
    public void remove(Module module) {
        if (module == null) {
            throw new ModuleRegistryTypeException(null, Module.class.getName());
        }
        Module member = nameIndex.get(module.name());
        if (member != module) {
            throw new ModuleNotPresentException(module.name());
        }
        unindex(member);
        modules.remove(member);
    }

    /**
     * Unsupported: bulk insertion would bypass duplicate checks and index maintenance.
     */
    public void extend(Collection<Module> others) {
        throw new UnsupportedOperationException("extend is not supported by ModuleRegistry; use append");
    }

    /**
     * Unsupported: positional removal would bypass index maintenance.
     */
    public Module pop(int position) {
        throw new UnsupportedOperationException("pop is not supported by ModuleRegistry; use remove");
    }

    private void checkInsertable(Module module) {
        if (module == null) {
            throw new ModuleRegistryTypeException(null, Module.class.getName());
        }
        if (nameIndex.containsKey(module.name())) {
            throw new DuplicateModuleNameException(module.name());
        }
    }

    private void index(Module module) {
        for (String moduleClass : module.constraint().get("class")) {
            classIndex.computeIfAbsent(moduleClass, ignored -> new ArrayList<>()).add(module);
        }
        for (String domain : module.constraint().get("domain")) {
            domainIndex.computeIfAbsent(domain, ignored -> new ArrayList<>()).add(module);
        }
        for (String software : module.constraint().get("software")) {
            softwareIndex.computeIfAbsent(software, ignored -> new ArrayList<>()).add(module);
        }
        for (String pkg : module.packages()) {
            packageIndex.computeIfAbsent(pkg, ignored -> new ArrayList<>()).add(module);
        }
        languageIndex.computeIfAbsent(module.language().id(), ignored -> new ArrayList<>()).add(module);
        nameIndex.put(module.name(), module);
    }

    private void unindex(Module module) {
        for (String moduleClass : module.constraint().get("class")) {
            unbucket(classIndex, moduleClass, module);
        }
        for (String domain : module.constraint().get("domain")) {
            unbucket(domainIndex, domain, module);
        }
        for (String software : module.constraint().get("software")) {
            unbucket(softwareIndex, software, module);
        }
        for (String pkg : module.packages()) {
            unbucket(packageIndex, pkg, module);
        }
        unbucket(languageIndex, module.language().id(), module);
        nameIndex.remove(module.name());
    }

    private static void unbucket(Map<String, List<Module>> index, String key, Module module) {
        List<Module> bucket = index.get(key);
        if (bucket == null) {
            return;
        }
        bucket.remove(module);
        if (bucket.isEmpty()) {
            index.remove(key);
        }
    }

    /**
     * Reorders the members; index membership is unaffected.
     */
    public void sort(Comparator<Module> comparator) {
        modules.sort(comparator);
    }

    public Module get(int position) {
        return modules.get(position);
    }

    public int indexOf(Module module) {
        return modules.indexOf(module);
    }

    public boolean contains(Module module) {
        return module != null && nameIndex.get(module.name()) == module;
    }

    public Optional<Module> byName(String name) {
        return Optional.ofNullable(nameIndex.get(name));
    }

    public int size() {
        return modules.size();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    public List<Module> modules() {
        return Collections.unmodifiableList(modules);
    }

    public Stream<Module> stream() {
        return modules.stream();
    }

    @Override
    public Iterator<Module> iterator() {
        return Collections.unmodifiableList(modules).iterator();
    }

    /**
     * Sorted distinct classes of the current members.
     */
    public List<String> classes() {
        return classIndex.keySet().stream().sorted().collect(Collectors.toList());
    }

    /**
     * Sorted distinct domains of the current members.
     */
    public List<String> domains() {
        return domainIndex.keySet().stream().sorted().collect(Collectors.toList());
    }

    public Map<String, List<Module>> classIndex() {
        return view(classIndex);
    }

    public Map<String, List<Module>> domainIndex() {
        return view(domainIndex);
    }

    public Map<String, List<Module>> languageIndex() {
        return view(languageIndex);
    }

    public Map<String, List<Module>> softwareIndex() {
        return view(softwareIndex);
    }

    public Map<String, List<Module>> packageIndex() {
        return view(packageIndex);
    }

    public Map<String, Module> nameIndex() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nameIndex));
    }

    private static Map<String, List<Module>> view(Map<String, List<Module>> index) {
        Map<String, List<Module>> copy = new LinkedHashMap<>();
        index.forEach((key, bucket) -> copy.put(key, List.copyOf(bucket)));
        return Collections.unmodifiableMap(copy);
    }
}
