package work.rescuekit.module;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.rescuekit.constraint.Constraint;

/**
 * Reads module metadata documents (YAML) into {@link Module} instances.
 */
public final class ModuleLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ModuleLoader() {}

    public static Module load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromDocument(parse(in, file), file);
        } catch (IOException ex) {
            throw new ModuleParseException("Unable to read module file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> parse(InputStream in, Path file) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new ModuleParseException("Module file " + file + " does not contain a mapping");
        }
        return YAML_MAPPER.convertValue(root, MAP_TYPE);
    }

    /**
     * Builds a module from an already-parsed metadata document.
     */
    public static Module fromDocument(Map<String, Object> document, Path file) {
        Object constraintRaw = document.get("constraint");
        Constraint constraint = null;
        if (constraintRaw instanceof Map<?, ?> map) {
            constraint = new Constraint();
            constraint.update(map);
        } else if (constraintRaw != null) {
            throw new ModuleParseException("Module file " + file + ": constraint must be a mapping");
        }
        return Module.builder()
            .name(text(document.get("name")))
            .version(text(document.get("version")))
            .title(text(document.get("title")))
            .helpText(text(document.get("helptext")))
            .placement(text(document.get("placement")))
            .packages(packages(document.get("package")))
            .language(text(document.get("language")))
            .content(text(document.get("content")))
            .path(file)
            .constraint(constraint)
            .build();
    }

    // Trailing newlines from block scalars are dropped so titles and help print cleanly.
    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value).stripTrailing();
    }

    // Package entries are "<name> <url>" pairs, so they are never split on whitespace. A list holding
    // only a blank entry means "no software needed"; an empty list or blank scalar is missing.
    private static List<String> packages(Object value) {
        if (value == null) {
            return null;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                result.add(item == null ? "" : String.valueOf(item));
            }
        } else if (!String.valueOf(value).isBlank()) {
            result.add(String.valueOf(value));
        }
        return result;
    }
}
