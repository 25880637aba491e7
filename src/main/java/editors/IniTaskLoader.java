package editors;

import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads task definitions from YAML. The document is either one mapping or a list of
 * mappings with the keys {@code dest}, {@code section}, {@code option}, {@code value} and
 * {@code state}. Scalars are taken as written, {@code 010} or {@code yes} stay strings.
 */
public class IniTaskLoader {

    private static final Set<String> KEYS = Set.of("dest", "section", "option", "value", "state");

    private final Yaml yaml;

    public IniTaskLoader() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new PlainScalarResolver());
    }

    public List<IniTask> load(Path file) throws IOException {
        return load(Files.readString(file, StandardCharsets.UTF_8));
    }

    public List<IniTask> load(String data) {
        Object root;
        try {
            root = yaml.load(data == null ? "" : data);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid task definition: " + e.getMessage(), e);
        }

        List<IniTask> tasks = new ArrayList<>();
        if (root == null) {
            return tasks;
        }
        if (root instanceof Map) {
            tasks.add(toTask((Map<?, ?>) root, 0));
        } else if (root instanceof List) {
            List<?> entries = (List<?>) root;
            for (int i = 0; i < entries.size(); i++) {
                Object entry = entries.get(i);
                if (!(entry instanceof Map)) {
                    throw new IllegalArgumentException("Task #" + i + " is not a mapping");
                }
                tasks.add(toTask((Map<?, ?>) entry, i));
            }
        } else {
            throw new IllegalArgumentException("Expected a mapping or a list of mappings");
        }
        return tasks;
    }

    private static IniTask toTask(Map<?, ?> entry, int position) {
        for (Object key : entry.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new IllegalArgumentException("Task #" + position + " has unsupported key: " + key);
            }
        }
        String dest = scalar(entry, "dest");
        if (StringUtils.isBlank(dest)) {
            throw new IllegalArgumentException("Task #" + position + " has no dest");
        }
        return IniTask.builder()
                .dest(expandHome(dest))
                .section(scalar(entry, "section"))
                .option(scalar(entry, "option"))
                .value(scalar(entry, "value"))
                .state(TaskState.from(scalar(entry, "state")))
                .build();
    }

    private static String scalar(Map<?, ?> entry, String key) {
        Object value = entry.get(key);
        if (value == null || "".equals(value)) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new IllegalArgumentException("'" + key + "' must be a scalar");
        }
        return String.valueOf(value);
    }

    static Path expandHome(String dest) {
        if (dest.equals("~") || dest.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + dest.substring(1));
        }
        return Paths.get(dest);
    }

    private static final class PlainScalarResolver extends Resolver {
        @Override
        protected void addImplicitResolvers() {
            // no implicit typing, every plain scalar is a string
        }
    }
}
