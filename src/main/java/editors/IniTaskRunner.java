package editors;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies one {@link IniTask} to its file. The file is only rewritten when the document
 * actually changed, so running the same task twice reports a change only once.
 */
public class IniTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(IniTaskRunner.class);
    private static final String OK = "OK";

    public IniResult run(IniTask task) {
        Validate.notNull(task, "task must not be null");
        Validate.notNull(task.getDest(), "dest must not be null");
        Path dest = task.getDest();

        IniFile ini = load(dest);
        boolean changed = apply(ini, task);
        if (changed) {
            save(ini);
        }

        log.info("{} [{}] {} {}: changed={}", dest, task.getSection(), task.getOption(), task.getState(), changed);
        return IniResult.builder()
                .dest(dest)
                .changed(changed)
                .msg(OK)
                .build();
    }

    boolean apply(IniEditor ini, IniTask task) {
        String section = StringUtils.defaultIfEmpty(task.getSection(), null);
        String option = task.getOption();
        TaskState state = task.getState() == null ? TaskState.PRESENT : task.getState();

        switch (state) {
            case PRESENT:
                if (StringUtils.isEmpty(option)) {
                    return false;
                }
                String value = Objects.toString(task.getValue(), "");
                Optional<String> current = ini.get(section, option);
                if (current.isPresent() && current.get().equals(value)) {
                    return false;
                }
                ini.set(section, option, value);
                return true;
            case ABSENT:
                if (StringUtils.isNotEmpty(option)) {
                    return ini.deleteOption(section, option);
                }
                if (StringUtils.isNotEmpty(section)) {
                    return ini.deleteSection(section);
                }
                return false;
            default:
                throw new IllegalStateException("Unexpected state: " + state);
        }
    }

    private static IniFile load(Path dest) {
        try {
            return IniFile.load(dest);
        } catch (IOException e) {
            log.error("Can't read {}", dest, e);
            throw new IniStorageException("Can't read " + dest, e);
        }
    }

    private static void save(IniFile ini) {
        try {
            ini.save();
        } catch (IOException e) {
            log.error("Can't create {}", ini.path(), e);
            throw new IniStorageException("Can't create " + ini.path(), e);
        }
    }
}
