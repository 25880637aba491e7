package editors;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line oriented INI document. Every line is kept verbatim together with its terminator,
 * so anything the editing operations do not touch is written back unchanged.
 * <p>
 * Lines are held with one char per file byte, so files in any encoding survive a load and
 * save untouched. Section names, options and values passed in or returned are UTF-8 text.
 */
public class IniFile implements IniEditor {

    private static final Logger log = LoggerFactory.getLogger(IniFile.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[([^\\]]+)\\]");
    private static final Pattern OPTION_PATTERN = Pattern.compile("^([^\\s=]+)\\s*=\\s*(.*)", Pattern.DOTALL);
    private static final String LF = "\n";
    private static final int MAX_LINK_HOPS = 40;

    private final Path path;
    private final List<String> lines;
    private SectionIndex index;

    private IniFile(Path path, List<String> lines) {
        this.path = path;
        this.lines = lines;
    }

    /**
     * Reads the whole file into memory. A missing file gives an empty document that
     * {@link #save()} will create.
     */
    public static IniFile load(Path path) throws IOException {
        Validate.notNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            log.debug("{} does not exist, starting with an empty document", path);
            return new IniFile(path, new ArrayList<>());
        }
        String text = Files.readString(path, StandardCharsets.ISO_8859_1);
        return new IniFile(path, splitLines(text));
    }

    public static IniFile parse(String text) {
        return new IniFile(null, splitLines(toRaw(text == null ? "" : text)));
    }

    public Path path() {
        return path;
    }

    /**
     * Raw lines, one char per byte.
     */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String render() {
        return fromRaw(rawText());
    }

    private String rawText() {
        return String.join("", lines);
    }

    @Override
    public Optional<String> get(String section, String option) {
        String rawOption = toRaw(option);
        for (Segment segment : index().segmentsOf(toRaw(section))) {
            for (int i = segment.start; i < segment.end; i++) {
                ParsedLine line = index().line(i);
                if (line.type == LineType.OPTION && line.name.equals(rawOption)) {
                    return Optional.of(fromRaw(line.value));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public void set(String section, String option, String value) {
        Validate.notNull(option, "option must not be null");
        String rawOption = toRaw(option);
        String rendered = renderOption(rawOption, toRaw(value));

        Segment segment = index().first(toRaw(section));
        if (segment == null) {
            appendSection(toRaw(section), rendered);
            return;
        }

        int lastOptLine = segment.hasHeader ? segment.start : -1;
        for (int i = segment.start; i < segment.end; i++) {
            ParsedLine line = index().line(i);
            if (line.type == LineType.COMMENT) {
                lastOptLine = i;
            } else if (line.type == LineType.OPTION) {
                if (line.name.equals(rawOption)) {
                    log.debug("Replacing line {} with '{} = {}'", i, option, value);
                    lines.set(i, rendered);
                    invalidate();
                    return;
                }
                lastOptLine = i;
            }
        }

        int at = lastOptLine + 1;
        log.debug("Inserting '{} = {}' at line {} of section [{}]", option, value, at, section);
        insert(at, rendered);
    }

    @Override
    public boolean deleteOption(String section, String option) {
        String rawOption = toRaw(option);
        for (Segment segment : index().segmentsOf(toRaw(section))) {
            for (int i = segment.start; i < segment.end; i++) {
                ParsedLine line = index().line(i);
                if (line.type == LineType.OPTION && line.name.equals(rawOption)) {
                    log.debug("Removing option '{}' at line {} of section [{}]", option, i, section);
                    lines.remove(i);
                    invalidate();
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean deleteSection(String section) {
        if (section == null) {
            return false;
        }
        Segment segment = index().first(toRaw(section));
        if (segment == null) {
            return false;
        }
        log.debug("Removing section [{}], lines {}..{}", section, segment.start, segment.end - 1);
        lines.subList(segment.start, segment.end).clear();
        invalidate();
        return true;
    }

    /**
     * Writes the document next to the target and moves it over the original, so a failed
     * write never leaves a truncated file behind. A symbolic link is followed and the file
     * it points to is replaced, the link itself stays.
     */
    public void save() throws IOException {
        Validate.validState(path != null, "document is not bound to a file");
        Path target = resolveLinks(path);
        Path dir = target.getParent();
        Files.createDirectories(dir);

        // createTempFile would force owner-only permissions on a new file
        Path tmp = Files.createFile(dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp"));
        try {
            copyPermissions(target, tmp);
            Files.writeString(tmp, rawText(), StandardCharsets.ISO_8859_1);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.debug("Saved {} lines to {}", lines.size(), target);
    }

    private static Path resolveLinks(Path path) throws IOException {
        Path target = path.toAbsolutePath();
        int hops = 0;
        while (Files.isSymbolicLink(target)) {
            if (++hops > MAX_LINK_HOPS) {
                throw new FileSystemException(path.toString(), null, "Too many levels of symbolic links");
            }
            target = target.resolveSibling(Files.readSymbolicLink(target)).normalize();
        }
        return target;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from) || Files.getFileAttributeView(from, PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
    }

    private void appendSection(String section, String rendered) {
        if (!lines.isEmpty()) {
            int last = lines.size() - 1;
            terminate(last);
            if (index().line(last).type != LineType.BLANK) {
                lines.add(LF);
            }
        }
        log.debug("Adding section [{}]", section);
        lines.add("[" + section + "]" + LF);
        lines.add(rendered);
        invalidate();
    }

    private void insert(int at, String rendered) {
        if (at > 0) {
            terminate(at - 1);
        }
        lines.add(at, rendered);
        invalidate();
    }

    // only the final line can lack a terminator
    private void terminate(int lineNo) {
        String line = lines.get(lineNo);
        if (!line.endsWith(LF) && !line.endsWith("\r")) {
            lines.set(lineNo, line + LF);
        }
    }

    private static String toRaw(String text) {
        return text == null ? null : new String(text.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
    }

    private static String fromRaw(String raw) {
        return new String(raw.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
    }

    private static String renderOption(String option, String value) {
        return option + " = " + Objects.toString(value, "") + LF;
    }

    private SectionIndex index() {
        if (index == null) {
            index = SectionIndex.build(lines);
        }
        return index;
    }

    private void invalidate() {
        index = null;
    }

    static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                result.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                if (i + 1 < len && text.charAt(i + 1) == '\n') {
                    i++;
                }
                result.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < len) {
            result.add(text.substring(start));
        }
        return result;
    }

    static ParsedLine classify(String rawLine) {
        String line = StringUtils.strip(rawLine);
        if (line.isEmpty()) {
            return ParsedLine.of(LineType.BLANK);
        }
        if (line.startsWith("#") || line.startsWith(";")) {
            return ParsedLine.of(LineType.COMMENT);
        }
        Matcher section = SECTION_PATTERN.matcher(line);
        if (section.find()) {
            return new ParsedLine(LineType.SECTION, section.group(1), null);
        }
        Matcher option = OPTION_PATTERN.matcher(line);
        if (option.find()) {
            return new ParsedLine(LineType.OPTION, option.group(1), option.group(2));
        }
        return ParsedLine.of(LineType.OTHER);
    }

    enum LineType {
        BLANK, COMMENT, SECTION, OPTION, OTHER
    }

    static final class ParsedLine {
        final LineType type;
        final String name;
        final String value;

        ParsedLine(LineType type, String name, String value) {
            this.type = type;
            this.name = name;
            this.value = value;
        }

        static ParsedLine of(LineType type) {
            return new ParsedLine(type, null, null);
        }
    }

    /**
     * Range of lines owned by one section header, header included. The global area before
     * the first header has no header line.
     */
    static final class Segment {
        final String name;
        final int start;
        final int end;
        final boolean hasHeader;

        Segment(String name, int start, int end, boolean hasHeader) {
            this.name = name;
            this.start = start;
            this.end = end;
            this.hasHeader = hasHeader;
        }
    }

    /**
     * Classified lines plus section ranges in document order. Rebuilt after every mutation.
     */
    static final class SectionIndex {
        private final List<ParsedLine> parsed;
        private final List<Segment> segments;

        private SectionIndex(List<ParsedLine> parsed, List<Segment> segments) {
            this.parsed = parsed;
            this.segments = segments;
        }

        static SectionIndex build(List<String> lines) {
            List<ParsedLine> parsed = new ArrayList<>(lines.size());
            List<Segment> segments = new ArrayList<>();
            String current = null;
            int start = 0;
            boolean hasHeader = false;
            for (int i = 0; i < lines.size(); i++) {
                ParsedLine line = classify(lines.get(i));
                parsed.add(line);
                if (line.type == LineType.SECTION) {
                    segments.add(new Segment(current, start, i, hasHeader));
                    current = line.name;
                    start = i;
                    hasHeader = true;
                }
            }
            segments.add(new Segment(current, start, lines.size(), hasHeader));
            return new SectionIndex(parsed, segments);
        }

        ParsedLine line(int lineNo) {
            return parsed.get(lineNo);
        }

        Segment first(String section) {
            for (Segment segment : segments) {
                if (Objects.equals(segment.name, section)) {
                    return segment;
                }
            }
            return null;
        }

        List<Segment> segmentsOf(String section) {
            List<Segment> result = new ArrayList<>();
            for (Segment segment : segments) {
                if (Objects.equals(segment.name, section)) {
                    result.add(segment);
                }
            }
            return result;
        }
    }
}
