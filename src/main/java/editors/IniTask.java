package editors;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Desired state of one option or section in an INI file.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class IniTask {
    private Path dest;
    private String section;
    private String option;
    private String value;
    @Builder.Default
    private TaskState state = TaskState.PRESENT;
}
