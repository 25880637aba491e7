package editors;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class IniResult {
    private Path dest;
    private boolean changed;
    private String msg;
}
