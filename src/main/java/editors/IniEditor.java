package editors;

import java.util.Optional;

public interface IniEditor {
    Optional<String> get(String section, String option);

    void set(String section, String option, String value);

    boolean deleteOption(String section, String option);

    boolean deleteSection(String section);
}
