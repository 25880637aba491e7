package editors;

public enum TaskState {
    PRESENT,
    ABSENT;

    public static TaskState from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRESENT;
        }
        for (TaskState state : values()) {
            if (state.name().equalsIgnoreCase(raw.trim())) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unsupported state: " + raw);
    }
}
