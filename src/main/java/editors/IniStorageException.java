package editors;

/**
 * The target file could not be read or written.
 */
public class IniStorageException extends RuntimeException {

    public IniStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
