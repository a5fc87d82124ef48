package symtab;

import java.util.NoSuchElementException;

/** No stored key satisfies a {@code floor} or {@code ceiling} query. */
public class KeyNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(final String message) {
        super(message);
    }
}
