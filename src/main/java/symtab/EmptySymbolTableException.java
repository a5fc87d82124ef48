package symtab;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link BST} when an operation that needs at least one key
 * ({@code min}, {@code max}, {@code deleteMin}, ...) runs on an empty table.
 */
public class EmptySymbolTableException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptySymbolTableException(final String message) {
        super(message);
    }
}
