package net.linkedvocabs.qa.store;

/**
 * Thrown if the backing store fails to execute a request.
 * <p>
 * No retry is done by this library, the cause is the store's original
 * exception.
 */
public class StoreUnavailableException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public StoreUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
