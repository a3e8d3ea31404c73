package net.linkedvocabs.qa.load;

/**
 * Thrown if the source document of a vocabulary can not be fetched or parsed.
 */
public class VocabularyLoadException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public VocabularyLoadException(String message) {
		super(message);
	}

	public VocabularyLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
