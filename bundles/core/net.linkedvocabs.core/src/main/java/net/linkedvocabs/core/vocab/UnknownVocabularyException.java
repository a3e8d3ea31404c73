package net.linkedvocabs.core.vocab;

import java.util.Locale;

/**
 * Thrown if a vocabulary is registered that is not defined by the
 * {@link VocabularyCatalog}.
 */
public class UnknownVocabularyException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final String vocabulary;

	public UnknownVocabularyException(String vocabulary) {
		super("Vocabulary undefined: " + String.valueOf(vocabulary).toUpperCase(Locale.ROOT));
		this.vocabulary = vocabulary;
	}

	/**
	 * The name that was used for registration.
	 */
	public String getVocabulary() {
		return vocabulary;
	}
}
