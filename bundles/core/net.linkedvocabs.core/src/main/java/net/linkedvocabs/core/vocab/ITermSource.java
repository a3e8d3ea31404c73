package net.linkedvocabs.core.vocab;

import java.util.Collection;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;

/**
 * Knows which terms a vocabulary defines.
 * <p>
 * All vocabularies, strict or not, are accessed through this interface.
 */
public interface ITermSource {
	/**
	 * Returns the namespace of the vocabulary, e.g.
	 * <code>http://purl.org/dc/dcmitype/</code>.
	 */
	String getNamespace();

	/**
	 * Tests if <code>name</code> is a term defined by this vocabulary.
	 * 
	 * @param name
	 *            The local name of the term
	 * @return <code>true</code> if the term is defined, else
	 *         <code>false</code>
	 */
	boolean hasTerm(String name);

	/**
	 * Returns the fully-qualified term for the given local name.
	 * 
	 * @param name
	 *            The local name of the term
	 * @return The term's IRI
	 * @throws IllegalArgumentException
	 *             If the vocabulary does not define <code>name</code>
	 */
	IRI termFor(String name);

	/**
	 * Returns the term catalog if this source is able to enumerate it.
	 */
	default Optional<Collection<IRI>> listTerms() {
		return Optional.empty();
	}

	/**
	 * Strict vocabularies only accept explicitly cataloged terms.
	 */
	default boolean isStrict() {
		return false;
	}
}
