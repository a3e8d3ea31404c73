package net.linkedvocabs.core.vocab;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

/**
 * Terms used to describe vocabularies within a {@link VocabularyCatalog}.
 */
public interface CATALOG {
	String NAMESPACE = "http://linkedvocabs.net/ns/catalog#";

	ValueFactory vf = SimpleValueFactory.getInstance();

	IRI NAMESPACE_URI = vf.createIRI(NAMESPACE);

	/**
	 * A controlled vocabulary known to the system.
	 */
	IRI TYPE_VOCABULARY = vf.createIRI(NAMESPACE, "Vocabulary");

	/**
	 * The name used to register the vocabulary, e.g. <code>dcmitype</code>.
	 */
	IRI PROPERTY_NAME = vf.createIRI(NAMESPACE, "name");

	/**
	 * String prefix of all identifiers belonging to the vocabulary.
	 */
	IRI PROPERTY_PREFIX = vf.createIRI(NAMESPACE, "prefix");

	/**
	 * Whether only cataloged terms are members of the vocabulary.
	 */
	IRI PROPERTY_STRICT = vf.createIRI(NAMESPACE, "strict");

	/**
	 * Document defining the vocabulary.
	 */
	IRI PROPERTY_SOURCE = vf.createIRI(NAMESPACE, "source");

	/**
	 * Whether the source document should be loaded into the store.
	 */
	IRI PROPERTY_FETCH = vf.createIRI(NAMESPACE, "fetch");

	/**
	 * Local name of a term of the vocabulary.
	 */
	IRI PROPERTY_TERM = vf.createIRI(NAMESPACE, "term");

	/**
	 * Name of a Java class whose IRI constants are the vocabulary's terms.
	 */
	IRI PROPERTY_TERMCLASS = vf.createIRI(NAMESPACE, "termClass");
}
