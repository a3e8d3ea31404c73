package net.linkedvocabs.qa;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.sail.SailRepository;
import org.eclipse.rdf4j.sail.memory.MemoryStore;

import net.linkedvocabs.core.vocab.TermSet;
import net.linkedvocabs.core.vocab.VocabularyCatalog;
import net.linkedvocabs.core.vocab.VocabularyConfig;

/**
 * Vocabularies and repositories shared by the tests.
 */
public class QaTestSupport {
	public static final ValueFactory vf = SimpleValueFactory.getInstance();

	public static final String ANIMALS = "http://example.org/animals/";
	public static final String COLORS = "http://example.org/colors/";
	public static final String OTHER = "http://other.org/";

	public static final IRI NAME = vf.createIRI("http://example.org/ns#name");

	public static IRI iri(String value) {
		return vf.createIRI(value);
	}

	public static VocabularyCatalog createCatalog() {
		VocabularyCatalog catalog = new VocabularyCatalog();
		catalog.add(new VocabularyConfig("animals", ANIMALS, TermSet.open(ANIMALS), false, null, false));
		catalog.add(new VocabularyConfig("colors", COLORS, TermSet.strict(COLORS, "red", "green", "blue"), true,
				iri("classpath:colors.ttl"), true));
		catalog.add(new VocabularyConfig("missing", "http://example.org/missing/",
				TermSet.open("http://example.org/missing/"), false, iri("classpath:does-not-exist.ttl"), true));
		catalog.add(new VocabularyConfig("skos", SKOS.NAMESPACE, TermSet.open(SKOS.NAMESPACE), false,
				iri("http://www.w3.org/2004/02/skos/core"), false));
		return catalog;
	}

	public static Repository createRepository() {
		Repository repository = new SailRepository(new MemoryStore());
		repository.init();
		return repository;
	}
}
