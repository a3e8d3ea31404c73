package net.linkedvocabs.qa.load;

import static net.linkedvocabs.qa.QaTestSupport.COLORS;
import static net.linkedvocabs.qa.QaTestSupport.iri;
import static net.linkedvocabs.qa.QaTestSupport.vf;

import java.util.Arrays;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.inject.Guice;
import com.google.inject.Injector;

import net.linkedvocabs.core.VocabularyModule;
import net.linkedvocabs.core.vocab.VocabularyCatalog;
import net.linkedvocabs.core.vocab.VocabularyRegistry;
import net.linkedvocabs.qa.QaModule;
import net.linkedvocabs.qa.QaTestSupport;
import net.linkedvocabs.qa.SearchHit;
import net.linkedvocabs.qa.VocabularySearch;
import net.linkedvocabs.qa.store.ITripleStore;

public class VocabularyLoaderTest {
	static final IRI COLORS_SOURCE = iri("classpath:colors.ttl");

	Repository repository;
	VocabularyRegistry registry;
	VocabularyLoader loader;

	@Before
	public void beforeTest() {
		repository = QaTestSupport.createRepository();
		registry = new VocabularyRegistry(QaTestSupport.createCatalog());
		loader = new VocabularyLoader(repository);
	}

	@After
	public void afterTest() {
		repository.shutDown();
	}

	long graphSize(IRI graph) {
		try (RepositoryConnection conn = repository.getConnection()) {
			return conn.size(graph);
		}
	}

	@Test
	public void testLoadIntoNamedGraph() {
		registry.register("colors");
		Assert.assertEquals(8, loader.loadVocabulary(registry, "colors"));
		Assert.assertEquals(8, graphSize(COLORS_SOURCE));
		try (RepositoryConnection conn = repository.getConnection()) {
			Assert.assertTrue(conn.hasStatement(iri(COLORS + "red"), SKOS.PREF_LABEL,
					vf.createLiteral("Rot", "de"), false, COLORS_SOURCE));
		}
	}

	@Test
	public void testReloadReplacesGraph() {
		registry.register("colors");
		loader.loadVocabulary(registry, "colors");
		try (RepositoryConnection conn = repository.getConnection()) {
			conn.add(iri(COLORS + "purple"), RDFS.LABEL, vf.createLiteral("Purple"), COLORS_SOURCE);
		}
		Assert.assertEquals(9, graphSize(COLORS_SOURCE));

		loader.loadVocabulary(registry, "colors");
		Assert.assertEquals(8, graphSize(COLORS_SOURCE));
	}

	@Test
	public void testLoadVocabularies() {
		registry.register("animals");
		registry.register("colors");
		registry.register("skos");
		Assert.assertEquals("Vocabularies without source or fetch flag are skipped", 8,
				loader.loadVocabularies(registry));
		try (RepositoryConnection conn = repository.getConnection()) {
			Assert.assertEquals(8, conn.size());
		}
	}

	@Test(expected = VocabularyLoadException.class)
	public void testMissingSource() {
		registry.register("missing");
		loader.loadVocabulary(registry, "missing");
	}

	@Test
	public void testUnregistered() {
		try {
			loader.loadVocabulary(registry, "colors");
			Assert.fail("Only registered vocabularies can be loaded");
		} catch (IllegalArgumentException e) {
			Assert.assertTrue(e.getMessage().contains("colors"));
		}
	}

	@Test
	public void testSearchLoadedVocabulary() {
		VocabularyCatalog catalog = QaTestSupport.createCatalog();
		Injector injector = Guice.createInjector(new VocabularyModule(catalog), new QaModule(repository));
		Assert.assertSame(catalog, injector.getInstance(VocabularyCatalog.class));

		VocabularyRegistry colors = new VocabularyRegistry(injector.getInstance(VocabularyCatalog.class));
		colors.register("colors");
		injector.getInstance(VocabularyLoader.class).loadVocabularies(colors);

		VocabularySearch search = new VocabularySearch(colors, injector.getInstance(ITripleStore.class));
		Assert.assertEquals(Arrays.asList(new SearchHit(COLORS + "green", "Green")), search.search("gr"));
		Assert.assertEquals(Arrays.asList(new SearchHit(COLORS + "green", "Colour of grass")),
				search.search("grass"));
	}
}
