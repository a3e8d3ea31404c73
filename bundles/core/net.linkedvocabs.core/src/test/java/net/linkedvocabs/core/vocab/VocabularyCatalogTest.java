package net.linkedvocabs.core.vocab;

import java.net.URL;
import java.nio.file.Paths;

import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.junit.Assert;
import org.junit.Test;

import com.google.inject.Guice;

import net.linkedvocabs.core.TestVocabularies;
import net.linkedvocabs.core.VocabularyModule;

public class VocabularyCatalogTest {
	@Test
	public void testDefaultCatalog() {
		VocabularyCatalog catalog = Guice.createInjector(new VocabularyModule()).getInstance(VocabularyCatalog.class);

		VocabularyConfig dcmitype = catalog.get("dcmitype").orElse(null);
		Assert.assertNotNull("Default catalog should define dcmitype", dcmitype);
		Assert.assertEquals("http://purl.org/dc/dcmitype/", dcmitype.getPrefix());
		Assert.assertTrue(dcmitype.isStrict());
		Assert.assertTrue(dcmitype.getTermSource().hasTerm("StillImage"));
		Assert.assertFalse(dcmitype.getTermSource().hasTerm("Painting"));
		Assert.assertEquals(TestVocabularies.iri("http://dublincore.org/2012/06/14/dctype.rdf"),
				dcmitype.getSource().get());

		VocabularyConfig lcsh = catalog.get("lcsh").get();
		Assert.assertFalse(lcsh.isStrict());
		Assert.assertFalse(lcsh.isFetch());

		VocabularyConfig skos = catalog.get("skos").get();
		Assert.assertTrue(skos.isStrict());
		Assert.assertTrue(skos.getTermSource().hasTerm("prefLabel"));
		Assert.assertEquals(SKOS.PREF_LABEL, skos.getTermSource().termFor("prefLabel"));
	}

	@Test
	public void testImportsAndInvalidDescriptions() {
		VocabularyCatalog catalog = new VocabularyCatalog();
		catalog.load(VocabularyCatalog.CLASSPATH_SCHEME + "test-catalog.ttl");

		Assert.assertTrue(catalog.contains("colors"));
		Assert.assertTrue(catalog.contains("places"));
		Assert.assertTrue("Imported catalog should be read", catalog.contains("shapes"));
		Assert.assertFalse("Vocabulary without prefix should be skipped", catalog.contains("broken"));

		VocabularyConfig colors = catalog.get("colors").get();
		Assert.assertTrue("Listed terms should default to strict", colors.isStrict());
		Assert.assertTrue(colors.isFetch());

		VocabularyConfig shapes = catalog.get("shapes").get();
		Assert.assertFalse(shapes.isStrict());
		Assert.assertTrue(shapes.getTermSource().hasTerm("circle"));

		Assert.assertFalse(catalog.get("places").get().getTermSource().isStrict());
	}

	@Test
	public void testLocationProperty() {
		URL location = getClass().getClassLoader().getResource("test-catalog.ttl");
		Assert.assertNotNull("Test resource 'test-catalog.ttl' not found on classpath", location);
		System.setProperty(VocabularyCatalog.LOCATION_PROPERTY, location.toString());
		try {
			VocabularyCatalog catalog = VocabularyCatalog.load();
			Assert.assertTrue(catalog.contains("colors"));
			Assert.assertFalse("Default catalog should not be read", catalog.contains("dcmitype"));
		} finally {
			System.clearProperty(VocabularyCatalog.LOCATION_PROPERTY);
		}
	}

	@Test
	public void testLocationPropertyFilePath() throws Exception {
		URL location = getClass().getClassLoader().getResource("test-catalog.ttl");
		System.setProperty(VocabularyCatalog.LOCATION_PROPERTY, Paths.get(location.toURI()).toString());
		try {
			Assert.assertTrue(VocabularyCatalog.load().contains("colors"));
		} finally {
			System.clearProperty(VocabularyCatalog.LOCATION_PROPERTY);
		}
	}

	@Test
	public void testLocationPropertyMissingFile() {
		System.setProperty(VocabularyCatalog.LOCATION_PROPERTY, "no-such-dir/catalog.ttl");
		try {
			VocabularyCatalog catalog = VocabularyCatalog.load();
			Assert.assertFalse(catalog.contains("colors"));
			Assert.assertTrue("Default catalog should be read instead", catalog.contains("dcmitype"));
		} finally {
			System.clearProperty(VocabularyCatalog.LOCATION_PROPERTY);
		}
	}

	@Test
	public void testMissingCatalog() {
		VocabularyCatalog catalog = new VocabularyCatalog();
		catalog.load(VocabularyCatalog.CLASSPATH_SCHEME + "does-not-exist.ttl");
		Assert.assertTrue(catalog.getVocabularies().isEmpty());
	}
}
