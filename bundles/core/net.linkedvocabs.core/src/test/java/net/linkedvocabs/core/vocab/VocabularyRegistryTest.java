package net.linkedvocabs.core.vocab;

import static net.linkedvocabs.core.TestVocabularies.DCMITYPE;
import static net.linkedvocabs.core.TestVocabularies.LCSH;
import static net.linkedvocabs.core.TestVocabularies.iri;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.linkedvocabs.core.TestVocabularies;

public class VocabularyRegistryTest {
	VocabularyRegistry registry;

	@Before
	public void beforeTest() {
		registry = new VocabularyRegistry(TestVocabularies.createCatalog());
	}

	@Test
	public void testUnknownVocabulary() {
		try {
			registry.register("nope");
			Assert.fail("Registration of an unknown vocabulary should fail");
		} catch (UnknownVocabularyException e) {
			Assert.assertEquals("Vocabulary undefined: NOPE", e.getMessage());
			Assert.assertEquals("nope", e.getVocabulary());
		}
		Assert.assertTrue(registry.isEmpty());
	}

	@Test
	public void testMatching() {
		VocabularyConfig dcmitype = registry.register("dcmitype");
		registry.register("lcsh");

		Assert.assertEquals(dcmitype, registry.matching(DCMITYPE + "term").get());
		Assert.assertEquals("lcsh", registry.matching(LCSH + "sh85").get().getName());
		Assert.assertFalse(registry.matching("unrelated:term").isPresent());
		Assert.assertFalse(registry.matching(null).isPresent());
		Assert.assertTrue(registry.usesVocabPrefix(DCMITYPE));
	}

	@Test
	public void testOverlappingPrefixes() {
		registry.register("dcmitype");
		registry.register("purl");
		Assert.assertEquals("dcmitype", registry.matching(DCMITYPE + "Image").get().getName());
		Assert.assertEquals("purl", registry.matching("http://purl.org/dc/terms/title").get().getName());
	}

	@Test
	public void testOverridesWin() {
		VocabularyConfig config = registry.register("dcmitype",
				VocabularyOptions.create().prefix("http://example.org/types/").strict(false).fetch(false));
		Assert.assertEquals("http://example.org/types/", config.getPrefix());
		Assert.assertFalse(config.isStrict());
		Assert.assertFalse(config.isFetch());
		// not overridden
		Assert.assertEquals(iri("http://dublincore.org/2012/06/14/dctype.rdf"), config.getSource().get());
		Assert.assertTrue(config.getTermSource().hasTerm("Image"));
	}

	@Test
	public void testOverrideTermSourceDefinesStrictness() {
		VocabularyConfig config = registry.register("lcsh",
				VocabularyOptions.create().termSource(TermSet.strict(LCSH, "sh85")));
		Assert.assertTrue(config.isStrict());
	}

	@Test
	public void testRegistrationOrder() {
		registry.register("lcsh");
		registry.register("dcmitype");
		registry.register("lcsh", VocabularyOptions.create().strict(true));

		List<String> names = new ArrayList<>();
		for (VocabularyConfig config : registry.getVocabularies()) {
			names.add(config.getName());
		}
		Assert.assertEquals(2, names.size());
		Assert.assertEquals("lcsh", names.get(0));
		Assert.assertEquals("dcmitype", names.get(1));
		Assert.assertTrue(registry.get("lcsh").get().isStrict());
	}

	@Test
	public void testListTerms() {
		registry.register("dcmitype");
		registry.register("lcsh");
		registry.register("skos");

		List<IRI> terms = registry.listTerms();
		Assert.assertTrue(terms.contains(iri(DCMITYPE + "Image")));
		Assert.assertTrue(terms.contains(SKOS.PREF_LABEL));
		for (IRI term : terms) {
			Assert.assertFalse("Non-strict vocabularies are not listed", term.stringValue().startsWith(LCSH));
		}
	}

	@Test
	public void testListTermsSkipsNonStrictOverride() {
		registry.register("dcmitype", VocabularyOptions.create().strict(false));
		Assert.assertTrue(registry.listTerms().isEmpty());
	}
}
