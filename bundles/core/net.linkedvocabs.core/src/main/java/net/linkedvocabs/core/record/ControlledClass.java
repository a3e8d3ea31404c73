package net.linkedvocabs.core.record;

import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.linkedvocabs.core.label.LabelSelector;
import net.linkedvocabs.core.resolve.IdentifierParser;
import net.linkedvocabs.core.resolve.TermResolver;
import net.linkedvocabs.core.vocab.VocabularyCatalog;
import net.linkedvocabs.core.vocab.VocabularyConfig;
import net.linkedvocabs.core.vocab.VocabularyOptions;
import net.linkedvocabs.core.vocab.VocabularyRegistry;

/**
 * A class of records bound to controlled vocabularies.
 * <p>
 * Holds the state shared by all records of the class: the registered
 * vocabularies, the declared label predicates and the components resolving
 * identities, selecting labels and validating records.
 */
public class ControlledClass {
	private final String name;
	private final VocabularyRegistry registry;
	private final List<IRI> labelPredicates;
	private final IRI baseIri;
	private final TermResolver resolver;
	private final LabelSelector labelSelector;
	private final AuthorityValidator validator;

	public ControlledClass(String name, VocabularyCatalog catalog) {
		this(name, new VocabularyRegistry(catalog), null, ImmutableList.<IRI> of());
	}

	/**
	 * @param name
	 *            Name of the record class
	 * @param registry
	 *            The vocabularies of the record class
	 * @param baseIri
	 *            Base for relative identifiers, may be <code>null</code>
	 * @param labelPredicates
	 *            Class-specific label predicates
	 */
	public ControlledClass(String name, VocabularyRegistry registry, IRI baseIri, List<IRI> labelPredicates) {
		this(name, registry, baseIri, labelPredicates, new LabelSelector());
	}

	/**
	 * @param labelSelector
	 *            Selects the display labels of the records, e.g. the
	 *            {@link LabelSelector} bound by
	 *            {@link net.linkedvocabs.core.VocabularyModule}
	 */
	public ControlledClass(String name, VocabularyRegistry registry, IRI baseIri, List<IRI> labelPredicates,
			LabelSelector labelSelector) {
		this.name = Preconditions.checkNotNull(name, "name");
		this.registry = Preconditions.checkNotNull(registry, "registry");
		this.baseIri = baseIri;
		this.labelPredicates = ImmutableList.copyOf(labelPredicates);
		this.resolver = new TermResolver(registry, new IdentifierParser(baseIri));
		this.labelSelector = Preconditions.checkNotNull(labelSelector, "labelSelector");
		this.validator = new AuthorityValidator();
	}

	/**
	 * Registers a vocabulary with its catalog defaults.
	 */
	public VocabularyConfig useVocabulary(String vocabulary) {
		return registry.register(vocabulary);
	}

	/**
	 * Registers a vocabulary with the given overrides.
	 */
	public VocabularyConfig useVocabulary(String vocabulary, VocabularyOptions options) {
		return registry.register(vocabulary, options);
	}

	/**
	 * Creates a new record with an anonymous identity.
	 */
	public ControlledResource newResource() {
		return new ControlledResource(this);
	}

	public String getName() {
		return name;
	}

	public VocabularyRegistry getRegistry() {
		return registry;
	}

	public List<IRI> getLabelPredicates() {
		return labelPredicates;
	}

	public Optional<IRI> getBaseIri() {
		return Optional.ofNullable(baseIri);
	}

	public TermResolver getResolver() {
		return resolver;
	}

	public LabelSelector getLabelSelector() {
		return labelSelector;
	}

	public AuthorityValidator getValidator() {
		return validator;
	}

	@Override
	public String toString() {
		return name;
	}
}
