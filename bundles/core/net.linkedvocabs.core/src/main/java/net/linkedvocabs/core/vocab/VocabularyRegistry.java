package net.linkedvocabs.core.vocab;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The controlled vocabularies used by a record class.
 * <p>
 * Vocabularies are kept in registration order which is also the order used to
 * break ties between overlapping prefixes. The registry is populated once
 * while setting up a record class and afterwards only read.
 */
public class VocabularyRegistry {
	private static final Logger log = LoggerFactory.getLogger(VocabularyRegistry.class);

	private final VocabularyCatalog catalog;

	private final Map<String, VocabularyConfig> vocabularies = new LinkedHashMap<>();

	private volatile List<VocabularyConfig> snapshot = ImmutableList.of();

	public VocabularyRegistry(VocabularyCatalog catalog) {
		this.catalog = Preconditions.checkNotNull(catalog, "catalog");
	}

	/**
	 * Registers the vocabulary <code>name</code> with its default
	 * configuration.
	 * 
	 * @see #register(String, VocabularyOptions)
	 */
	public VocabularyConfig register(String name) {
		return register(name, null);
	}

	/**
	 * Registers the vocabulary <code>name</code>.
	 * 
	 * @param name
	 *            Name of a vocabulary defined by the catalog
	 * @param overrides
	 *            Options replacing the catalog defaults, may be
	 *            <code>null</code>
	 * @return The effective configuration
	 * @throws UnknownVocabularyException
	 *             If the catalog does not define <code>name</code>
	 */
	public synchronized VocabularyConfig register(String name, VocabularyOptions overrides) {
		VocabularyConfig defaults = catalog.get(name).orElseThrow(() -> new UnknownVocabularyException(name));
		VocabularyConfig config = defaults.merge(overrides);
		vocabularies.put(name, config);
		snapshot = ImmutableList.copyOf(vocabularies.values());
		log.debug("Registered vocabulary {}", config);
		return config;
	}

	/**
	 * Returns the first registered vocabulary whose prefix is a prefix of
	 * <code>identifier</code>.
	 */
	public Optional<VocabularyConfig> matching(String identifier) {
		if (identifier == null) {
			return Optional.empty();
		}
		for (VocabularyConfig config : snapshot) {
			if (identifier.startsWith(config.getPrefix())) {
				return Optional.of(config);
			}
		}
		return Optional.empty();
	}

	public boolean usesVocabPrefix(String identifier) {
		return matching(identifier).isPresent();
	}

	/**
	 * Returns the terms allowed by the registered strict vocabularies.
	 * <p>
	 * This does not necessarily list <em>all</em> terms allowed for the record
	 * class. Non-strict vocabularies are not included.
	 */
	public List<IRI> listTerms() {
		List<IRI> terms = new ArrayList<>();
		for (VocabularyConfig config : snapshot) {
			if (!config.isStrict()) {
				continue;
			}
			ITermSource termSource = config.getTermSource();
			Optional<Collection<IRI>> catalogTerms = termSource.listTerms();
			if (!catalogTerms.isPresent()) {
				continue;
			}
			for (IRI term : catalogTerms.get()) {
				if (term.stringValue().startsWith(termSource.getNamespace())) {
					terms.add(term);
				}
			}
		}
		return terms;
	}

	public Optional<VocabularyConfig> get(String name) {
		for (VocabularyConfig config : snapshot) {
			if (config.getName().equals(name)) {
				return Optional.of(config);
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the registered vocabularies in registration order.
	 */
	public List<VocabularyConfig> getVocabularies() {
		return snapshot;
	}

	public boolean isEmpty() {
		return snapshot.isEmpty();
	}
}
