package net.linkedvocabs.qa;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.vocabulary.DCTERMS;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.model.vocabulary.SKOS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.linkedvocabs.core.record.ControlledClass;
import net.linkedvocabs.core.vocab.VocabularyRegistry;
import net.linkedvocabs.qa.store.ITripleStore;
import net.linkedvocabs.qa.store.ITripleStore.MatchMode;
import net.linkedvocabs.qa.store.QuerySolution;

/**
 * Keyword search over the vocabularies of a record class.
 * <p>
 * Literals starting with the search text are looked up first. Only if this
 * does not yield any hits the store is searched for literals containing the
 * text. Hits are restricted to subjects within the registered vocabularies and
 * label statements are preferred over other matching literals.
 */
public class VocabularySearch {
	public static final List<IRI> DEFAULT_LABEL_PREDICATES = ImmutableList.of(SKOS.PREF_LABEL, DCTERMS.TITLE,
			RDFS.LABEL);

	private static final Logger log = LoggerFactory.getLogger(VocabularySearch.class);

	protected final VocabularyRegistry registry;

	protected final ITripleStore store;

	protected final Set<IRI> labelPredicates;

	private volatile List<SearchHit> response = ImmutableList.of();

	public VocabularySearch(VocabularyRegistry registry, ITripleStore store) {
		this(registry, store, ImmutableList.<IRI> of());
	}

	/**
	 * @param registry
	 *            The vocabularies to search
	 * @param store
	 *            The store containing the vocabulary data
	 * @param recordLabelPredicates
	 *            Label predicates declared by the record class in addition to
	 *            {@link #DEFAULT_LABEL_PREDICATES}
	 */
	public VocabularySearch(VocabularyRegistry registry, ITripleStore store, List<IRI> recordLabelPredicates) {
		this.registry = Preconditions.checkNotNull(registry, "registry");
		this.store = Preconditions.checkNotNull(store, "store");
		Set<IRI> predicates = new LinkedHashSet<>(DEFAULT_LABEL_PREDICATES);
		predicates.addAll(recordLabelPredicates);
		this.labelPredicates = predicates;
	}

	/**
	 * Creates a search for the vocabularies and label predicates of the given
	 * record class.
	 */
	public static VocabularySearch forClass(ControlledClass type, ITripleStore store) {
		return new VocabularySearch(type.getRegistry(), store, type.getLabelPredicates());
	}

	/**
	 * Searches the registered vocabularies for <code>q</code>.
	 * 
	 * @param q
	 *            The search text, matched case-insensitively
	 * @return The hits without duplicates
	 * @throws net.linkedvocabs.qa.store.StoreUnavailableException
	 *             If the store fails
	 */
	public List<SearchHit> search(String q) {
		Preconditions.checkNotNull(q, "query");
		List<SearchHit> hits = toHits(store.findByLiteral(q, MatchMode.STARTS_WITH));
		if (hits.isEmpty()) {
			log.debug("No literals starting with '{}', searching for literals containing it", q);
			hits = toHits(store.findByLiteral(q, MatchMode.CONTAINS));
		}
		response = hits;
		return hits;
	}

	/**
	 * Searches the registered vocabularies for <code>q</code>.
	 * <p>
	 * Sub-authorities are not distinguished, all registered vocabularies are
	 * searched.
	 */
	public List<SearchHit> search(String q, String subAuthority) {
		return search(q);
	}

	protected List<SearchHit> toHits(List<QuerySolution> solutions) {
		List<QuerySolution> inVocabulary = new ArrayList<>();
		for (QuerySolution solution : solutions) {
			if (registry.usesVocabPrefix(solution.getSubject().stringValue())) {
				inVocabulary.add(solution);
			}
		}
		Set<SearchHit> labelHits = new LinkedHashSet<>();
		for (QuerySolution solution : inVocabulary) {
			if (labelPredicates.contains(solution.getPredicate())) {
				labelHits.add(buildHit(solution));
			}
		}
		if (!labelHits.isEmpty()) {
			return ImmutableList.copyOf(labelHits);
		}
		Set<SearchHit> hits = new LinkedHashSet<>();
		for (QuerySolution solution : inVocabulary) {
			hits.add(buildHit(solution));
		}
		return ImmutableList.copyOf(hits);
	}

	protected SearchHit buildHit(QuerySolution solution) {
		return new SearchHit(solution.getSubject().stringValue(), solution.getObject().stringValue());
	}

	/**
	 * The hits of the last search.
	 */
	public List<SearchHit> getResults() {
		return response;
	}

	/**
	 * Returns the full record for <code>id</code>.
	 * <p>
	 * Not supported by the generic vocabulary search, subclasses for specific
	 * authorities may override this.
	 */
	public Optional<Model> getFullRecord(String id, String subAuthority) {
		return Optional.empty();
	}

	public Set<IRI> getLabelPredicates() {
		return labelPredicates;
	}
}
