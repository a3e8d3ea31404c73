package net.linkedvocabs.core.label;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.vocabulary.DCTERMS;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.model.vocabulary.SKOS;

import com.google.common.collect.ImmutableList;

import net.linkedvocabs.core.record.IControlledRecord;

/**
 * Selects display labels for records.
 * <p>
 * The label predicates declared by the record's class are tried first,
 * followed by {@link #DEFAULT_LABEL_PREDICATES}. The values of the first
 * predicate that has any are returned, restricted to the first preferred
 * language that has values. A record without labels is represented by its
 * identifier.
 */
public class LabelSelector {
	public static final List<IRI> DEFAULT_LABEL_PREDICATES = ImmutableList.of(SKOS.PREF_LABEL, DCTERMS.TITLE,
			RDFS.LABEL, SKOS.ALT_LABEL, SKOS.HIDDEN_LABEL);

	public static final List<String> DEFAULT_LANGUAGES = ImmutableList.of("en", "en-us");

	protected final List<String> preferredLanguages;

	public LabelSelector() {
		this(DEFAULT_LANGUAGES);
	}

	public LabelSelector(List<String> preferredLanguages) {
		this.preferredLanguages = ImmutableList.copyOf(preferredLanguages);
	}

	public List<String> selectLabel(IControlledRecord record) {
		return selectLabel(record, preferredLanguages);
	}

	public List<String> selectLabel(IControlledRecord record, List<String> preferredLanguages) {
		for (IRI predicate : labelPredicates(record)) {
			List<String> values = withPreferredLanguage(record.getLiterals(predicate), preferredLanguages);
			if (!values.isEmpty()) {
				return values;
			}
		}
		Optional<Resource> identifier = record.getIdentifier();
		if (identifier.isPresent() && !identifier.get().isBNode()) {
			return ImmutableList.of(identifier.get().stringValue());
		}
		return ImmutableList.of();
	}

	protected Set<IRI> labelPredicates(IControlledRecord record) {
		Set<IRI> predicates = new LinkedHashSet<>(record.getLabelPredicates());
		predicates.addAll(DEFAULT_LABEL_PREDICATES);
		return predicates;
	}

	protected List<String> withPreferredLanguage(List<Literal> values, List<String> preferredLanguages) {
		for (String language : preferredLanguages) {
			List<String> result = filterByLanguage(values, language);
			if (!result.isEmpty()) {
				return result;
			}
		}
		List<String> all = new ArrayList<>(values.size());
		for (Literal value : values) {
			all.add(value.getLabel());
		}
		return all;
	}

	protected List<String> filterByLanguage(List<Literal> values, String language) {
		List<String> result = new ArrayList<>();
		for (Literal value : values) {
			if (value.getLanguage().map(language::equals).orElse(false)) {
				result.add(value.getLabel());
			}
		}
		return result;
	}

	public List<String> getPreferredLanguages() {
		return preferredLanguages;
	}
}
