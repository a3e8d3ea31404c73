package net.linkedvocabs.core.resolve;

import java.util.Objects;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;

import net.linkedvocabs.core.vocab.VocabularyConfig;

/**
 * Outcome of resolving a candidate identifier against the vocabularies of a
 * record class.
 */
public final class ResolvedTerm {
	public enum Kind {
		/**
		 * The identifier is a term of a registered vocabulary.
		 */
		BOUND,
		/**
		 * The identifier is adopted unchanged.
		 */
		PASS_THROUGH,
		/**
		 * The identifier can not be used as identity (blank node).
		 */
		REJECTED
	}

	private static final ResolvedTerm REJECTED = new ResolvedTerm(Kind.REJECTED, null, null, null);

	private final Kind kind;
	private final String identifier;
	private final IRI iri;
	private final VocabularyConfig vocabulary;

	private ResolvedTerm(Kind kind, String identifier, IRI iri, VocabularyConfig vocabulary) {
		this.kind = kind;
		this.identifier = identifier;
		this.iri = iri;
		this.vocabulary = vocabulary;
	}

	static ResolvedTerm bound(IRI term, VocabularyConfig vocabulary) {
		return new ResolvedTerm(Kind.BOUND, term.stringValue(), term, vocabulary);
	}

	static ResolvedTerm bound(ParsedIdentifier identifier, VocabularyConfig vocabulary) {
		return new ResolvedTerm(Kind.BOUND, identifier.getValue(), iriOf(identifier), vocabulary);
	}

	static ResolvedTerm passThrough(ParsedIdentifier identifier) {
		return new ResolvedTerm(Kind.PASS_THROUGH, identifier.getValue(), iriOf(identifier), null);
	}

	static ResolvedTerm rejected() {
		return REJECTED;
	}

	private static IRI iriOf(ParsedIdentifier identifier) {
		return identifier instanceof ParsedIdentifier.Parsed ? ((ParsedIdentifier.Parsed) identifier).getIri()
				: null;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isBound() {
		return kind == Kind.BOUND;
	}

	public boolean isRejected() {
		return kind == Kind.REJECTED;
	}

	/**
	 * The identifier to adopt, empty if rejected.
	 */
	public Optional<String> getIdentifier() {
		return Optional.ofNullable(identifier);
	}

	/**
	 * The identifier as IRI if it is an absolute IRI.
	 */
	public Optional<IRI> getIri() {
		return Optional.ofNullable(iri);
	}

	/**
	 * The vocabulary of a bound term.
	 */
	public Optional<VocabularyConfig> getVocabulary() {
		return Optional.ofNullable(vocabulary);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ResolvedTerm)) {
			return false;
		}
		ResolvedTerm other = (ResolvedTerm) obj;
		return kind == other.kind && Objects.equals(identifier, other.identifier)
				&& Objects.equals(vocabulary, other.vocabulary);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, identifier, vocabulary);
	}

	@Override
	public String toString() {
		switch (kind) {
		case BOUND:
			return "BOUND(" + identifier + " in " + vocabulary.getName() + ")";
		case PASS_THROUGH:
			return "PASS_THROUGH(" + identifier + ")";
		default:
			return "REJECTED";
		}
	}
}
