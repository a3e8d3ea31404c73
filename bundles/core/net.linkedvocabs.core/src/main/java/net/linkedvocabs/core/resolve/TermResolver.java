package net.linkedvocabs.core.resolve;

import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import net.linkedvocabs.core.vocab.ITermSource;
import net.linkedvocabs.core.vocab.VocabularyConfig;
import net.linkedvocabs.core.vocab.VocabularyRegistry;

/**
 * Finds the term of a controlled vocabulary that should be used as identity
 * for a record.
 * <p>
 * Vocabularies are consulted in registration order:
 * <ul>
 * <li>identifiers starting with the prefix of a non-strict vocabulary are
 * accepted as they are,</li>
 * <li>identifiers starting with the prefix of a strict vocabulary are
 * replaced by the vocabulary's term if the remainder is a defined term,</li>
 * <li>any other identifier is checked to be the local name of a term. The
 * first such term is used if it is confirmed by the prefix of a registered
 * vocabulary.</li>
 * </ul>
 * Identifiers that do not match any vocabulary are passed through unchanged,
 * blank nodes are rejected.
 */
public class TermResolver {
	private static final Logger log = LoggerFactory.getLogger(TermResolver.class);

	protected final VocabularyRegistry registry;

	protected final IdentifierParser parser;

	public TermResolver(VocabularyRegistry registry) {
		this(registry, new IdentifierParser());
	}

	public TermResolver(VocabularyRegistry registry, IdentifierParser parser) {
		this.registry = Preconditions.checkNotNull(registry, "registry");
		this.parser = Preconditions.checkNotNull(parser, "parser");
	}

	/**
	 * Resolves a candidate identifier.
	 * 
	 * @param candidate
	 *            A string, {@link IRI}, blank node or other value whose string
	 *            form is the identifier
	 * @return The resolved term, never <code>null</code>
	 */
	public ResolvedTerm resolve(Object candidate) {
		if (candidate == null) {
			return ResolvedTerm.rejected();
		}
		ParsedIdentifier identifier = parser.parse(candidate);
		if (identifier.isAnonymous()) {
			log.debug("Rejected anonymous identifier {}", identifier);
			return ResolvedTerm.rejected();
		}

		String value = identifier.getValue();
		IRI nameMatch = null;
		for (VocabularyConfig config : registry.getVocabularies()) {
			ITermSource termSource = config.getTermSource();
			if (value.startsWith(config.getPrefix())) {
				if (!config.isStrict()) {
					return ResolvedTerm.bound(identifier, config);
				}
				String suffix = value.substring(config.getPrefix().length());
				if (termSource.hasTerm(suffix)) {
					return ResolvedTerm.bound(termSource.termFor(suffix), config);
				}
			} else if (nameMatch == null && termSource.hasTerm(value)) {
				nameMatch = termSource.termFor(value);
			}
		}
		if (nameMatch == null) {
			return ResolvedTerm.passThrough(identifier);
		}

		// a term found by name must also be confirmed by a registered prefix
		Optional<VocabularyConfig> confirmed = registry.matching(nameMatch.stringValue());
		if (confirmed.isPresent()) {
			return ResolvedTerm.bound(nameMatch, confirmed.get());
		}
		log.debug("Term {} for {} does not match any vocabulary prefix", nameMatch, identifier);
		return ResolvedTerm.passThrough(identifier);
	}

	/**
	 * Tests if <code>subject</code> is a member of one of the registered
	 * vocabularies.
	 * <p>
	 * The namespace of a vocabulary itself is not a member.
	 */
	public boolean inVocab(Resource subject) {
		if (!(subject instanceof IRI)) {
			return false;
		}
		String identifier = subject.stringValue();
		Optional<VocabularyConfig> match = registry.matching(identifier);
		if (!match.isPresent()) {
			return false;
		}
		VocabularyConfig config = match.get();
		if (identifier.equals(config.getPrefix())) {
			return false;
		}
		if (config.isStrict()
				&& !config.getTermSource().hasTerm(identifier.substring(config.getPrefix().length()))) {
			return false;
		}
		return true;
	}

	public VocabularyRegistry getRegistry() {
		return registry;
	}
}
