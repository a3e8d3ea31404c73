package net.linkedvocabs.core.record;

import java.util.List;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;

/**
 * A record whose identity may be bound to a controlled vocabulary.
 */
public interface IControlledRecord {
	/**
	 * The current identifier, a blank node if the record has not been given a
	 * persistent identity yet.
	 */
	Optional<Resource> getIdentifier();

	/**
	 * Label predicates declared by the record's class, in priority order.
	 */
	List<IRI> getLabelPredicates();

	/**
	 * Returns the literal values of <code>predicate</code>.
	 */
	List<Literal> getLiterals(IRI predicate);
}
