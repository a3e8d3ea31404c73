package net.linkedvocabs.qa.store;

import java.util.Objects;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;

/**
 * A statement returned by a {@link ITripleStore} query.
 */
public final class QuerySolution {
	private final Resource subject;
	private final IRI predicate;
	private final Value object;

	public QuerySolution(Resource subject, IRI predicate, Value object) {
		this.subject = Objects.requireNonNull(subject);
		this.predicate = Objects.requireNonNull(predicate);
		this.object = Objects.requireNonNull(object);
	}

	public Resource getSubject() {
		return subject;
	}

	public IRI getPredicate() {
		return predicate;
	}

	public Value getObject() {
		return object;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof QuerySolution)) {
			return false;
		}
		QuerySolution other = (QuerySolution) obj;
		return subject.equals(other.subject) && predicate.equals(other.predicate) && object.equals(other.object);
	}

	@Override
	public int hashCode() {
		return Objects.hash(subject, predicate, object);
	}

	@Override
	public String toString() {
		return "(" + subject + ", " + predicate + ", " + object + ")";
	}
}
