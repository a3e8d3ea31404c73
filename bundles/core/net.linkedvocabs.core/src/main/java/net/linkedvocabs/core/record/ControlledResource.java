package net.linkedvocabs.core.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.util.Models;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.linkedvocabs.core.resolve.ResolvedTerm;

/**
 * A record whose data is kept in an RDF {@link Model} and whose identity is
 * controlled by the vocabularies of its {@link ControlledClass}.
 */
public class ControlledResource implements IControlledRecord {
	protected static final ValueFactory vf = SimpleValueFactory.getInstance();

	private static final Logger log = LoggerFactory.getLogger(ControlledResource.class);

	private final ControlledClass type;

	private final Model model = new LinkedHashModel();

	private final Map<IRI, List<ControlledResource>> links = new LinkedHashMap<>();

	private Resource subject;

	ControlledResource(ControlledClass type) {
		this.type = type;
		this.subject = vf.createBNode();
	}

	/**
	 * Sets the identity of this record.
	 * <p>
	 * The candidate is resolved against the vocabularies of the record class,
	 * a matching vocabulary term is used instead of the candidate if one
	 * exists.
	 * 
	 * @param candidate
	 *            A string or IRI
	 * @return <code>true</code> if the identity was set, <code>false</code> if
	 *         the candidate can not be used as identity
	 * @throws IllegalStateException
	 *             If the record already has a different IRI
	 */
	public boolean setSubject(Object candidate) {
		ResolvedTerm term = type.getResolver().resolve(candidate);
		if (term.isRejected()) {
			return false;
		}
		Optional<IRI> iri = term.getIri();
		if (!iri.isPresent()) {
			log.warn("Identifier {} of {} is not an absolute IRI", term.getIdentifier().orElse(null), type);
			return false;
		}
		if (subject instanceof IRI && !subject.equals(iri.get())) {
			throw new IllegalStateException("Refusing to update IRI when one is already assigned: " + subject);
		}
		replaceSubject(iri.get());
		return true;
	}

	private void replaceSubject(IRI newSubject) {
		List<Statement> statements = new ArrayList<>(model.filter(subject, null, null));
		model.remove(subject, null, null);
		for (Statement stmt : statements) {
			model.add(newSubject, stmt.getPredicate(), stmt.getObject());
		}
		subject = newSubject;
	}

	/**
	 * Tests if the identity of this record is a term of one of the class's
	 * vocabularies.
	 */
	public boolean inVocab() {
		return type.getResolver().inVocab(subject);
	}

	/**
	 * Returns the display labels of this record.
	 */
	public List<String> getLabel() {
		return type.getLabelSelector().selectLabel(this);
	}

	/**
	 * Validates that this record and its linked controlled records are
	 * members of their vocabularies.
	 * 
	 * @return The error messages, empty if the record is valid
	 */
	public List<String> validate() {
		return type.getValidator().validate(this);
	}

	public void addLiteral(IRI predicate, Literal value) {
		model.add(subject, predicate, value);
	}

	public void addLiteral(IRI predicate, String label, String language) {
		addLiteral(predicate, language == null ? vf.createLiteral(label) : vf.createLiteral(label, language));
	}

	/**
	 * Links a controlled record as value of <code>predicate</code>.
	 */
	public void addLink(IRI predicate, ControlledResource value) {
		links.computeIfAbsent(predicate, p -> new ArrayList<>()).add(value);
	}

	public List<ControlledResource> getLinks(IRI predicate) {
		List<ControlledResource> values = links.get(predicate);
		return values == null ? Collections.<ControlledResource> emptyList() : Collections.unmodifiableList(values);
	}

	public Map<IRI, List<ControlledResource>> getLinks() {
		return Collections.unmodifiableMap(links);
	}

	@Override
	public List<Literal> getLiterals(IRI predicate) {
		List<Literal> literals = new ArrayList<>();
		for (Value value : model.filter(subject, predicate, null).objects()) {
			if (value instanceof Literal) {
				literals.add((Literal) value);
			}
		}
		return literals;
	}

	public Optional<Literal> getLiteral(IRI predicate) {
		return Models.objectLiteral(model.filter(subject, predicate, null));
	}

	@Override
	public Optional<Resource> getIdentifier() {
		return Optional.of(subject);
	}

	public Resource getSubject() {
		return subject;
	}

	@Override
	public List<IRI> getLabelPredicates() {
		return type.getLabelPredicates();
	}

	public ControlledClass getType() {
		return type;
	}

	public Model getModel() {
		return model.unmodifiable();
	}

	@Override
	public String toString() {
		return subject.toString();
	}
}
