package net.linkedvocabs.core.vocab;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A term source defined by an explicit set of local names below a namespace.
 * <p>
 * An open term set without any names accepts every identifier below its
 * prefix when used as a non-strict vocabulary.
 */
public class TermSet implements ITermSource {
	protected static final ValueFactory vf = SimpleValueFactory.getInstance();

	protected final String namespace;
	protected final Set<String> names;
	protected final boolean strict;

	public TermSet(String namespace, Collection<String> names, boolean strict) {
		this.namespace = Preconditions.checkNotNull(namespace, "namespace");
		this.names = ImmutableSet.copyOf(names);
		this.strict = strict;
	}

	/**
	 * Creates a strict term set which only accepts the given names.
	 */
	public static TermSet strict(String namespace, String... names) {
		return new TermSet(namespace, ImmutableList.copyOf(names), true);
	}

	/**
	 * Creates a non-strict term set.
	 */
	public static TermSet open(String namespace, String... names) {
		return new TermSet(namespace, ImmutableList.copyOf(names), false);
	}

	@Override
	public String getNamespace() {
		return namespace;
	}

	@Override
	public boolean hasTerm(String name) {
		return name != null && names.contains(name);
	}

	@Override
	public IRI termFor(String name) {
		if (!hasTerm(name)) {
			throw new IllegalArgumentException("Term " + name + " is not defined in <" + namespace + ">");
		}
		return vf.createIRI(namespace + name);
	}

	@Override
	public Optional<Collection<IRI>> listTerms() {
		ImmutableList.Builder<IRI> terms = ImmutableList.builder();
		for (String name : names) {
			terms.add(vf.createIRI(namespace + name));
		}
		return Optional.<Collection<IRI>> of(terms.build());
	}

	@Override
	public boolean isStrict() {
		return strict;
	}

	@Override
	public String toString() {
		return namespace;
	}
}
