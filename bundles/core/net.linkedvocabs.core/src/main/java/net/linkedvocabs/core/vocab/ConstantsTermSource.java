package net.linkedvocabs.core.vocab;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Strict term source whose terms are the <code>public static</code>
 * {@link IRI} constants of a vocabulary class like
 * {@link org.eclipse.rdf4j.model.vocabulary.SKOS}.
 * <p>
 * Only constants below the given namespace are considered to be terms.
 */
public class ConstantsTermSource implements ITermSource {
	private static final Logger log = LoggerFactory.getLogger(ConstantsTermSource.class);

	protected final String namespace;
	protected final Map<String, IRI> terms;

	public ConstantsTermSource(Class<?> vocabularyClass, String namespace) {
		this.namespace = namespace;
		this.terms = collectTerms(vocabularyClass, namespace);
		log.debug("Found {} terms of <{}> in {}", terms.size(), namespace, vocabularyClass.getName());
	}

	/**
	 * Creates a term source for the vocabulary class with the given name.
	 * 
	 * @throws IllegalArgumentException
	 *             If the class can not be loaded
	 */
	public static ConstantsTermSource forClassName(String className, String namespace, ClassLoader classLoader) {
		try {
			return new ConstantsTermSource(Class.forName(className, true, classLoader), namespace);
		} catch (ClassNotFoundException e) {
			throw new IllegalArgumentException("Vocabulary class not found: " + className, e);
		}
	}

	private static Map<String, IRI> collectTerms(Class<?> vocabularyClass, String namespace) {
		Map<String, IRI> terms = new LinkedHashMap<>();
		for (Field field : vocabularyClass.getFields()) {
			int modifiers = field.getModifiers();
			if (!Modifier.isStatic(modifiers) || !IRI.class.isAssignableFrom(field.getType())) {
				continue;
			}
			try {
				IRI term = (IRI) field.get(null);
				if (term != null && term.stringValue().startsWith(namespace)
						&& term.stringValue().length() > namespace.length()) {
					terms.put(term.stringValue().substring(namespace.length()), term);
				}
			} catch (IllegalAccessException e) {
				log.warn("Unable to read term constant {}", field, e);
			}
		}
		return ImmutableMap.copyOf(terms);
	}

	@Override
	public String getNamespace() {
		return namespace;
	}

	@Override
	public boolean hasTerm(String name) {
		return name != null && terms.containsKey(name);
	}

	@Override
	public IRI termFor(String name) {
		IRI term = name == null ? null : terms.get(name);
		if (term == null) {
			throw new IllegalArgumentException("Term " + name + " is not defined in <" + namespace + ">");
		}
		return term;
	}

	@Override
	public Optional<Collection<IRI>> listTerms() {
		return Optional.<Collection<IRI>> of(ImmutableList.copyOf(terms.values()));
	}

	@Override
	public boolean isStrict() {
		return true;
	}

	@Override
	public String toString() {
		return namespace;
	}
}
