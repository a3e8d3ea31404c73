package net.linkedvocabs.core.vocab;

import org.eclipse.rdf4j.model.IRI;

/**
 * Caller-supplied overrides for the catalog defaults of a vocabulary.
 * <p>
 * Unset (<code>null</code>) options keep the catalog's value.
 */
public class VocabularyOptions {
	private String prefix;
	private ITermSource termSource;
	private Boolean strict;
	private IRI source;
	private Boolean fetch;

	public static VocabularyOptions create() {
		return new VocabularyOptions();
	}

	public VocabularyOptions prefix(String prefix) {
		this.prefix = prefix;
		return this;
	}

	public VocabularyOptions termSource(ITermSource termSource) {
		this.termSource = termSource;
		return this;
	}

	public VocabularyOptions strict(boolean strict) {
		this.strict = strict;
		return this;
	}

	public VocabularyOptions source(IRI source) {
		this.source = source;
		return this;
	}

	public VocabularyOptions fetch(boolean fetch) {
		this.fetch = fetch;
		return this;
	}

	public String getPrefix() {
		return prefix;
	}

	public ITermSource getTermSource() {
		return termSource;
	}

	public Boolean getStrict() {
		return strict;
	}

	public IRI getSource() {
		return source;
	}

	public Boolean getFetch() {
		return fetch;
	}
}
