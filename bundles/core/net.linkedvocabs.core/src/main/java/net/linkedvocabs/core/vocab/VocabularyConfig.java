package net.linkedvocabs.core.vocab;

import java.util.Objects;
import java.util.Optional;

import org.eclipse.rdf4j.model.IRI;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Configuration of a controlled vocabulary as registered for a record class.
 */
public final class VocabularyConfig {
	private final String name;
	private final String prefix;
	private final ITermSource termSource;
	private final boolean strict;
	private final IRI source;
	private final boolean fetch;

	public VocabularyConfig(String name, String prefix, ITermSource termSource, boolean strict, IRI source,
			boolean fetch) {
		this.name = Preconditions.checkNotNull(name, "name");
		this.prefix = Preconditions.checkNotNull(prefix, "prefix");
		this.termSource = Preconditions.checkNotNull(termSource, "termSource");
		this.strict = strict;
		this.source = source;
		this.fetch = fetch;
	}

	public String getName() {
		return name;
	}

	public String getPrefix() {
		return prefix;
	}

	public ITermSource getTermSource() {
		return termSource;
	}

	public boolean isStrict() {
		return strict;
	}

	/**
	 * The document defining this vocabulary.
	 */
	public Optional<IRI> getSource() {
		return Optional.ofNullable(source);
	}

	/**
	 * Whether {@link #getSource()} should be loaded into the backing store.
	 */
	public boolean isFetch() {
		return fetch;
	}

	/**
	 * Returns a copy of this configuration with the non-null values of
	 * <code>overrides</code> applied.
	 */
	public VocabularyConfig merge(VocabularyOptions overrides) {
		if (overrides == null) {
			return this;
		}
		ITermSource mergedSource = overrides.getTermSource() != null ? overrides.getTermSource() : termSource;
		boolean mergedStrict;
		if (overrides.getStrict() != null) {
			mergedStrict = overrides.getStrict();
		} else if (overrides.getTermSource() != null) {
			mergedStrict = mergedSource.isStrict();
		} else {
			mergedStrict = strict;
		}
		return new VocabularyConfig(name, overrides.getPrefix() != null ? overrides.getPrefix() : prefix,
				mergedSource, mergedStrict, overrides.getSource() != null ? overrides.getSource() : source,
				overrides.getFetch() != null ? overrides.getFetch() : fetch);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof VocabularyConfig)) {
			return false;
		}
		VocabularyConfig other = (VocabularyConfig) obj;
		return name.equals(other.name) && prefix.equals(other.prefix) && termSource.equals(other.termSource)
				&& strict == other.strict && Objects.equals(source, other.source) && fetch == other.fetch;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, prefix, termSource, strict, source, fetch);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("name", name).add("prefix", prefix).add("strict", strict)
				.add("source", source).toString();
	}
}
