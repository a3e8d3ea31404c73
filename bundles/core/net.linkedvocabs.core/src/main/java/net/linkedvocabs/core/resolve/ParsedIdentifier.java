package net.linkedvocabs.core.resolve;

import java.util.Objects;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;

/**
 * Result of interpreting a candidate identifier.
 * <p>
 * An identifier is either {@link Parsed} into an {@link IRI},
 * {@link Unparsed} and kept as its original string or {@link Anonymous} if it
 * denotes a blank node.
 */
public abstract class ParsedIdentifier {
	private ParsedIdentifier() {
	}

	/**
	 * The string form used for prefix and term matching.
	 */
	public abstract String getValue();

	public boolean isAnonymous() {
		return false;
	}

	public static Parsed parsed(IRI iri) {
		return new Parsed(iri);
	}

	public static Unparsed unparsed(String original) {
		return new Unparsed(original);
	}

	public static Anonymous anonymous(BNode node) {
		return new Anonymous(node);
	}

	public static final class Parsed extends ParsedIdentifier {
		private final IRI iri;

		Parsed(IRI iri) {
			this.iri = Objects.requireNonNull(iri);
		}

		public IRI getIri() {
			return iri;
		}

		@Override
		public String getValue() {
			return iri.stringValue();
		}

		@Override
		public String toString() {
			return "<" + iri + ">";
		}
	}

	public static final class Unparsed extends ParsedIdentifier {
		private final String original;

		Unparsed(String original) {
			this.original = Objects.requireNonNull(original);
		}

		@Override
		public String getValue() {
			return original;
		}

		@Override
		public String toString() {
			return "\"" + original + "\"";
		}
	}

	public static final class Anonymous extends ParsedIdentifier {
		private final BNode node;

		Anonymous(BNode node) {
			this.node = Objects.requireNonNull(node);
		}

		public BNode getNode() {
			return node;
		}

		@Override
		public String getValue() {
			return "_:" + node.getID();
		}

		@Override
		public boolean isAnonymous() {
			return true;
		}

		@Override
		public String toString() {
			return getValue();
		}
	}
}
