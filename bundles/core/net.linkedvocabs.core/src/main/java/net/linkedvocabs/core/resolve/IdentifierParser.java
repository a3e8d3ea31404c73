package net.linkedvocabs.core.resolve;

import org.eclipse.rdf4j.common.net.ParsedIRI;
import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

/**
 * Interprets candidate identifiers as IRIs.
 * <p>
 * Relative identifiers are resolved against an optional base IRI. Anything
 * that can not be interpreted as IRI is returned as
 * {@link ParsedIdentifier.Unparsed} instead of raising an error.
 */
public class IdentifierParser {
	protected static final ValueFactory vf = SimpleValueFactory.getInstance();

	static final String BNODE_PREFIX = "_:";

	protected final IRI baseIri;

	public IdentifierParser() {
		this(null);
	}

	/**
	 * @param baseIri
	 *            IRI used to resolve relative identifiers, may be
	 *            <code>null</code>
	 */
	public IdentifierParser(IRI baseIri) {
		this.baseIri = baseIri;
	}

	public ParsedIdentifier parse(Object candidate) {
		if (candidate instanceof BNode) {
			return ParsedIdentifier.anonymous((BNode) candidate);
		}
		if (candidate instanceof IRI) {
			return ParsedIdentifier.parsed((IRI) candidate);
		}
		String str;
		if (candidate instanceof Value) {
			str = ((Value) candidate).stringValue();
		} else {
			str = String.valueOf(candidate);
		}
		if (str.startsWith(BNODE_PREFIX)) {
			return ParsedIdentifier.anonymous(vf.createBNode(str.substring(BNODE_PREFIX.length())));
		}
		if (isAbsolute(str)) {
			return ParsedIdentifier.parsed(vf.createIRI(str));
		}
		if (baseIri != null && !str.isEmpty()) {
			String base = baseIri.stringValue();
			if (!str.startsWith(base)) {
				String resolved = base + (endsWithDelimiter(base) ? "" : "/") + str;
				if (isAbsolute(resolved)) {
					return ParsedIdentifier.parsed(vf.createIRI(resolved));
				}
			}
		}
		return ParsedIdentifier.unparsed(str);
	}

	/**
	 * Namespaces ending with <code>/</code> or <code>#</code> are directly
	 * followed by local names.
	 */
	static boolean endsWithDelimiter(String base) {
		return base.endsWith("/") || base.endsWith("#");
	}

	public static boolean isAbsolute(String str) {
		if (str.isEmpty()) {
			return false;
		}
		try {
			return ParsedIRI.create(str).isAbsolute();
		} catch (IllegalArgumentException e) {
			return false;
		}
	}
}
