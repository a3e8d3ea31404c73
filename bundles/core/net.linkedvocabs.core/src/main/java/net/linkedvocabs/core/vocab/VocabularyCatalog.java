package net.linkedvocabs.core.vocab;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

import org.eclipse.rdf4j.common.net.ParsedIRI;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.model.util.Models;
import org.eclipse.rdf4j.model.vocabulary.OWL;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFParser;
import org.eclipse.rdf4j.rio.Rio;
import org.eclipse.rdf4j.rio.helpers.AbstractRDFHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The vocabularies known to the system together with their default
 * configuration.
 * <p>
 * The catalog is read from RDF documents which describe each vocabulary as an
 * instance of {@link CATALOG#TYPE_VOCABULARY}. Further documents may be
 * included by using <code>owl:imports</code>.
 */
public class VocabularyCatalog {
	public static final String LOCATION_PROPERTY = "net.linkedvocabs.catalog";

	public static final String DEFAULT_CATALOG_FILE = "vocabularies.ttl";

	public static final String CLASSPATH_SCHEME = "classpath:";

	private static final Logger log = LoggerFactory.getLogger(VocabularyCatalog.class);

	private final Map<String, VocabularyConfig> vocabularies = new LinkedHashMap<>();

	private final ClassLoader classLoader;

	public VocabularyCatalog() {
		this(VocabularyCatalog.class.getClassLoader());
	}

	public VocabularyCatalog(ClassLoader classLoader) {
		this.classLoader = classLoader;
	}

	/**
	 * Creates a catalog from the file specified by the system property
	 * {@link #LOCATION_PROPERTY} or, if it is not set, from the default
	 * catalog on the class path.
	 */
	public static VocabularyCatalog load() {
		VocabularyCatalog catalog = new VocabularyCatalog();
		String location = catalogLocation(System.getProperty(LOCATION_PROPERTY));
		catalog.load(location != null ? location : CLASSPATH_SCHEME + DEFAULT_CATALOG_FILE);
		return catalog;
	}

	private static String catalogLocation(String configLocation) {
		if (configLocation == null) {
			return null;
		}
		try {
			Path configPath = Paths.get(configLocation);
			if (Files.exists(configPath)) {
				return configPath.toAbsolutePath().toUri().toString();
			}
		} catch (InvalidPathException ipe) {
			// not a file path, try as URI
		}
		if (configLocation.startsWith(CLASSPATH_SCHEME) || isAbsoluteIri(configLocation)) {
			return configLocation;
		}
		log.error("Catalog file not found: {}", configLocation);
		return null;
	}

	private static boolean isAbsoluteIri(String location) {
		try {
			return ParsedIRI.create(location).isAbsolute();
		} catch (IllegalArgumentException e) {
			return false;
		}
	}

	/**
	 * Reads the vocabulary descriptions from the given locations and all
	 * documents imported by them.
	 * 
	 * @param locations
	 *            URLs of the catalog documents, resources on the class path
	 *            are denoted by the prefix {@link #CLASSPATH_SCHEME}
	 */
	public void load(String... locations) {
		final Queue<String> toLoad = new LinkedList<>();
		Collections.addAll(toLoad, locations);
		final Model model = new LinkedHashModel();
		Set<String> seen = new HashSet<>();
		while (!toLoad.isEmpty()) {
			String location = toLoad.remove();
			if (!seen.add(location)) {
				continue;
			}
			RDFFormat format = Rio.getParserFormatForFileName(location).orElse(RDFFormat.TURTLE);
			RDFParser parser = Rio.createParser(format);
			parser.setRDFHandler(new AbstractRDFHandler() {
				@Override
				public void handleStatement(Statement stmt) {
					model.add(stmt);
					if (OWL.IMPORTS.equals(stmt.getPredicate()) && stmt.getObject() instanceof IRI) {
						toLoad.add(stmt.getObject().stringValue());
					}
				}
			});
			try (InputStream in = new BufferedInputStream(openStream(location))) {
				parser.parse(in, baseUri(location));
				log.debug("Read vocabulary catalog {}", location);
			} catch (Exception e) {
				log.error("Unable to read vocabulary catalog {}", location, e);
			}
		}
		addAll(model);
	}

	private static String baseUri(String location) {
		return location.startsWith(CLASSPATH_SCHEME) ? "urn:" + location : location;
	}

	private InputStream openStream(String location) throws IOException {
		if (location.startsWith(CLASSPATH_SCHEME)) {
			String resource = location.substring(CLASSPATH_SCHEME.length());
			InputStream in = classLoader.getResourceAsStream(resource);
			if (in == null) {
				throw new FileNotFoundException("Class path resource not found: " + resource);
			}
			return in;
		}
		return new URL(location).openStream();
	}

	/**
	 * Adds all vocabularies that are described within <code>model</code>.
	 */
	public void addAll(Model model) {
		for (Resource subject : model.filter(null, RDF.TYPE, CATALOG.TYPE_VOCABULARY).subjects()) {
			try {
				add(toConfig(model, subject));
			} catch (IllegalArgumentException e) {
				log.error("Invalid vocabulary description {}: {}", subject, e.getMessage());
			}
		}
	}

	private VocabularyConfig toConfig(Model model, Resource subject) {
		Model description = model.filter(subject, null, null);
		String name = Models.objectLiteral(description.filter(subject, CATALOG.PROPERTY_NAME, null))
				.map(Literal::getLabel)
				.orElseThrow(() -> new IllegalArgumentException("missing " + CATALOG.PROPERTY_NAME));
		String prefix = Models.objectString(description.filter(subject, CATALOG.PROPERTY_PREFIX, null))
				.orElseThrow(() -> new IllegalArgumentException("missing " + CATALOG.PROPERTY_PREFIX));
		Optional<Boolean> strict = Models.objectLiteral(description.filter(subject, CATALOG.PROPERTY_STRICT, null))
				.map(Literal::booleanValue);
		Optional<String> termClass = Models
				.objectString(description.filter(subject, CATALOG.PROPERTY_TERMCLASS, null));
		List<String> terms = new ArrayList<>();
		for (Value term : description.filter(subject, CATALOG.PROPERTY_TERM, null).objects()) {
			terms.add(term.stringValue());
		}

		ITermSource termSource;
		if (termClass.isPresent()) {
			termSource = ConstantsTermSource.forClassName(termClass.get(), prefix, classLoader);
		} else if (!terms.isEmpty()) {
			termSource = new TermSet(prefix, terms, strict.orElse(true));
		} else {
			termSource = new TermSet(prefix, terms, false);
		}
		IRI source = Models.objectIRI(description.filter(subject, CATALOG.PROPERTY_SOURCE, null)).orElse(null);
		boolean fetch = Models.objectLiteral(description.filter(subject, CATALOG.PROPERTY_FETCH, null))
				.map(Literal::booleanValue).orElse(true);
		return new VocabularyConfig(name, prefix, termSource, strict.orElse(termSource.isStrict()), source,
				fetch);
	}

	/**
	 * Adds or replaces the vocabulary with the name of <code>config</code>.
	 */
	public void add(VocabularyConfig config) {
		VocabularyConfig replaced = vocabularies.put(config.getName(), config);
		if (replaced != null) {
			log.info("Replaced vocabulary {} with {}", replaced, config);
		}
	}

	public boolean contains(String name) {
		return name != null && vocabularies.containsKey(name);
	}

	public Optional<VocabularyConfig> get(String name) {
		return Optional.ofNullable(name == null ? null : vocabularies.get(name));
	}

	public Collection<VocabularyConfig> getVocabularies() {
		return Collections.unmodifiableCollection(vocabularies.values());
	}
}
