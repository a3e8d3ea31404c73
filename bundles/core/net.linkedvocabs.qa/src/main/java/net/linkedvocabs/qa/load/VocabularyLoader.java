package net.linkedvocabs.qa.load;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.RepositoryException;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RDFParser;
import org.eclipse.rdf4j.rio.Rio;
import org.eclipse.rdf4j.rio.UnsupportedRDFormatException;
import org.eclipse.rdf4j.rio.helpers.StatementCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;

import net.linkedvocabs.core.vocab.VocabularyCatalog;
import net.linkedvocabs.core.vocab.VocabularyConfig;
import net.linkedvocabs.core.vocab.VocabularyRegistry;
import net.linkedvocabs.qa.store.StoreUnavailableException;

/**
 * Loads the source documents of vocabularies into a repository.
 * <p>
 * Each document is stored in a named graph identified by its source IRI.
 * Reloading a vocabulary replaces the contents of this graph.
 */
public class VocabularyLoader {
	static final String ACCEPT = "text/turtle, application/rdf+xml;q=0.9, application/n-triples;q=0.8, */*;q=0.1";

	private static final Logger log = LoggerFactory.getLogger(VocabularyLoader.class);

	protected final Repository repository;

	@Inject
	public VocabularyLoader(Repository repository) {
		this.repository = Preconditions.checkNotNull(repository, "repository");
	}

	/**
	 * Loads all registered vocabularies that have a source document which
	 * should be fetched.
	 * 
	 * @return The number of loaded statements
	 */
	public int loadVocabularies(VocabularyRegistry registry) {
		int count = 0;
		for (VocabularyConfig config : registry.getVocabularies()) {
			count += loadVocabulary(config);
		}
		return count;
	}

	/**
	 * Loads the registered vocabulary <code>name</code>.
	 * 
	 * @return The number of loaded statements
	 * @throws IllegalArgumentException
	 *             If the vocabulary is not registered
	 */
	public int loadVocabulary(VocabularyRegistry registry, String name) {
		return loadVocabulary(registry.get(name)
				.orElseThrow(() -> new IllegalArgumentException("Vocabulary not registered: " + name)));
	}

	/**
	 * Loads the source document of a vocabulary.
	 * 
	 * @return The number of loaded statements, 0 if the vocabulary has no
	 *         source or should not be fetched
	 */
	public int loadVocabulary(VocabularyConfig config) {
		Optional<IRI> source = config.getSource();
		if (!source.isPresent() || !config.isFetch()) {
			log.debug("Skipping vocabulary {}", config.getName());
			return 0;
		}
		List<Statement> statements = acquireStatements(source.get());
		try (RepositoryConnection conn = repository.getConnection()) {
			conn.begin();
			try {
				conn.clear(source.get());
				conn.add(statements, source.get());
				conn.commit();
			} finally {
				if (conn.isActive()) {
					conn.rollback();
				}
			}
		} catch (RepositoryException e) {
			throw new StoreUnavailableException("Unable to store vocabulary " + config.getName(), e);
		}
		log.info("Loaded {} statements of vocabulary {} from {}", statements.size(), config.getName(),
				source.get());
		return statements.size();
	}

	protected List<Statement> acquireStatements(IRI source) {
		String location = source.stringValue();
		try {
			if (location.startsWith("http://") || location.startsWith("https://")) {
				return acquireRemoteStatements(location);
			}
			try (InputStream in = new BufferedInputStream(openStream(location))) {
				return parse(in, location, formatForFileName(location));
			}
		} catch (IOException | RDFParseException | UnsupportedRDFormatException e) {
			throw new VocabularyLoadException("Unable to load vocabulary from " + location, e);
		}
	}

	protected List<Statement> acquireRemoteStatements(String location) throws IOException {
		HttpGet request = new HttpGet(location);
		request.setHeader(HttpHeaders.ACCEPT, ACCEPT);
		try (CloseableHttpClient httpClient = HttpClients.createDefault();
				CloseableHttpResponse response = httpClient.execute(request)) {
			int status = response.getStatusLine().getStatusCode();
			log.debug("GET {} status={} content-type={}", location, status,
					response.getLastHeader(HttpHeaders.CONTENT_TYPE));
			HttpEntity entity = response.getEntity();
			if (status >= 300 || entity == null) {
				throw new VocabularyLoadException("Unable to fetch " + location + ": HTTP status " + status);
			}
			RDFFormat format = formatForContentType(response.getLastHeader(HttpHeaders.CONTENT_TYPE))
					.orElseGet(() -> formatForFileName(location));
			try (InputStream in = entity.getContent()) {
				return parse(in, location, format);
			}
		}
	}

	protected List<Statement> parse(InputStream in, String baseUri, RDFFormat format) throws IOException {
		List<Statement> statements = new ArrayList<>();
		RDFParser parser = Rio.createParser(format);
		parser.setRDFHandler(new StatementCollector(statements));
		parser.parse(in, baseUri);
		return statements;
	}

	private InputStream openStream(String location) throws IOException {
		if (location.startsWith(VocabularyCatalog.CLASSPATH_SCHEME)) {
			String resource = location.substring(VocabularyCatalog.CLASSPATH_SCHEME.length());
			InputStream in = getClass().getClassLoader().getResourceAsStream(resource);
			if (in == null) {
				throw new FileNotFoundException("Class path resource not found: " + resource);
			}
			return in;
		}
		return new URL(location).openStream();
	}

	private static Optional<RDFFormat> formatForContentType(Header contentType) {
		if (contentType == null) {
			return Optional.empty();
		}
		String mimeType = contentType.getValue().split(";")[0].trim();
		return Rio.getParserFormatForMIMEType(mimeType);
	}

	private static RDFFormat formatForFileName(String location) {
		return Rio.getParserFormatForFileName(location).orElse(RDFFormat.RDFXML);
	}
}
