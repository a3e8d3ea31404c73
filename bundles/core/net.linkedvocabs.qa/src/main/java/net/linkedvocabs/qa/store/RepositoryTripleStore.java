package net.linkedvocabs.qa.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.query.BindingSet;
import org.eclipse.rdf4j.query.MalformedQueryException;
import org.eclipse.rdf4j.query.QueryEvaluationException;
import org.eclipse.rdf4j.query.QueryLanguage;
import org.eclipse.rdf4j.query.TupleQuery;
import org.eclipse.rdf4j.query.TupleQueryResult;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;

/**
 * {@link ITripleStore} on top of an RDF4J {@link Repository} using SPARQL.
 */
public class RepositoryTripleStore implements ITripleStore {
	protected static final ValueFactory vf = SimpleValueFactory.getInstance();

	private static final Logger log = LoggerFactory.getLogger(RepositoryTripleStore.class);

	static final String STARTS_WITH_QUERY = "SELECT DISTINCT ?s ?p ?o WHERE { ?s ?p ?o . " //
			+ "FILTER(isLiteral(?o) && strstarts(lcase(str(?o)), ?q)) }";

	static final String CONTAINS_QUERY = "SELECT DISTINCT ?s ?p ?o WHERE { ?s ?p ?o . " //
			+ "FILTER(isLiteral(?o) && contains(lcase(str(?o)), ?q)) }";

	protected final Repository repository;

	@Inject
	public RepositoryTripleStore(Repository repository) {
		this.repository = Preconditions.checkNotNull(repository, "repository");
	}

	@Override
	public List<QuerySolution> findByLiteral(String text, MatchMode mode) {
		String q = text.toLowerCase(Locale.ROOT);
		String queryString = mode == MatchMode.STARTS_WITH ? STARTS_WITH_QUERY : CONTAINS_QUERY;
		try (RepositoryConnection conn = repository.getConnection()) {
			TupleQuery query = conn.prepareTupleQuery(QueryLanguage.SPARQL, queryString);
			query.setBinding("q", vf.createLiteral(q));
			List<QuerySolution> solutions = new ArrayList<>();
			try (TupleQueryResult result = query.evaluate()) {
				while (result.hasNext()) {
					BindingSet bindings = result.next();
					solutions.add(new QuerySolution((Resource) bindings.getValue("s"), (IRI) bindings.getValue("p"),
							bindings.getValue("o")));
				}
			}
			log.trace("{} search for '{}' returned {} solutions", mode, q, solutions.size());
			return solutions;
		} catch (RepositoryException | QueryEvaluationException | MalformedQueryException e) {
			throw new StoreUnavailableException("Query for '" + text + "' failed", e);
		}
	}

	public Repository getRepository() {
		return repository;
	}
}
