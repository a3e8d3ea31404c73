package net.linkedvocabs.qa.store;

import java.util.List;

/**
 * Read access to the store holding the vocabulary data.
 */
public interface ITripleStore {
	/**
	 * How literal values are matched against the search text.
	 */
	enum MatchMode {
		STARTS_WITH, CONTAINS
	}

	/**
	 * Returns all statements whose object is a literal that, lower-cased,
	 * starts with or contains the lower-cased <code>text</code>.
	 * 
	 * @param text
	 *            The search text
	 * @param mode
	 *            The match mode
	 * @return The matching statements in store order
	 * @throws StoreUnavailableException
	 *             If the store can not be queried
	 */
	List<QuerySolution> findByLiteral(String text, MatchMode mode);
}
