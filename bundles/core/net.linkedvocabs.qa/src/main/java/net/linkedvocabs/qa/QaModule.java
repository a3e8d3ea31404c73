package net.linkedvocabs.qa;

import org.eclipse.rdf4j.repository.Repository;

import com.google.common.base.Preconditions;
import com.google.inject.AbstractModule;

import net.linkedvocabs.qa.load.VocabularyLoader;
import net.linkedvocabs.qa.store.ITripleStore;
import net.linkedvocabs.qa.store.RepositoryTripleStore;

/**
 * Binds the store access and vocabulary loading to a {@link Repository}.
 */
public class QaModule extends AbstractModule {
	private final Repository repository;

	public QaModule(Repository repository) {
		this.repository = Preconditions.checkNotNull(repository, "repository");
	}

	@Override
	protected void configure() {
		bind(Repository.class).toInstance(repository);
		bind(ITripleStore.class).to(RepositoryTripleStore.class);
		bind(VocabularyLoader.class);
	}
}
