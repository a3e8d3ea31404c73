package net.linkedvocabs.core;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import net.linkedvocabs.core.label.LabelSelector;
import net.linkedvocabs.core.vocab.VocabularyCatalog;

/**
 * Provides the system-wide {@link VocabularyCatalog}.
 * <p>
 * The catalog is read from the location given by the system property
 * {@link VocabularyCatalog#LOCATION_PROPERTY} or the default catalog unless
 * an explicit catalog is passed to the module. The bound {@link LabelSelector}
 * prefers the given languages, {@link LabelSelector#DEFAULT_LANGUAGES} by
 * default.
 */
public class VocabularyModule extends AbstractModule {
	private final VocabularyCatalog catalog;

	private final List<String> preferredLanguages;

	public VocabularyModule() {
		this(null);
	}

	public VocabularyModule(VocabularyCatalog catalog) {
		this(catalog, LabelSelector.DEFAULT_LANGUAGES);
	}

	public VocabularyModule(VocabularyCatalog catalog, List<String> preferredLanguages) {
		this.catalog = catalog;
		this.preferredLanguages = ImmutableList
				.copyOf(Preconditions.checkNotNull(preferredLanguages, "preferredLanguages"));
	}

	@Override
	protected void configure() {
		bind(LabelSelector.class).toInstance(new LabelSelector(preferredLanguages));
	}

	@Provides
	@Singleton
	VocabularyCatalog provideCatalog() {
		return catalog != null ? catalog : VocabularyCatalog.load();
	}
}
