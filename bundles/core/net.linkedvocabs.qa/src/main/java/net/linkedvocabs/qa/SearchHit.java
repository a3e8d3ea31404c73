package net.linkedvocabs.qa;

import java.util.Objects;

/**
 * A search result pairing a subject identifier with a display label.
 */
public final class SearchHit {
	private final String id;
	private final String label;

	public SearchHit(String id, String label) {
		this.id = Objects.requireNonNull(id);
		this.label = Objects.requireNonNull(label);
	}

	public String getId() {
		return id;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SearchHit)) {
			return false;
		}
		SearchHit other = (SearchHit) obj;
		return id.equals(other.id) && label.equals(other.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, label);
	}

	@Override
	public String toString() {
		return "{id=" + id + ", label=" + label + "}";
	}
}
