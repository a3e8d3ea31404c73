package net.linkedvocabs.core.record;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.rdf4j.model.Resource;

/**
 * Checks that controlled records use terms of their vocabularies.
 */
public class AuthorityValidator {
	public List<String> validate(ControlledResource record) {
		List<String> errors = new ArrayList<>();
		if (!record.getSubject().isBNode() && !record.inVocab()) {
			errors.add(message(record.getSubject()));
		}
		for (List<ControlledResource> values : record.getLinks().values()) {
			for (ControlledResource value : values) {
				if (!value.inVocab()) {
					errors.add(message(value.getSubject()));
				}
			}
		}
		return errors;
	}

	protected String message(Resource subject) {
		return subject.stringValue() + " is not a term in a controlled vocabulary.";
	}
}
