package com.apidocs.porter.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Thrown once all port options have been checked, listing every invalid one.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super("Invalid port options (" + errors.size() + "):" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}
}
