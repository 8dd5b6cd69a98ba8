package com.apidocs.porter.porting;

/**
 * Thrown when the operator chooses to stop the run from a name mismatch prompt.
 * Nothing is saved once this is thrown.
 */
public class PortAbortedException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public PortAbortedException(String message) {
		super(message);
	}
}
