package org.javai.chitalishta.sql;

/**
 * Thrown when a schema catalog definition cannot be read or is malformed.
 */
public class SchemaCatalogLoadException extends RuntimeException {

	public SchemaCatalogLoadException(String message) {
		super(message);
	}

	public SchemaCatalogLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
