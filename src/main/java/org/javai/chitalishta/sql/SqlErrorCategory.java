package org.javai.chitalishta.sql;

/**
 * Why {@link SqlValidator} rejected a statement. Callers branch on the category, never on the
 * message text.
 */
public enum SqlErrorCategory {
	NONE,
	EMPTY_QUERY,
	DANGEROUS_KEYWORD,
	DISALLOWED_START,
	INJECTION_SEMICOLONS,
	INJECTION_COMMENTS,
	INVALID_COLUMN
}
