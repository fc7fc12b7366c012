package io.intellixity.relata.persistence.query;

/**
 * A filter, sort or read spec names a field or relation the schema does not have, or is otherwise malformed.
 * <p>
 * Thrown by the translators before any storage call; backends throw it again when a statement slips through.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  /** {@code owner} is a model or join table name, optionally followed by context ("User", "sort of User"). */
  public static QueryValidationException unknownField(String field, String owner) {
    return new QueryValidationException("Unknown field '" + field + "' on " + owner);
  }

  public static QueryValidationException unknownRelation(String relation, String model) {
    return new QueryValidationException("Unknown relation '" + relation + "' on model " + model);
  }
}
