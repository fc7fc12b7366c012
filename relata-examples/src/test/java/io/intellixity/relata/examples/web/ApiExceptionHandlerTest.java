package io.intellixity.relata.examples.web;

import io.intellixity.relata.persistence.error.*;
import io.intellixity.relata.persistence.plan.DirectivePath;
import io.intellixity.relata.persistence.query.QueryValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ApiExceptionHandlerTest {
  private static final DirectivePath USER = DirectivePath.root("User");

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void abortedWrites_areMappedByCause() {
    assertEquals(409, status(handler.aborted(aborted(new UniqueConstraintViolationException("duplicate email", USER)))));
    assertEquals(404, status(handler.aborted(aborted(new UniqueTargetNotFoundException("no Category", USER)))));
    assertEquals(422, status(handler.aborted(aborted(new CardinalityViolationException("already linked", USER)))));
    assertEquals(500, status(handler.aborted(aborted(new IllegalStateException("connection reset")))));
  }

  @Test
  void validationFailures_areBadRequests() {
    ResponseEntity<Map<String, Object>> r = handler.invalid(new DirectiveValidationException("Missing 'where'", USER));

    assertEquals(400, status(r));
    assertEquals("DirectiveValidationException", r.getBody().get("error"));
    assertEquals("User", r.getBody().get("path"));
    assertEquals(400, status(handler.invalid(new QueryValidationException("Unknown field 'x'"))));
    assertFalse(handler.invalid(new QueryValidationException("Unknown field 'x'")).getBody().containsKey("path"));
  }

  @Test
  void chainAndCycleErrors_areUnprocessable() {
    assertEquals(422, status(handler.unprocessable(new ChainCardinalityException("one() on list", USER))));
    assertEquals(422, status(handler.unprocessable(new ConstraintCycleException("required cycle", USER))));
  }

  private static TransactionAbortedException aborted(Throwable cause) {
    return new TransactionAbortedException(USER, cause);
  }

  private static int status(ResponseEntity<?> r) {
    return r.getStatusCode().value();
  }
}
