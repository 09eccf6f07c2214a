package io.github.suppierk.eventsourcing.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CommandRejectedExceptionTest {
  @Test
  void all_exception_constructors_must_be_present() {
    assertDoesNotThrow(() -> new CommandRejectedException());
    assertDoesNotThrow(() -> new CommandRejectedException("message"));
    assertDoesNotThrow(() -> new CommandRejectedException("message", new IllegalStateException()));
    assertDoesNotThrow(() -> new CommandRejectedException(new IllegalStateException()));
  }

  @Test
  void must_have_unprocessable_entity_http_status_code() {
    assertEquals(422, new CommandRejectedException().getStatusCode());
  }
}
