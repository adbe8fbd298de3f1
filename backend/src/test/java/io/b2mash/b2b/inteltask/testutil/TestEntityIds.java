package io.b2mash.b2b.inteltask.testutil;

import java.util.UUID;

/** Assigns ids to entities built in unit tests, where no persistence context generates them. */
public final class TestEntityIds {

  private TestEntityIds() {}

  public static <T> T withId(T entity, UUID id) {
    try {
      var idField = entity.getClass().getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(entity, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set id on " + entity.getClass().getSimpleName(), e);
    }
    return entity;
  }

  public static <T> T withRandomId(T entity) {
    return withId(entity, UUID.randomUUID());
  }
}
