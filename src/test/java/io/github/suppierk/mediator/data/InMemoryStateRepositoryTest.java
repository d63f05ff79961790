package io.github.suppierk.mediator.data;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.Customer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryStateRepositoryTest {
  InMemoryStateRepository<Customer, String> repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryStateRepository<>(Customer::copy);
  }

  @Test
  void when_copier_is_null_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class, () -> new InMemoryStateRepository<Customer, String>(null));
  }

  @Nested
  class Saving {
    @Test
    void saved_entity_must_be_readable_as_a_separate_copy_with_its_version() {
      final var customer = new Customer("c-1", "Alice");

      repository.save(customer);

      assertEquals(1, customer.getVersion());

      final var loaded = repository.getById("c-1").orElseThrow();
      assertNotSame(customer, loaded);
      assertEquals("Alice", loaded.getName());
      assertEquals(1, loaded.getVersion());
      assertTrue(repository.contains("c-1"));
    }

    @Test
    void each_save_must_increment_the_state_version() {
      final var customer = new Customer("c-1", "Alice");

      repository.save(customer);
      customer.rename("Alicia");
      repository.save(customer);

      assertEquals(2, customer.getVersion());
      assertEquals("Alicia", repository.getById("c-1").orElseThrow().getName());
    }

    @Test
    void saving_stale_state_must_conflict_and_keep_the_stored_state() {
      repository.save(new Customer("c-1", "Alice"));

      final var first = repository.getById("c-1").orElseThrow();
      final var second = repository.getById("c-1").orElseThrow();

      first.rename("Alicia");
      repository.save(first);

      second.rename("Ally");
      final var conflict =
          assertThrows(ConcurrencyConflictException.class, () -> repository.save(second));

      assertEquals(1, conflict.getExpectedVersion());
      assertEquals(2, conflict.getActualVersion());
      assertEquals(1, second.getVersion());
      assertEquals("Alicia", repository.getById("c-1").orElseThrow().getName());
    }

    @Test
    void creating_an_already_existing_entity_must_conflict() {
      repository.save(new Customer("c-1", "Alice"));

      assertThrows(
          ConcurrencyConflictException.class, () -> repository.save(new Customer("c-1", "Bob")));
    }

    @Test
    void add_outside_of_a_unit_of_work_must_save_immediately() {
      repository.add(new Customer("c-1", "Alice"));

      assertTrue(repository.contains("c-1"));
    }

    @Test
    void add_inside_a_unit_of_work_must_wait_for_the_commit() {
      try (UnitOfWork.Scope scope = UnitOfWork.begin()) {
        repository.add(new Customer("c-1", "Alice"));

        assertFalse(repository.contains("c-1"));

        scope.getUnitOfWork().persist();
      }

      assertTrue(repository.contains("c-1"));
    }

    @Test
    void loaded_entity_must_be_saved_at_commit_only_when_changed() {
      repository.save(new Customer("c-1", "Alice"));
      repository.save(new Customer("c-2", "Bob"));

      try (UnitOfWork.Scope scope = UnitOfWork.begin()) {
        final var renamed = repository.getById("c-1").orElseThrow();
        final var untouched = repository.getById("c-2").orElseThrow();
        renamed.rename("Alicia");

        scope.getUnitOfWork().persist();

        assertEquals(List.of(renamed, untouched), scope.getUnitOfWork().getEnlisted());
      }

      final var stored = repository.getById("c-1").orElseThrow();
      assertEquals("Alicia", stored.getName());
      assertEquals(2, stored.getVersion());
      assertEquals(1, repository.getById("c-2").orElseThrow().getVersion());
    }

    @Test
    void version_verification_must_compare_with_the_stored_version() {
      repository.save(new Customer("c-1", "Alice"));
      final var stale = repository.getById("c-1").orElseThrow();
      final var fresh = repository.getById("c-1").orElseThrow();
      fresh.rename("Bob");
      repository.save(fresh);

      assertDoesNotThrow(() -> repository.verifyVersion(fresh));
      assertDoesNotThrow(() -> repository.verifyVersion(new Customer("c-2", "Carol")));
      final var exception =
          assertThrows(ConcurrencyConflictException.class, () -> repository.verifyVersion(stale));
      assertEquals(1, exception.getExpectedVersion());
      assertEquals(2, exception.getActualVersion());
      assertThrows(IllegalArgumentException.class, () -> repository.verifyVersion(null));
    }
  }

  @Nested
  class Searching {
    @Test
    void find_must_return_matching_copies() {
      repository.save(new Customer("c-1", "Alice"));
      repository.save(new Customer("c-2", "Bob"));
      repository.save(new Customer("c-3", "Anna"));

      final var found = repository.find(customer -> customer.getName().startsWith("A"));

      assertEquals(2, found.size());
      assertTrue(found.stream().allMatch(customer -> customer.getVersion() == 1));
      assertThrows(IllegalArgumentException.class, () -> repository.find(null));
    }

    @Test
    void found_entities_must_be_saved_at_commit_when_changed() {
      repository.save(new Customer("c-1", "Alice"));

      try (UnitOfWork.Scope scope = UnitOfWork.begin()) {
        repository.find(customer -> true).forEach(customer -> customer.rename("Alicia"));

        scope.getUnitOfWork().persist();
      }

      assertEquals("Alicia", repository.getById("c-1").orElseThrow().getName());
    }

    @Test
    void clear_must_remove_everything() {
      repository.save(new Customer("c-1", "Alice"));

      repository.clear();

      assertTrue(repository.find(customer -> true).isEmpty());
    }
  }

  @Nested
  class Deleting {
    @Test
    void delete_must_remove_the_entity_and_ignore_missing_ones() {
      repository.save(new Customer("c-1", "Alice"));

      repository.delete("c-1");

      assertFalse(repository.contains("c-1"));
      assertDoesNotThrow(() -> repository.delete("c-1"));
      assertThrows(IllegalArgumentException.class, () -> repository.delete(null));
    }
  }
}
