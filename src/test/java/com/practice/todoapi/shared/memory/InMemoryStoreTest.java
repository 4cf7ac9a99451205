package com.practice.todoapi.shared.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.practice.todoapi.shared.repository.EntityNotFoundException;
import com.practice.todoapi.todo.domain.model.Todo;

class InMemoryStoreTest {

    private final InMemoryStore<Todo> store = new InMemoryStore<>(Todo::copy);

    @Test
    void insert_ShouldAssignIdsStartingAtOne() {
        Todo first = store.insert(id -> new Todo(id, "first"));
        Todo second = store.insert(id -> new Todo(id, "second"));

        assertThat(first.getId()).isEqualTo(1L);
        assertThat(second.getId()).isEqualTo(2L);
    }

    @Test
    void insert_AfterRemove_ShouldNotReuseId() {
        store.insert(id -> new Todo(id, "first"));
        Todo second = store.insert(id -> new Todo(id, "second"));
        store.remove(second.getId());

        Todo third = store.insert(id -> new Todo(id, "third"));

        assertThat(third.getId()).isEqualTo(3L);
    }

    @Test
    void values_ShouldKeepInsertionOrder() {
        store.insert(id -> new Todo(id, "a"));
        store.insert(id -> new Todo(id, "b"));
        store.insert(id -> new Todo(id, "c"));

        assertThat(store.values()).extracting(Todo::getText).containsExactly("a", "b", "c");
    }

    @Test
    void returnedEntities_ShouldBeCopies() {
        Todo created = store.insert(id -> new Todo(id, "original"));
        created.setText("changed by caller");
        store.get(created.getId()).orElseThrow().setCompleted(true);
        store.values().get(0).setText("changed again");

        Todo stored = store.get(created.getId()).orElseThrow();
        assertThat(stored.getText()).isEqualTo("original");
        assertThat(stored.isCompleted()).isFalse();
    }

    @Test
    void get_WithUnknownId_ShouldReturnEmpty() {
        assertThat(store.get(42)).isEmpty();
    }

    @Test
    void modify_WithUnknownId_ShouldThrowNotFound() {
        assertThatThrownBy(() -> store.modify(7, todo -> todo.setCompleted(true)))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessage("NotFound, id is 7");
    }

    @Test
    void remove_WithUnknownId_ShouldThrowNotFound() {
        assertThatThrownBy(() -> store.remove(7))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void concurrentInserts_ShouldNeverShareAnId() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<List<Long>>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.insert(id -> new Todo(id, "concurrent")).getId());
                    }
                    return ids;
                });
            }
            List<Long> issued = new ArrayList<>();
            for (Future<List<Long>> future : executor.invokeAll(tasks)) {
                issued.addAll(future.get());
            }

            assertThat(issued).hasSize(threads * perThread).doesNotHaveDuplicates();
            assertThat(store.values()).hasSize(threads * perThread);
        } finally {
            executor.shutdownNow();
        }
    }
}
