package com.practice.todoapi.label.infrastructure.persistence.memory;

import java.util.List;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import com.practice.todoapi.label.domain.model.CreateLabel;
import com.practice.todoapi.label.domain.model.Label;
import com.practice.todoapi.label.domain.repository.LabelRepository;
import com.practice.todoapi.shared.memory.InMemoryStore;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@Profile("memory")
public class LabelRepositoryInMemory implements LabelRepository {

    private final InMemoryStore<Label> store = new InMemoryStore<>(Label::copy);

    @Override
    public Label create(CreateLabel payload) {
        Label label = store.insert(id -> new Label(id, payload.getName()));
        log.debug("Created label {}", label.getId());
        return label;
    }

    @Override
    public List<Label> all() {
        return store.values();
    }

    @Override
    public void delete(Long id) {
        store.remove(id);
        log.debug("Deleted label {}", id);
    }
}
