package com.practice.todoapi.label.infrastructure.persistence.mybatis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import com.practice.todoapi.label.domain.model.CreateLabel;
import com.practice.todoapi.label.domain.model.Label;
import com.practice.todoapi.label.domain.repository.LabelRepository;
import com.practice.todoapi.shared.repository.EntityNotFoundException;

@SpringBootTest
@Transactional
@ActiveProfiles({"database", "test"})
class LabelRepositoryMyBatisTest {

    @Autowired
    private LabelRepository repository;

    @Test
    void create_ThenAll_ShouldContainLabel() {
        Label label = repository.create(new CreateLabel("work"));

        assertThat(label.getId()).isNotNull();
        assertThat(repository.all()).contains(label);
    }

    @Test
    void delete_ShouldRemoveLabel() {
        Label label = repository.create(new CreateLabel("home"));

        repository.delete(label.getId());

        assertThat(repository.all()).doesNotContain(label);
    }

    @Test
    void delete_WithUnknownId_ShouldThrowNotFound() {
        assertThatThrownBy(() -> repository.delete(-1L))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
