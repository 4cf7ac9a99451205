package com.practice.todoapi.label.infrastructure.persistence.mybatis;

import static com.practice.todoapi.shared.persistence.DataAccessTranslator.translate;

import java.util.List;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import com.practice.todoapi.label.domain.model.CreateLabel;
import com.practice.todoapi.label.domain.model.Label;
import com.practice.todoapi.label.domain.repository.LabelRepository;
import com.practice.todoapi.shared.repository.EntityNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@Profile("database")
@RequiredArgsConstructor
public class LabelRepositoryMyBatis implements LabelRepository {

    private final LabelMapper labelMapper;

    @Override
    public Label create(CreateLabel payload) {
        Label label = new Label(null, payload.getName());
        translate("insert label", () -> labelMapper.insert(label));
        log.debug("Created label {}", label.getId());
        return label;
    }

    @Override
    public List<Label> all() {
        return translate("select labels", labelMapper::selectAll);
    }

    @Override
    public void delete(Long id) {
        int deleted = translate("delete label", () -> labelMapper.deleteById(id));
        if (deleted == 0) {
            throw new EntityNotFoundException(id);
        }
        log.debug("Deleted label {}", id);
    }
}
