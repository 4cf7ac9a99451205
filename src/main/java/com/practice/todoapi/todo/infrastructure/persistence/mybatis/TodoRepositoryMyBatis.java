package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import static com.practice.todoapi.shared.persistence.DataAccessTranslator.translate;

import java.util.List;
import java.util.Optional;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.practice.todoapi.shared.repository.EntityNotFoundException;
import com.practice.todoapi.todo.domain.model.CreateTodo;
import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;
import com.practice.todoapi.todo.domain.repository.TodoRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@Profile("database")
@RequiredArgsConstructor
public class TodoRepositoryMyBatis implements TodoRepository {

    private final TodoMapper todoMapper;

    @Override
    public Todo create(CreateTodo payload) {
        Todo todo = new Todo(null, payload.getText());
        translate("insert todo", () -> todoMapper.insert(todo));
        log.debug("Created todo {}", todo.getId());
        return todo;
    }

    @Override
    public Optional<Todo> find(Long id) {
        return translate("select todo", () -> Optional.ofNullable(todoMapper.selectById(id)));
    }

    @Override
    public List<Todo> all() {
        return translate("select todos", todoMapper::selectAll);
    }

    @Override
    @Transactional
    public Todo update(Long id, UpdateTodo payload) {
        if (!payload.isEmpty()) {
            int updated = translate("update todo", () -> todoMapper.update(id, payload));
            if (updated == 0) {
                throw new EntityNotFoundException(id);
            }
            log.debug("Updated todo {}", id);
        }
        return find(id).orElseThrow(() -> new EntityNotFoundException(id));
    }

    @Override
    public void delete(Long id) {
        int deleted = translate("delete todo", () -> todoMapper.deleteById(id));
        if (deleted == 0) {
            throw new EntityNotFoundException(id);
        }
        log.debug("Deleted todo {}", id);
    }
}
