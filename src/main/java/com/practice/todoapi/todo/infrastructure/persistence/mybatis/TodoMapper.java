package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import java.util.List;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import com.practice.todoapi.todo.domain.model.Todo;
import com.practice.todoapi.todo.domain.model.UpdateTodo;

@Mapper
public interface TodoMapper {
    Todo selectById(@Param("id") Long id);
    List<Todo> selectAll();
    int insert(Todo todo);
    int update(@Param("id") Long id, @Param("payload") UpdateTodo payload);
    int deleteById(@Param("id") Long id);
}
