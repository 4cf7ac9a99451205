package com.practice.todoapi.label.infrastructure.persistence.mybatis;

import java.util.List;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import com.practice.todoapi.label.domain.model.Label;

@Mapper
public interface LabelMapper {
    List<Label> selectAll();
    int insert(Label label);
    int deleteById(@Param("id") Long id);
}
