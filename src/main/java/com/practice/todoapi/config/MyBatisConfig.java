package com.practice.todoapi.config;

import org.apache.ibatis.annotations.Mapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

// only the database backend has a SqlSessionFactory
@Configuration
@Profile("database")
@MapperScan(basePackages = "com.practice.todoapi", annotationClass = Mapper.class)
public class MyBatisConfig {
}
