package com.enterprise.querybuilder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryBuilderApplication.class, args);
    }
}
