package com.libris;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * @author libris
 * @since 2024-11-02
 */
@SpringBootApplication
@EnableAsync
@MapperScan("com.libris.mapper")
public class LibrisApplication {

	public static void main(String[] args) {
		SpringApplication.run(LibrisApplication.class, args);
	}

}
