package com.biography;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 传记编译系统主应用类
 *
 * @author Biography Compiler
 * @version 1.0.0
 */
@SpringBootApplication
@MapperScan("com.biography.repository")
@EnableScheduling
public class BiographyCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiographyCompilerApplication.class, args);
        System.out.println("🚀 传记编译系统启动成功");
    }
}
