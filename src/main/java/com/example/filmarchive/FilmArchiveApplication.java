package com.example.filmarchive;

import com.example.filmarchive.common.config.AppDuplicateProperties;
import com.example.filmarchive.common.config.AppEnhanceProperties;
import com.example.filmarchive.common.config.AppPipelineProperties;
import com.example.filmarchive.common.config.AppTaggingProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.filmarchive.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppPipelineProperties.class,
        AppEnhanceProperties.class,
        AppDuplicateProperties.class,
        AppTaggingProperties.class
})
public class FilmArchiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilmArchiveApplication.class, args);
    }
}
