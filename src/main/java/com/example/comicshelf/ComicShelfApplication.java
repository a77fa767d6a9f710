package com.example.comicshelf;

import com.example.comicshelf.common.config.AppLibraryProperties;
import com.example.comicshelf.common.config.AppNsfwProperties;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.config.AppThumbnailProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.comicshelf.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppScanProperties.class,
        AppThumbnailProperties.class,
        AppNsfwProperties.class
})
public class ComicShelfApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComicShelfApplication.class, args);
    }
}
