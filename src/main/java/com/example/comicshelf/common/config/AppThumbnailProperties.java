package com.example.comicshelf.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.thumbnail")
public class AppThumbnailProperties {

    private String dir = "./data/thumbnails";

    private int width = 225;

    private int height = 350;

    /**
     * Encoder quality, 1-100.
     */
    private int quality = 70;

    /**
     * jpeg, png, webp or best. best keeps the smaller of jpeg and png.
     */
    private String format = "webp";

    /**
     * Wall-clock limit for on-demand cover generation before a placeholder is served.
     */
    private long onDemandTimeoutMs = 10000L;

    private int onDemandThreads = 2;
}
