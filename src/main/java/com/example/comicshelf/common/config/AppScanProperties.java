package com.example.comicshelf.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    /**
     * Worker count for the phase 2 archive processing pool.
     */
    private int workerThreads = 4;

    /**
     * Pending comics fetched and applied per processing round.
     */
    private int processBatchSize = 100;

    /**
     * Rows per multi-row insert during sync.
     */
    private int insertBatchSize = 500;

    /**
     * Files between progress callbacks and cancel checks during the walk.
     */
    private int progressInterval = 50;

    private int maxErrors = 50;

    private int maxErrorLength = 500;

    private boolean incrementalEnabled = false;

    private String incrementalCron = "0 0 3 * * ?";
}
