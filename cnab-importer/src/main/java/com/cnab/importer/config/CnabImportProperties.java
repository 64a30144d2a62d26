package com.cnab.importer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code cnab.import} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "cnab.import")
public class CnabImportProperties {

    /** Character set of uploaded CNAB files. */
    private String encoding = "UTF-8";

    /** File imported by {@code cnabImportJob} when no {@code inputFile} parameter is given. */
    private String inputFile = "classpath:data/CNAB.txt";

    /** Identity recorded for job-triggered imports that do not name a user. */
    private JobUser jobUser = new JobUser();

    @Getter
    @Setter
    public static class JobUser {
        private long id = 1L;
        private String name = "batch";
    }
}
