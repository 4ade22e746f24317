package com.meshnet.linkwatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code linkwatch.*} tree of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "linkwatch")
public class LinkwatchProperties {

    @Valid
    private Store store = new Store();

    @Valid
    private Links links = new Links();

    @Valid
    private Topology topology = new Topology();

    /**
     * MongoDB holding the inventory (layers, nodes, endpoints) and the links.
     */
    @Data
    public static class Store {
        @NotBlank
        private String uri = "mongodb://localhost:27017";

        @NotBlank
        private String database = "linkwatch";

        @Min(1)
        private int maxPoolSize = 20;

        @Min(0)
        private int minPoolSize = 2;

        @NotNull
        private Duration maxConnectionIdleTime = Duration.ofSeconds(60);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration serverSelectionTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Links {
        private boolean publishedDefault = true;

        /**
         * Keep the status transitions of every link.
         */
        private boolean reversionEnabled = true;

        @Min(1)
        private int statusHistorySize = 50;
    }

    @Data
    public static class Topology {
        private boolean updateEnabled = true;

        @Min(1000)
        private long updateIntervalMs = 300_000;

        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int updatePoolSize = 4;

        @Valid
        private List<Source> sources = new ArrayList<>();
    }

    @Data
    public static class Source {
        @NotBlank
        private String id;

        private String name;

        @NotBlank
        private String url;

        private String protocol;
        private String version;
        private String metric;

        private boolean enabled = true;
    }
}
