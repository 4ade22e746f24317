package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display values cached on a link at save time so that listings do not need to
 * load nodes and endpoints. {@code extra} keeps any additional attribute.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LinkData {

    private String nodeAName;
    private String nodeBName;
    private String nodeASlug;
    private String nodeBSlug;
    private String endpointAMac;
    private String endpointBMac;
    private String layerSlug;

    @Builder.Default
    private Map<String, String> extra = new LinkedHashMap<>();

    public LinkData copy() {
        return toBuilder()
                .extra(extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>())
                .build();
    }
}
