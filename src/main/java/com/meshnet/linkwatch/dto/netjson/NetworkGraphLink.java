package com.meshnet.linkwatch.dto.netjson;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"source", "target", "weight"})
public class NetworkGraphLink {

    private String source;
    private String target;
    private Double weight;
}
