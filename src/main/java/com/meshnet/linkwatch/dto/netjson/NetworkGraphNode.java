package com.meshnet.linkwatch.dto.netjson;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkGraphNode {

    private String id;  // IP or MAC address
}
