package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkStatusChange {

    private LinkStatus from;    // null for the first save
    private LinkStatus to;
    private LocalDateTime changedAt;
}
