package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.DBRef;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A site of the network (a roof, a tower, a house) holding one or more devices.
 * The point is stored as GeoJSON, so x is the longitude and y the latitude.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "nodes")
public class Node {

    @Id
    private String id;

    @Indexed(unique = true)
    private String slug;

    private String name;

    private GeoJsonPoint point;

    @DBRef
    private Layer layer;
}
