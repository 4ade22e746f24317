package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.DBRef;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * A network interface of a device installed on a {@link Node}.
 * MAC and IP addresses are stored normalised (lower case, colon separated MAC).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "endpoints")
public class Endpoint {

    @Id
    private String id;

    @Indexed
    private String mac;

    @Indexed
    @Builder.Default
    private List<String> addresses = new ArrayList<>();

    private EndpointType type;

    @DBRef
    private Node node;

    /**
     * Address used to identify this endpoint in exported graphs:
     * the first IP address, or the MAC when the interface has none.
     */
    public String getPrimaryAddress() {
        if (addresses != null && !addresses.isEmpty()) {
            return addresses.get(0);
        }
        return mac;
    }

    /**
     * First address of the given kind, falling back to the primary address
     * when the interface has none of that kind.
     */
    public String getAddress(AddressKind kind) {
        if (kind == null) {
            return getPrimaryAddress();
        }
        if (kind == AddressKind.MAC) {
            return mac != null ? mac : getPrimaryAddress();
        }
        if (addresses != null) {
            for (String address : addresses) {
                if (kind.matches(address)) {
                    return address;
                }
            }
        }
        return getPrimaryAddress();
    }
}
