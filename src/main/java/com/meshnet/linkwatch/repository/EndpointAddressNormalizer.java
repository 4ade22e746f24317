package com.meshnet.linkwatch.repository;

import com.meshnet.linkwatch.model.AddressKind;
import com.meshnet.linkwatch.model.Endpoint;
import org.springframework.data.mongodb.core.mapping.event.AbstractMongoEventListener;
import org.springframework.data.mongodb.core.mapping.event.BeforeConvertEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores endpoint MAC and IP addresses in the canonical form lookups use, so
 * that {@code fd00:0:0:0:0:0:0:2} and {@code fd00::2} name the same interface.
 */
@Component
public class EndpointAddressNormalizer extends AbstractMongoEventListener<Endpoint> {

    @Override
    public void onBeforeConvert(BeforeConvertEvent<Endpoint> event) {
        normalize(event.getSource());
    }

    public static Endpoint normalize(Endpoint endpoint) {
        endpoint.setMac(AddressKind.canonicalize(endpoint.getMac()));
        if (endpoint.getAddresses() != null) {
            List<String> addresses = endpoint.getAddresses().stream()
                    .map(AddressKind::canonicalize)
                    .distinct()
                    .toList();
            endpoint.setAddresses(new ArrayList<>(addresses));
        }
        return endpoint;
    }
}
