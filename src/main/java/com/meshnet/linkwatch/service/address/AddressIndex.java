package com.meshnet.linkwatch.service.address;

import com.meshnet.linkwatch.exception.AddressNotFoundException;
import com.meshnet.linkwatch.exception.InvalidAddressException;
import com.meshnet.linkwatch.model.AddressKind;
import com.meshnet.linkwatch.model.Endpoint;
import com.meshnet.linkwatch.model.EndpointPair;
import com.meshnet.linkwatch.repository.EndpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves IPv4, IPv6 and MAC addresses to the endpoint that owns them.
 * Addresses are looked up in canonical form, whatever their spelling.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AddressIndex {

    private final EndpointRepository endpointRepository;

    /**
     * @throws InvalidAddressException  when the string is not an IP or MAC address
     * @throws AddressNotFoundException when no endpoint owns the address
     */
    public Endpoint resolve(String address) {
        return resolve(address, kindOf(address));
    }

    /**
     * Resolves both addresses of an edge. Both must be of the same kind:
     * two IPv4, two IPv6 or two MAC addresses.
     */
    public EndpointPair resolvePair(String addressA, String addressB) {
        AddressKind kindA = kindOf(addressA);
        AddressKind kindB = kindOf(addressB);
        if (kindA != kindB) {
            throw new InvalidAddressException(String.format(
                    "Expecting two addresses of the same kind, got %s (%s) and %s (%s)",
                    addressA, kindA, addressB, kindB));
        }
        return new EndpointPair(resolve(addressA, kindA), resolve(addressB, kindB));
    }

    private Endpoint resolve(String address, AddressKind kind) {
        String normalized = kind.normalize(address);
        log.trace("Resolving {} address {}", kind, normalized);
        return (kind == AddressKind.MAC
                ? endpointRepository.findFirstByMac(normalized)
                : endpointRepository.findFirstByAddressesContaining(normalized))
                .orElseThrow(() -> new AddressNotFoundException(address));
    }

    private static AddressKind kindOf(String address) {
        return AddressKind.classify(address)
                .orElseThrow(() -> new InvalidAddressException(
                        "Expecting valid ipv4, ipv6 or mac address, got: " + address));
    }
}
