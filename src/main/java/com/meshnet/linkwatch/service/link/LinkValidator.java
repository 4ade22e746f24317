package com.meshnet.linkwatch.service.link;

import com.meshnet.linkwatch.exception.LinkValidationException;
import com.meshnet.linkwatch.model.Endpoint;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkType;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Checks run before a link is persisted:
 * <ol>
 *   <li>both endpoints are mandatory, and must differ, unless the link is planned</li>
 *   <li>planned links must name both nodes</li>
 *   <li>only radio links carry dBm and noise</li>
 *   <li>both endpoints must have the same physical type</li>
 * </ol>
 */
@Component
public class LinkValidator {

    public void validate(Link link) {
        if (!link.isPlanned()) {
            if (link.getEndpointA() == null || link.getEndpointB() == null) {
                throw new LinkValidationException(
                        "fields \"endpoint a\" and \"endpoint b\" are mandatory unless the link is planned");
            }
            if (sameEndpoint(link.getEndpointA(), link.getEndpointB())) {
                throw new LinkValidationException("link cannot have the same endpoint on both sides");
            }
        }

        if (link.isPlanned() && (link.getNodeA() == null || link.getNodeB() == null)) {
            throw new LinkValidationException("fields \"node a\" and \"node b\" are mandatory for planned links");
        }

        if (link.getType() != LinkType.RADIO && (link.getDbm() != null || link.getNoise() != null)) {
            throw new LinkValidationException("only links of type RADIO can contain dbm and noise information");
        }

        Endpoint a = link.getEndpointA();
        Endpoint b = link.getEndpointB();
        if (a != null && b != null && a.getType() != b.getType()) {
            throw new LinkValidationException(String.format(
                    "link cannot be between endpoints of different types: endpoint a is %s while b is %s",
                    a.getType(), b.getType()));
        }
    }

    private static boolean sameEndpoint(Endpoint a, Endpoint b) {
        return a == b || (a.getId() != null && Objects.equals(a.getId(), b.getId()));
    }
}
