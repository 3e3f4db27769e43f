package org.operaton.fedlink.model.vocab;

import java.net.URI;

/**
 * Anything activities can be delivered to.
 */
public interface Recipient {

    /**
     * @return the identity of the recipient, or null if unknown
     */
    URI getId();

    /**
     * @return the personal inbox, or null if unknown
     */
    URI getInboxId();

    /**
     * @return the server-wide shared inbox, or null if the recipient has none
     */
    URI getSharedInboxId();
}
