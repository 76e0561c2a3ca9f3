package com.studioledger.billing.service;

/**
 * Lookup into the client records owned by the host application.
 */
public interface ClientDirectory {

    boolean clientExists(Long clientId);

    boolean projectBelongsTo(Long projectId, Long clientId);
}
