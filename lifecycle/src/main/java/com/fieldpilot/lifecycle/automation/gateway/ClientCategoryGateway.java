package com.fieldpilot.lifecycle.automation.gateway;

import com.fieldpilot.lifecycle.model.ClientCategory;

import java.util.Optional;
import java.util.UUID;

/** Boundary to the client module: read and change a client's category. */
public interface ClientCategoryGateway {

    Optional<ClientCategory> categoryOf(UUID clientId);

    /**
     * @return true if the category changed, false if it already had that value
     * @throws com.fieldpilot.lifecycle.automation.ActionException NOT_FOUND for an unknown client
     */
    boolean setCategory(UUID clientId, ClientCategory category);
}
