package com.fieldpilot.lifecycle.automation.gateway;

import com.fieldpilot.lifecycle.automation.ActionException;
import com.fieldpilot.lifecycle.model.Client;
import com.fieldpilot.lifecycle.model.ClientCategory;
import com.fieldpilot.lifecycle.repository.ClientRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaClientCategoryGateway implements ClientCategoryGateway {

    private final ClientRepository clientRepo;

    public JpaClientCategoryGateway(ClientRepository clientRepo) {
        this.clientRepo = clientRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClientCategory> categoryOf(UUID clientId) {
        return clientRepo.findById(clientId).map(Client::getCategory);
    }

    @Override
    @Transactional
    public boolean setCategory(UUID clientId, ClientCategory category) {
        Client client = clientRepo.findById(clientId).orElseThrow(() ->
                new ActionException(ActionException.Kind.NOT_FOUND, "Client " + clientId + " not found"));
        if (client.getCategory() == category) {
            return false;
        }
        client.setCategory(category);
        clientRepo.save(client);
        return true;
    }
}
