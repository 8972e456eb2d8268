package com.example.JobCopilot.service;

import com.example.JobCopilot.exception.NotFoundException;
import com.example.JobCopilot.model.ClientSummary;
import com.example.JobCopilot.model.PageResult;
import com.example.JobCopilot.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.example.JobCopilot.util.RequestFields.optional;

@Service
@RequiredArgsConstructor
public class ClientService {

    private final ClientRepository clientRepository;

    public PageResult<ClientSummary> listClients(String tenantId, String search, String city, String state) {
        return PageResult.of(clientRepository.search(tenantId, optional(search), optional(city), optional(state)));
    }

    public ClientSummary getClient(String tenantId, String clientId) {
        return clientRepository.findSummary(tenantId, clientId)
                .orElseThrow(() -> new NotFoundException("Client not found"));
    }
}
